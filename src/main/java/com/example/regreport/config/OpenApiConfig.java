package com.example.regreport.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * API documentation for report runs and mapping imports
 */
@Configuration
public class OpenApiConfig {

    private static final String BEARER_SCHEME = "bearerAuth";

    @Bean
    public OpenAPI reportServiceOpenAPI(@Value("${server.port:8080}") int port,
                                        @Value("${spring.application.name:regulatory-report-service}") String applicationName) {
        return new OpenAPI()
                .servers(List.of(new Server().url("http://localhost:" + port).description("Local")))
                .info(new Info()
                        .title(applicationName)
                        .version("1.0.0")
                        .description("Builds the quarterly investment report from ledger, holdings and position extracts. "
                                + "A run with unmapped keys produces the gap workbook insert_mapping.xlsx instead of the report; "
                                + "fill it in and post it to /mappings/import before rerunning.\n\n"
                                + "Runs need REPORTER, ADMIN or SERVICE; mapping imports need ADMIN."))
                .tags(List.of(
                        new Tag().name("runs").description("Report runs and their outcomes"),
                        new Tag().name("mappings").description("Mapping table maintenance")))
                .components(new Components()
                        .addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
    }
}
