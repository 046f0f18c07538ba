package com.example.regreport.config;

import com.example.regreport.model.AttributePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the report pipeline, bound from the {@code report.*} keys.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "report")
public class ReportProperties {

    /**
     * Quarters to step back from today when no report date is given.
     */
    private int quarterOffset = 1;

    private AttributePolicy attributePolicy = AttributePolicy.FIRST_WINS;

    /**
     * Literal written into the non-numeric cells of a totals row.
     */
    private String totalLabel = "Total";

    private Source source = new Source();

    private Output output = new Output();

    private Lookup lookup = new Lookup();

    @Getter
    @Setter
    public static class Source {

        /**
         * Directory holding the CSV extracts and mapping files.
         */
        private String directory = "data";
    }

    @Getter
    @Setter
    public static class Output {

        /**
         * Candidate output directories, tried in order.
         */
        private List<String> directories = new ArrayList<>(List.of("out"));

        private String gapFileName = "insert_mapping.xlsx";

        private String reportFilePattern = "report_%s.xlsx";
    }

    @Getter
    @Setter
    public static class Lookup {

        /**
         * Accounts whose acquisition value is reported as zero.
         */
        private List<String> zeroAcquisitionAccounts = new ArrayList<>();

        /**
         * Position names containing any of these fragments get quantity zero.
         */
        private List<String> zeroQuantityNameFragments = new ArrayList<>();

        /**
         * Lot nominal at which the number of lots is quoted per hundred.
         */
        private BigDecimal percentLotNominal = new BigDecimal("100");
    }
}
