package com.example.regreport.security;

import io.jsonwebtoken.Claims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Validates bearer tokens; authorities come from the roles claim, ROLE_SERVICE when it is absent
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationManager implements ReactiveAuthenticationManager {

    static final String DEFAULT_ROLE = "ROLE_SERVICE";

    private final JwtUtil jwtUtil;

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        return Mono.justOrEmpty(authentication)
                .cast(JwtAuthenticationToken.class)
                .flatMap(auth -> {
                    String token = (String) auth.getCredentials();
                    try {
                        Claims claims = jwtUtil.parseClaims(token);
                        JwtAuthenticationToken authenticated =
                                JwtAuthenticationToken.authenticated(claims.getSubject(), authorities(claims));

                        log.debug("Authenticated client: {}", claims.getSubject());
                        return Mono.just((Authentication) authenticated);
                    } catch (RuntimeException e) {
                        log.warn("Failed to authenticate JWT: {}", e.getMessage());
                        return Mono.error(new BadCredentialsException("Invalid bearer token", e));
                    }
                });
    }

    private List<GrantedAuthority> authorities(Claims claims) {
        List<String> roles = jwtUtil.extractRoles(claims);
        if (roles.isEmpty()) {
            return List.of(new SimpleGrantedAuthority(DEFAULT_ROLE));
        }
        return roles.stream()
                .map(role -> role.startsWith("ROLE_") ? role : "ROLE_" + role)
                .map(role -> (GrantedAuthority) new SimpleGrantedAuthority(role))
                .toList();
    }
}
