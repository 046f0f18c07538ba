package com.example.regreport.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;

import java.util.Collection;

/**
 * Bearer token before authentication, client identity after
 */
public class JwtAuthenticationToken extends AbstractAuthenticationToken {

    private final String token;
    private final String client;

    private JwtAuthenticationToken(String token, String client,
                                   Collection<? extends GrantedAuthority> authorities, boolean authenticated) {
        super(authorities);
        this.token = token;
        this.client = client;
        setAuthenticated(authenticated);
    }

    public static JwtAuthenticationToken unauthenticated(String token) {
        return new JwtAuthenticationToken(token, null, null, false);
    }

    public static JwtAuthenticationToken authenticated(String client, Collection<? extends GrantedAuthority> authorities) {
        return new JwtAuthenticationToken(null, client, authorities, true);
    }

    @Override
    public Object getCredentials() {
        return token;
    }

    @Override
    public Object getPrincipal() {
        return client != null ? client : token;
    }
}
