package com.legisgraph.citegraph.security;

import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthenticationToken;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Accepts exactly one bearer token and grants {@code ROLE_ADMIN} to its holder.
 */
public class AdminTokenAuthenticationManager implements ReactiveAuthenticationManager {

    static final String ADMIN_PRINCIPAL = "citegraph-admin";

    private final byte[] expectedToken;

    public AdminTokenAuthenticationManager(String expectedToken) {
        if (expectedToken == null || expectedToken.isBlank()) {
            throw new IllegalArgumentException("Admin token must not be blank");
        }
        this.expectedToken = expectedToken.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        if (!(authentication instanceof BearerTokenAuthenticationToken bearer)) {
            return Mono.error(new BadCredentialsException("Unsupported authentication token"));
        }
        String token = bearer.getToken();
        if (token == null || !MessageDigest.isEqual(expectedToken, token.getBytes(StandardCharsets.UTF_8))) {
            return Mono.error(new BadCredentialsException("Invalid admin token"));
        }
        return Mono.just(new UsernamePasswordAuthenticationToken(
                ADMIN_PRINCIPAL,
                null,
                AuthorityUtils.createAuthorityList("ROLE_ADMIN")));
    }
}
