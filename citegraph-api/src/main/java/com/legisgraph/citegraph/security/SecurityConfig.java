package com.legisgraph.citegraph.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.oauth2.server.resource.web.server.authentication.ServerBearerTokenAuthenticationConverter;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.authentication.AuthenticationWebFilter;
import org.springframework.security.web.server.context.NoOpServerSecurityContextRepository;
import org.springframework.security.web.server.util.matcher.ServerWebExchangeMatchers;

/**
 * Read endpoints under {@code /api} and actuator are open; {@code /admin/**} writes to the
 * graph and needs the configured admin bearer token.
 */
@Configuration
@EnableWebFluxSecurity
@EnableConfigurationProperties(AdminSecurityProperties.class)
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);
    private static final String ADMIN_PATHS = "/admin/**";

    private final AdminSecurityProperties securityProperties;

    public SecurityConfig(AdminSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        ServerHttpSecurity security = http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .securityContextRepository(NoOpServerSecurityContextRepository.getInstance());

        if (!securityProperties.hasAdminToken()) {
            log.warn("citegraph.security.admin-token is not set; {} endpoints are disabled", ADMIN_PATHS);
            return security
                    .authorizeExchange(registry -> registry
                            .pathMatchers(ADMIN_PATHS).denyAll()
                            .anyExchange().permitAll())
                    .build();
        }

        return security
                .addFilterAt(adminTokenAuthenticationFilter(), SecurityWebFiltersOrder.AUTHENTICATION)
                .authorizeExchange(registry -> registry
                        .pathMatchers(ADMIN_PATHS).hasRole("ADMIN")
                        .anyExchange().permitAll())
                .build();
    }

    private AuthenticationWebFilter adminTokenAuthenticationFilter() {
        AuthenticationWebFilter filter = new AuthenticationWebFilter(
                new AdminTokenAuthenticationManager(securityProperties.getAdminToken()));
        filter.setServerAuthenticationConverter(new ServerBearerTokenAuthenticationConverter());
        filter.setRequiresAuthenticationMatcher(ServerWebExchangeMatchers.pathMatchers(ADMIN_PATHS));
        filter.setSecurityContextRepository(NoOpServerSecurityContextRepository.getInstance());
        return filter;
    }
}
