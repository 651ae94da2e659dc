package com.z254.lazarus.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;

/**
 * Security configuration for LAZARUS.
 * <p>
 * Configures:
 * <ul>
 *     <li>Actuator endpoints (open for health checks and Prometheus scraping)</li>
 *     <li>API documentation endpoints (open)</li>
 *     <li>Sandbox chaos endpoints (open)</li>
 * </ul>
 */
@Configuration
@EnableWebFluxSecurity
public class SecurityConfig {

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .authorizeExchange(exchanges -> exchanges
                        .pathMatchers("/actuator/**").permitAll()
                        .pathMatchers("/swagger-ui/**", "/swagger-ui.html", "/v3/api-docs/**", "/api-docs/**").permitAll()
                        .pathMatchers("/api/v1/chaos/**").permitAll()
                        // operator endpoints sit behind the platform gateway
                        .anyExchange().permitAll()
                )
                .build();
    }
}
