package com.example.tenantgate.config;

import com.example.tenantgate.properties.ApplicationProperties;
import com.example.tenantgate.security.AuthenticationGate;
import com.example.tenantgate.security.filter.TenantAuthenticationFilter;
import com.example.tenantgate.service.SessionValidator;
import com.example.tenantgate.service.TenantPoolManager;
import com.example.tenantgate.service.TokenCodec;
import com.example.tenantgate.web.rest.errors.DelegatedAuthenticationEntryPoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import java.time.Duration;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

/**
 * Stateless security configuration.
 * <p>
 * A single chain runs every request through the {@link TenantAuthenticationFilter}. The gate owns
 * the bypass list and the 401 decision, so the chain itself permits whatever the gate lets
 * through.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@SecurityScheme(name = "bearerAuth", type = SecuritySchemeType.HTTP, scheme = "bearer",
    bearerFormat = "JWT")
public class SecurityConfig {

  @Bean
  public AuthenticationGate authenticationGate(TokenCodec tokenCodec,
                                               TenantPoolManager tenantPoolManager,
                                               SessionValidator sessionValidator,
                                               ApplicationProperties properties) {
    return new AuthenticationGate(tokenCodec, tenantPoolManager, sessionValidator,
                                  properties.auth().bypassPrefixes());
  }

  @Bean
  public TenantAuthenticationFilter tenantAuthenticationFilter(AuthenticationGate authenticationGate,
                                                               ObjectMapper objectMapper) {
    return new TenantAuthenticationFilter(authenticationGate, objectMapper);
  }

  // Runs inside the security chain only; keep the servlet container from registering it again
  @Bean
  public FilterRegistrationBean<TenantAuthenticationFilter> tenantAuthenticationFilterRegistration(
      TenantAuthenticationFilter tenantAuthenticationFilter) {
    FilterRegistrationBean<TenantAuthenticationFilter> registration =
        new FilterRegistrationBean<>(tenantAuthenticationFilter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  public SecurityFilterChain tenantFilterChain(HttpSecurity http,
                                               TenantAuthenticationFilter tenantAuthenticationFilter,
                                               DelegatedAuthenticationEntryPoint entryPoint)
      throws Exception {
    http
        .addFilterBefore(tenantAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll())
        // JSON envelope instead of Spring's default HTML for anything Spring Security rejects
        .exceptionHandling(exceptions -> exceptions.authenticationEntryPoint(entryPoint))
        // Bearer tokens only, no cookies to protect
        .csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                          )
        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .contentTypeOptions(contentType -> {
                     })
                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN)
                                    )
                     .httpStrictTransportSecurity(hsts -> hsts
                                                      .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                                      .includeSubDomains(true)
                                                 )
                     .addHeaderWriter((request, response) -> {
                       // Responses carry tenant data; never cache them
                       response.setHeader("Cache-Control",
                                          "no-cache, no-store, must-revalidate");
                       response.setHeader("Pragma",
                                          "no-cache");
                     })
                );
    return http.build();
  }
}
