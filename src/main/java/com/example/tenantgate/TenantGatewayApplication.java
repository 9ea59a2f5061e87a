package com.example.tenantgate;

import com.example.tenantgate.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Tenant Gateway Application
 *
 * Multi-tenant API gateway with:
 * - One connection pool per tenant database, resolved through the tenants catalog
 * - Signed bearer tokens bound to a server-side login session
 * - Session revocation checked on every authenticated request
 */
// Bearer tokens only; no in-memory user store
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@EnableConfigurationProperties(ApplicationProperties.class)
public class TenantGatewayApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(TenantGatewayApplication.class);

    // Tenant pools must be ready before the first request
    app.setLazyInitialization(false);
    // Closes tenant pools on shutdown
    app.setRegisterShutdownHook(true);

    app.run(args);
  }
}
