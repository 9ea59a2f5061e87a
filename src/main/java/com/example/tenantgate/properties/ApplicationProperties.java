package com.example.tenantgate.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Centralized configuration properties for the Tenant Gateway application.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid TokenProperties token,
    @NotNull @Valid AuthProperties auth,
    @NotNull @Valid CatalogProperties catalog,
    @NotNull @Valid TenantPoolProperties tenantPool
) {

  /**
   * Signed token configuration. The secret normally arrives through the APP_TOKEN_SECRET
   * environment variable; the key file is the fallback.
   */
  public record TokenProperties(
      String secret,
      String secretFile,
      @DefaultValue("7d") @DurationUnit(ChronoUnit.SECONDS) Duration maxAge
  ) {}

  /**
   * Authentication gate configuration
   */
  public record AuthProperties(
      @DefaultValue({"/api/auth/signup", "/api/auth/login", "/api/ping", "/health", "/api-doc"})
      List<String> bypassPrefixes
  ) {}

  /**
   * Main catalog database holding the tenants table
   */
  public record CatalogProperties(
      @NotBlank String url,
      String username,
      String password,
      @DefaultValue("10") @Positive int maximumPoolSize,
      @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration connectionTimeout
  ) {}

  /**
   * Settings applied to every lazily created tenant pool
   */
  public record TenantPoolProperties(
      @DefaultValue("5") @Positive int maximumPoolSize,
      @DefaultValue("1") @Min(0) int minimumIdle,
      @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration connectionTimeout,
      @DefaultValue("10m") @DurationUnit(ChronoUnit.MINUTES) Duration idleTimeout,
      @DefaultValue("5s") @DurationUnit(ChronoUnit.SECONDS) Duration queryTimeout,
      @DefaultValue({}) List<String> preloadTenants
  ) {}
}
