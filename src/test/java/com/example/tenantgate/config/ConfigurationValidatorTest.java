package com.example.tenantgate.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.tenantgate.properties.ApplicationProperties;
import com.example.tenantgate.properties.ApplicationProperties.AuthProperties;
import com.example.tenantgate.properties.ApplicationProperties.CatalogProperties;
import com.example.tenantgate.properties.ApplicationProperties.TenantPoolProperties;
import com.example.tenantgate.properties.ApplicationProperties.TokenProperties;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConfigurationValidator")
class ConfigurationValidatorTest {

  private static final TokenProperties TOKEN =
      new TokenProperties("0123456789abcdef0123456789abcdef", null, Duration.ofDays(7));
  private static final AuthProperties AUTH = new AuthProperties(List.of("/health", "/api/auth/login"));
  private static final CatalogProperties CATALOG = new CatalogProperties(
      "jdbc:postgresql://localhost:5432/catalog", "postgres", "postgres", 10, Duration.ofSeconds(5));
  private static final TenantPoolProperties TENANT_POOL = new TenantPoolProperties(
      5, 1, Duration.ofSeconds(5), Duration.ofMinutes(10), Duration.ofSeconds(5), List.of("acme"));

  @Test
  @DisplayName("accepts a consistent configuration")
  void valid() {
    var validator = new ConfigurationValidator(
        new ApplicationProperties(TOKEN, AUTH, CATALOG, TENANT_POOL));

    assertThatCode(validator::afterPropertiesSet).doesNotThrowAnyException();
  }

  @Test
  @DisplayName("reports every broken rule at once")
  void collectsAllErrors() {
    var properties = new ApplicationProperties(
        new TokenProperties(null, null, Duration.ZERO),
        new AuthProperties(List.of("health")),
        new CatalogProperties("postgres://localhost/catalog", null, null, 10, Duration.ofSeconds(5)),
        new TenantPoolProperties(2, 5, Duration.ofSeconds(5), Duration.ofMinutes(10),
                                 Duration.ofSeconds(5), List.of()));

    assertThatThrownBy(() -> new ConfigurationValidator(properties).afterPropertiesSet())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("5 error(s)")
        .hasMessageContaining("token secret")
        .hasMessageContaining("Bypass prefix")
        .hasMessageContaining("JDBC URL")
        .hasMessageContaining("minimum idle");
  }
}
