package com.example.tenantgate.config;

import com.example.tenantgate.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration validator that enforces business rules and constraints
 * beyond basic JSR-303 validation. Fails startup with every problem listed at once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_MUST_BE_POSITIVE = "%s must be positive.";
  private static final String PATH_PREFIX_SLASH = "/";
  private static final String JDBC_PREFIX = "jdbc:";

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = new ArrayList<>();

    validateTokenConfig(errors);
    validateAuthConfig(errors);
    validateCatalogConfig(errors);
    validateTenantPoolConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validateTokenConfig(List<String> errors) {
    ApplicationProperties.TokenProperties token = properties.token();
    if (!StringUtils.hasText(token.secret()) && !StringUtils.hasText(token.secretFile())) {
      errors.add("A token secret is required: set 'app.token.secret' or 'app.token.secret-file'.");
    }
    if (token.maxAge().isZero() || token.maxAge().isNegative()) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Token max age"));
    }
  }

  private void validateAuthConfig(List<String> errors) {
    for (String prefix : properties.auth().bypassPrefixes()) {
      if (!StringUtils.hasText(prefix) || !prefix.startsWith(PATH_PREFIX_SLASH)) {
        errors.add("Bypass prefix must start with a '/': " + prefix);
      }
    }
  }

  private void validateCatalogConfig(List<String> errors) {
    String url = properties.catalog().url();
    if (StringUtils.hasText(url) && !url.startsWith(JDBC_PREFIX)) {
      errors.add("Catalog URL must be a JDBC URL: " + url);
    }
    if (properties.catalog().connectionTimeout().isNegative()) {
      errors.add("Catalog connection timeout cannot be negative.");
    }
  }

  private void validateTenantPoolConfig(List<String> errors) {
    ApplicationProperties.TenantPoolProperties pool = properties.tenantPool();
    if (pool.minimumIdle() > pool.maximumPoolSize()) {
      errors.add("Tenant pool minimum idle (%d) must not exceed maximum pool size (%d)"
                     .formatted(pool.minimumIdle(), pool.maximumPoolSize()));
    }
    if (pool.queryTimeout().isZero() || pool.queryTimeout().isNegative()) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted("Tenant query timeout"));
    }
    for (String tenantId : pool.preloadTenants()) {
      if (!StringUtils.hasText(tenantId)) {
        errors.add("Preloaded tenant ids must not be blank.");
      }
    }
  }
}
