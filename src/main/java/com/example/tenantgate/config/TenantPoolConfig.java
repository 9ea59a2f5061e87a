package com.example.tenantgate.config;

import com.example.tenantgate.adapter.catalog.CatalogHealthClient;
import com.example.tenantgate.adapter.catalog.JdbcTenantCatalog;
import com.example.tenantgate.adapter.catalog.TenantCatalog;
import com.example.tenantgate.adapter.datasource.HikariTenantDataSourceFactory;
import com.example.tenantgate.adapter.datasource.TenantDataSourceFactory;
import com.example.tenantgate.properties.ApplicationProperties;
import com.example.tenantgate.service.SessionValidator;
import com.example.tenantgate.service.TenantPoolManager;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Wires the catalog pool and the tenant pool registry.
 *
 * <p>The catalog pool is opened eagerly: if the catalog database is unreachable the application
 * context fails to start instead of failing on the first request.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class TenantPoolConfig {

  private static final String MAIN_POOL_NAME = "catalog";

  @Bean
  @Primary
  public HikariDataSource mainPool(ApplicationProperties properties) {
    ApplicationProperties.CatalogProperties catalog = properties.catalog();

    HikariConfig config = new HikariConfig();
    config.setPoolName(MAIN_POOL_NAME);
    config.setJdbcUrl(catalog.url());
    config.setUsername(catalog.username());
    config.setPassword(catalog.password());
    config.setMaximumPoolSize(catalog.maximumPoolSize());
    config.setConnectionTimeout(catalog.connectionTimeout().toMillis());
    config.setInitializationFailTimeout(catalog.connectionTimeout().toMillis());

    log.info("Opening catalog pool at {}", catalog.url());
    return new HikariDataSource(config);
  }

  @Bean
  public TenantCatalog tenantCatalog(DataSource mainPool, ApplicationProperties properties) {
    return new JdbcTenantCatalog(mainPool, queryTimeoutSeconds(properties));
  }

  @Bean
  public TenantDataSourceFactory tenantDataSourceFactory(ApplicationProperties properties) {
    return new HikariTenantDataSourceFactory(properties.tenantPool());
  }

  @Bean
  public TenantPoolManager tenantPoolManager(DataSource mainPool,
                                             TenantCatalog tenantCatalog,
                                             TenantDataSourceFactory tenantDataSourceFactory) {
    return new TenantPoolManager(mainPool, tenantCatalog, tenantDataSourceFactory);
  }

  @Bean
  public CatalogHealthClient catalogHealthClient(TenantPoolManager tenantPoolManager,
                                                 ApplicationProperties properties) {
    return new CatalogHealthClient(tenantPoolManager, queryTimeoutSeconds(properties));
  }

  @Bean
  public SessionValidator sessionValidator(ApplicationProperties properties) {
    return new SessionValidator(properties.tenantPool().queryTimeout());
  }

  // JDBC query timeouts have whole-second resolution
  private static int queryTimeoutSeconds(ApplicationProperties properties) {
    return (int) Math.max(1, properties.tenantPool().queryTimeout().toSeconds());
  }
}
