package com.example.tenantgate.adapter.datasource;

import com.example.tenantgate.exception.PoolConstructionException;
import com.example.tenantgate.properties.ApplicationProperties.TenantPoolProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HikariCP backed tenant pools. Each pool opens a first connection eagerly so an unreachable
 * database is reported at construction rather than on first use.
 */
@Slf4j
@RequiredArgsConstructor
public class HikariTenantDataSourceFactory implements TenantDataSourceFactory {

  private static final String POOL_NAME_PREFIX = "tenant-";

  private final TenantPoolProperties properties;

  @Override
  public DataSource create(String tenantId, String dbUrl) {
    TenantDatabaseUrl url;
    try {
      url = TenantDatabaseUrl.parse(dbUrl);
    } catch (IllegalArgumentException e) {
      throw new PoolConstructionException("Invalid database URL for tenant " + tenantId, e);
    }

    HikariConfig config = new HikariConfig();
    config.setPoolName(POOL_NAME_PREFIX + tenantId);
    config.setJdbcUrl(url.jdbcUrl());
    if (url.username() != null) {
      config.setUsername(url.username());
    }
    if (url.password() != null) {
      config.setPassword(url.password());
    }
    config.setMaximumPoolSize(properties.maximumPoolSize());
    config.setMinimumIdle(Math.min(properties.minimumIdle(), properties.maximumPoolSize()));
    config.setConnectionTimeout(properties.connectionTimeout().toMillis());
    config.setIdleTimeout(properties.idleTimeout().toMillis());

    try {
      HikariDataSource dataSource = new HikariDataSource(config);
      log.info("Created connection pool {} for {}", config.getPoolName(), url.jdbcUrl());
      return dataSource;
    } catch (RuntimeException e) {
      log.error("Failed to create connection pool for tenant {}", tenantId, e);
      throw new PoolConstructionException("Could not create pool for tenant " + tenantId, e);
    }
  }
}
