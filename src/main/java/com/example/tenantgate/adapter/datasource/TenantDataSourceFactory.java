package com.example.tenantgate.adapter.datasource;

import javax.sql.DataSource;

/**
 * Builds the connection pool for one tenant database.
 */
@FunctionalInterface
public interface TenantDataSourceFactory {

  /**
   * Creates a new, independent pool for the given catalog URL.
   *
   * @throws com.example.tenantgate.exception.PoolConstructionException if the pool cannot be built
   */
  DataSource create(String tenantId, String dbUrl);
}
