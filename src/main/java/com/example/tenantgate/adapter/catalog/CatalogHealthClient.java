package com.example.tenantgate.adapter.catalog;

import com.example.tenantgate.service.TenantPoolManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Catalog Health Check Client
 *
 * Probes the main pool: the database must answer and the tenants table must be readable.
 */
@Slf4j
public class CatalogHealthClient {

  private static final String COUNT_TENANTS_SQL = "SELECT COUNT(*) FROM tenants";

  private final JdbcTemplate jdbcTemplate;

  public CatalogHealthClient(TenantPoolManager tenantPoolManager, int queryTimeoutSeconds) {
    this.jdbcTemplate = new JdbcTemplate(tenantPoolManager.getMainPool());
    this.jdbcTemplate.setQueryTimeout(queryTimeoutSeconds);
  }

  public CatalogHealthResponse checkHealth() {
    long startTime = System.currentTimeMillis();

    try {
      String product = jdbcTemplate.execute((ConnectionCallback<String>) connection ->
          connection.getMetaData().getDatabaseProductName());
      Integer tenants = jdbcTemplate.queryForObject(COUNT_TENANTS_SQL, Integer.class);

      long responseTime = System.currentTimeMillis() - startTime;
      return CatalogHealthResponse.healthy(responseTime,
                                           product != null ? product : "unknown",
                                           tenants != null ? tenants : 0);
    } catch (DataAccessException e) {
      log.error("Catalog health check failed", e);
      return CatalogHealthResponse.unhealthy(e.getMostSpecificCause().getMessage());
    }
  }
}
