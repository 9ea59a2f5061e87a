package com.example.tenantgate.adapter.catalog;

import com.example.tenantgate.domain.entity.TenantRecord;
import com.example.tenantgate.exception.DatabaseTimeoutException;
import com.example.tenantgate.util.JdbcTimeouts;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * Catalog lookups against the tenants table of the main pool.
 */
@Slf4j
public class JdbcTenantCatalog implements TenantCatalog {

  private static final String FIND_BY_ID_SQL = "SELECT id, name, db_url FROM tenants WHERE id = ?";

  private static final RowMapper<TenantRecord> TENANT_ROW_MAPPER = (rs, rowNum) -> new TenantRecord(
      rs.getString("id"),
      rs.getString("name"),
      rs.getString("db_url"));

  private final JdbcTemplate jdbcTemplate;

  public JdbcTenantCatalog(DataSource mainPool, int queryTimeoutSeconds) {
    this.jdbcTemplate = new JdbcTemplate(mainPool);
    this.jdbcTemplate.setQueryTimeout(queryTimeoutSeconds);
  }

  @Override
  public Optional<TenantRecord> findById(String tenantId) {
    try {
      List<TenantRecord> rows = jdbcTemplate.query(FIND_BY_ID_SQL, TENANT_ROW_MAPPER, tenantId);
      log.debug("Catalog lookup for tenant {} returned {} row(s)", tenantId, rows.size());
      return rows.stream().findFirst();
    } catch (DataAccessException e) {
      if (JdbcTimeouts.isTimeout(e)) {
        throw new DatabaseTimeoutException("Catalog lookup timed out for tenant " + tenantId, e);
      }
      throw e;
    }
  }
}
