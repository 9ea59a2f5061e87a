package com.example.tenantgate.adapter.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.tenantgate.H2Databases;
import com.example.tenantgate.domain.entity.TenantRecord;
import com.example.tenantgate.exception.DatabaseTimeoutException;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

@DisplayName("JdbcTenantCatalog")
class JdbcTenantCatalogTest {

  private DataSource catalogDb;
  private JdbcTenantCatalog catalog;

  @BeforeEach
  void setUp() {
    catalogDb = H2Databases.catalogDatabase(H2Databases.uniqueUrl("catalog"));
    H2Databases.insertTenant(catalogDb, "acme", "postgres://app:pw@db.internal/acme");
    catalog = new JdbcTenantCatalog(catalogDb, 2);
  }

  @Test
  @DisplayName("finds a tenant row by id")
  void findsTenant() {
    assertThat(catalog.findById("acme"))
        .contains(new TenantRecord("acme", "ACME", "postgres://app:pw@db.internal/acme"));
  }

  @Test
  @DisplayName("unknown tenant is empty")
  void unknownTenant() {
    assertThat(catalog.findById("initech")).isEmpty();
  }

  @Test
  @DisplayName("an exhausted catalog pool is reported as a timeout")
  void timeout() throws Exception {
    DataSource exhausted = mock(DataSource.class);
    when(exhausted.getConnection()).thenThrow(new SQLTransientConnectionException("timeout"));

    assertThatThrownBy(() -> new JdbcTenantCatalog(exhausted, 2).findById("acme"))
        .isInstanceOf(DatabaseTimeoutException.class);
  }

  @Test
  @DisplayName("other catalog failures propagate as data access exceptions")
  void otherFailure() throws Exception {
    DataSource broken = mock(DataSource.class);
    when(broken.getConnection()).thenThrow(new SQLException("refused"));

    assertThatThrownBy(() -> new JdbcTenantCatalog(broken, 2).findById("acme"))
        .isInstanceOf(DataAccessException.class);
  }
}
