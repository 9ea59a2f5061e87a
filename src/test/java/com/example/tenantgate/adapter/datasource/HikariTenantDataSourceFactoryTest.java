package com.example.tenantgate.adapter.datasource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.tenantgate.H2Databases;
import com.example.tenantgate.exception.PoolConstructionException;
import com.example.tenantgate.properties.ApplicationProperties.TenantPoolProperties;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

@DisplayName("HikariTenantDataSourceFactory")
class HikariTenantDataSourceFactoryTest {

  private final HikariTenantDataSourceFactory factory = new HikariTenantDataSourceFactory(
      new TenantPoolProperties(3, 1, Duration.ofSeconds(2), Duration.ofMinutes(1),
                               Duration.ofSeconds(2), List.of()));

  @Test
  @DisplayName("builds a named, sized pool that can run queries")
  void buildsPool() {
    String url = H2Databases.uniqueUrl("acme");
    H2Databases.tenantDatabase(url);

    DataSource pool = factory.create("acme", url);

    try (HikariDataSource hikari = (HikariDataSource) pool) {
      assertThat(hikari.getPoolName()).isEqualTo("tenant-acme");
      assertThat(hikari.getMaximumPoolSize()).isEqualTo(3);
      assertThat(new JdbcTemplate(pool).queryForObject("SELECT COUNT(*) FROM users", Integer.class))
          .isZero();
    }
  }

  @Test
  @DisplayName("an unparsable catalog URL is a construction failure")
  void invalidUrl() {
    assertThatThrownBy(() -> factory.create("acme", "mysql://db.internal/acme"))
        .isInstanceOf(PoolConstructionException.class)
        .hasMessageContaining("acme");
  }

  @Test
  @DisplayName("a database without a driver is a construction failure")
  void unreachableDatabase() {
    assertThatThrownBy(() -> factory.create("acme", "jdbc:nosuchdriver://db.internal/acme"))
        .isInstanceOf(PoolConstructionException.class);
  }
}
