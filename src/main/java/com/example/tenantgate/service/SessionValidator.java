package com.example.tenantgate.service;

import com.example.tenantgate.domain.entity.Claims;
import com.example.tenantgate.domain.entity.SessionInfo;
import com.example.tenantgate.exception.DatabaseTimeoutException;
import com.example.tenantgate.exception.SessionLookupException;
import com.example.tenantgate.exception.SessionNotFoundException;
import com.example.tenantgate.util.JdbcTimeouts;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.util.StringUtils;

/**
 * Confirms that a token's user and login session still match a row in the tenant database.
 *
 * <p>Runs one query per call with no caching, so clearing a user's login session revokes every
 * outstanding token for that user on the very next request.
 */
@Slf4j
public class SessionValidator {

  private static final String SESSION_EXISTS_SQL =
      "SELECT COUNT(*) FROM users WHERE username = ? AND login_session = ?";
  private static final String SESSION_INFO_SQL =
      "SELECT username, login_session FROM users WHERE username = ? AND login_session = ?";

  private final int queryTimeoutSeconds;

  public SessionValidator(Duration queryTimeout) {
    this.queryTimeoutSeconds = (int) Math.max(1, queryTimeout.toSeconds());
  }

  /**
   * @return {@code true} when exactly the user's current login session is presented
   * @throws DatabaseTimeoutException when the connection or the query times out
   * @throws SessionLookupException for any other data access failure
   */
  public boolean isValidSession(Claims claims, DataSource pool) {
    if (!StringUtils.hasText(claims.loginSession())) {
      return false;
    }
    Integer matches = execute(claims, () -> template(pool).queryForObject(
        SESSION_EXISTS_SQL, Integer.class, claims.user(), claims.loginSession()));
    return matches != null && matches > 0;
  }

  /**
   * Same lookup as {@link #isValidSession}, returning the matching row.
   *
   * @throws SessionNotFoundException when no row matches
   */
  public SessionInfo findSessionInfo(Claims claims, DataSource pool) {
    if (!StringUtils.hasText(claims.loginSession())) {
      throw new SessionNotFoundException("User not found");
    }
    List<SessionInfo> rows = execute(claims, () -> template(pool).query(
        SESSION_INFO_SQL,
        (rs, rowNum) -> new SessionInfo(
            rs.getString("username"),
            rs.getString("login_session"),
            claims.tenantId()),
        claims.user(), claims.loginSession()));
    return rows.stream()
        .findFirst()
        .orElseThrow(() -> new SessionNotFoundException("User not found"));
  }

  private JdbcTemplate template(DataSource pool) {
    JdbcTemplate jdbcTemplate = new JdbcTemplate(pool);
    jdbcTemplate.setQueryTimeout(queryTimeoutSeconds);
    return jdbcTemplate;
  }

  private <T> T execute(Claims claims, Supplier<T> query) {
    try {
      return query.get();
    } catch (DataAccessException e) {
      if (JdbcTimeouts.isTimeout(e)) {
        log.error("Session query timed out for tenant {} user {}", claims.tenantId(), claims.user(), e);
        throw new DatabaseTimeoutException("Session query timed out", e);
      }
      log.error("Session query failed for tenant {} user {}", claims.tenantId(), claims.user(), e);
      throw new SessionLookupException("Session query failed", e);
    }
  }
}
