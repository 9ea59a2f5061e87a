package com.example.tenantgate.service;

import com.example.tenantgate.exception.DatabaseTimeoutException;
import com.example.tenantgate.exception.InvalidCredentialsException;
import com.example.tenantgate.exception.SessionLookupException;
import com.example.tenantgate.exception.SessionNotFoundException;
import com.example.tenantgate.util.JdbcTimeouts;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.util.StringUtils;

/**
 * Writes the server-side half of a token: the login session stored on the user row.
 *
 * <p>Starting a session stores a fresh random value and issues a token bound to it. Ending a
 * session stores an empty value, which no token can match.
 */
@Slf4j
public class LoginSessionService {

  private static final String FIND_CREDENTIALS_SQL =
      "SELECT username, password, active FROM users WHERE username = ? OR email = ?";
  private static final String UPDATE_LOGIN_SESSION_SQL =
      "UPDATE users SET login_session = ? WHERE username = ?";
  private static final String NO_SESSION = "";
  private static final String LOGIN_FAILED = "Invalid username or password";

  private final TokenCodec tokenCodec;
  private final PasswordEncoder passwordEncoder;
  private final int queryTimeoutSeconds;

  public LoginSessionService(TokenCodec tokenCodec,
                             PasswordEncoder passwordEncoder,
                             Duration queryTimeout) {
    this.tokenCodec = tokenCodec;
    this.passwordEncoder = passwordEncoder;
    this.queryTimeoutSeconds = (int) Math.max(1, queryTimeout.toSeconds());
  }

  /**
   * Verifies the password of an active user, found by username or email, and starts a session.
   *
   * @throws InvalidCredentialsException for an unknown or inactive user or a wrong password
   */
  public String login(String tenantId, String usernameOrEmail, String password, DataSource pool) {
    List<StoredCredentials> rows = execute(tenantId, usernameOrEmail, () -> template(pool).query(
        FIND_CREDENTIALS_SQL,
        (rs, rowNum) -> new StoredCredentials(
            rs.getString("username"),
            rs.getString("password"),
            rs.getBoolean("active")),
        usernameOrEmail, usernameOrEmail));

    StoredCredentials user = rows.stream()
        .filter(StoredCredentials::active)
        .filter(candidate -> StringUtils.hasText(candidate.passwordHash()))
        .filter(candidate -> passwordEncoder.matches(password, candidate.passwordHash()))
        .findFirst()
        .orElseThrow(() -> {
          log.warn("Login failed for tenant {} user {}", tenantId, usernameOrEmail);
          return new InvalidCredentialsException(LOGIN_FAILED);
        });

    return startSession(tenantId, user.username(), pool);
  }

  /**
   * Records a new login session for the user and returns a token carrying it.
   *
   * @throws SessionNotFoundException if the tenant has no such user
   */
  public String startSession(String tenantId, String username, DataSource pool) {
    String loginSession = UUID.randomUUID().toString();
    int updated = update(pool, tenantId, username, loginSession);
    if (updated == 0) {
      throw new SessionNotFoundException("User not found");
    }
    log.info("Login session started for tenant {} user {}", tenantId, username);
    return tokenCodec.issue(username, loginSession, tenantId);
  }

  /**
   * Clears the user's login session, invalidating all of the user's outstanding tokens.
   */
  public void endSession(String tenantId, String username, DataSource pool) {
    int updated = update(pool, tenantId, username, NO_SESSION);
    if (updated == 0) {
      log.debug("Logout for unknown user {} in tenant {}", username, tenantId);
      return;
    }
    log.info("Login session ended for tenant {} user {}", tenantId, username);
  }

  private int update(DataSource pool, String tenantId, String username, String loginSession) {
    return execute(tenantId, username, () -> template(pool)
        .update(UPDATE_LOGIN_SESSION_SQL, loginSession, username));
  }

  private JdbcTemplate template(DataSource pool) {
    JdbcTemplate jdbcTemplate = new JdbcTemplate(pool);
    jdbcTemplate.setQueryTimeout(queryTimeoutSeconds);
    return jdbcTemplate;
  }

  private <T> T execute(String tenantId, String username, Supplier<T> statement) {
    try {
      return statement.get();
    } catch (DataAccessException e) {
      if (JdbcTimeouts.isTimeout(e)) {
        log.error("Login session statement timed out for tenant {} user {}", tenantId, username, e);
        throw new DatabaseTimeoutException("Login session statement timed out", e);
      }
      log.error("Login session statement failed for tenant {} user {}", tenantId, username, e);
      throw new SessionLookupException("Login session statement failed", e);
    }
  }

  private record StoredCredentials(String username, String passwordHash, boolean active) {}
}
