package com.example.tenantgate.util;

import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import lombok.experimental.UtilityClass;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;

/**
 * Recognises data access failures caused by a connection or query timeout.
 */
@UtilityClass
public class JdbcTimeouts {

  /**
   * HikariCP reports an exhausted connectionTimeout as SQLTransientConnectionException,
   * drivers report an elapsed query timeout as SQLTimeoutException.
   */
  public static boolean isTimeout(DataAccessException e) {
    if (e instanceof QueryTimeoutException) {
      return true;
    }
    for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
      if (cause instanceof SQLTransientConnectionException || cause instanceof SQLTimeoutException) {
        return true;
      }
    }
    return false;
  }
}
