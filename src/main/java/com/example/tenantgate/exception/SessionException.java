package com.example.tenantgate.exception;

/**
 * Base class for login session failures against a tenant database. Only the concrete subclasses
 * are thrown; the error handler maps each to its own status.
 */
public abstract class SessionException extends RuntimeException {

  protected SessionException(String message) {
    super(message);
  }

  protected SessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
