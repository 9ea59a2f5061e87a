package com.example.tenantgate.exception;

/**
 * Connection acquisition or a query ran past its configured bound.
 * Kept apart from token failures so infrastructure trouble never reads as a bad credential.
 */
public class DatabaseTimeoutException extends RuntimeException {
  public DatabaseTimeoutException(String message) {
    super(message);
  }

  public DatabaseTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
