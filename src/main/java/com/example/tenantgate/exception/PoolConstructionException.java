package com.example.tenantgate.exception;

/**
 * A connection pool for a tenant database could not be built.
 */
public class PoolConstructionException extends RuntimeException {
  public PoolConstructionException(String message) {
    super(message);
  }

  public PoolConstructionException(String message, Throwable cause) {
    super(message, cause);
  }
}
