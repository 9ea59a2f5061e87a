package com.example.tenantgate.exception;

/**
 * The tenant pool or URL cache failed internally while being read or mutated.
 */
public class TenantCacheException extends RuntimeException {
  public TenantCacheException(String message, Throwable cause) {
    super(message, cause);
  }
}
