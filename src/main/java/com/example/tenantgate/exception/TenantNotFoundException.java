package com.example.tenantgate.exception;

/**
 * Tenant Not Found Exception
 */
public class TenantNotFoundException extends RuntimeException {

  private final String tenantId;

  public TenantNotFoundException(String tenantId) {
    super("Tenant not found: " + tenantId);
    this.tenantId = tenantId;
  }

  public String getTenantId() {
    return tenantId;
  }
}
