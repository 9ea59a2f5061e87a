package com.example.tenantgate.security;

/**
 * Reasons the gate refuses a request. Clients always see the same 401; these values only
 * appear in server logs.
 */
public enum AuthenticationFailure {
  // No Authorization header, wrong scheme or an empty bearer value.
  MISSING_TOKEN,
  MALFORMED_TOKEN,
  INVALID_SIGNATURE_OR_EXPIRED,
  // Tenant has no provisioned pool.
  TENANT_NOT_FOUND,
  // Login session cleared or replaced since the token was issued.
  SESSION_INVALIDATED
}
