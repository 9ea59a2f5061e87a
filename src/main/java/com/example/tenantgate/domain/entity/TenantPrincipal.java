package com.example.tenantgate.domain.entity;

/**
 * Tenant Principal - Minimal authenticated identity placed into the security context
 */
public record TenantPrincipal(
    String username,
    String tenantId,
    Long expiresAt
) {}
