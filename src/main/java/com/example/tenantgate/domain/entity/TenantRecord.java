package com.example.tenantgate.domain.entity;

/**
 * A row of the catalog tenants table. Read-only from the gateway's perspective.
 */
public record TenantRecord(
    String id,
    String name,
    String dbUrl
) {}
