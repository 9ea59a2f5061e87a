package com.example.tenantgate.domain.entity;

/**
 * Login session details resolved from a tenant's users table.
 */
public record SessionInfo(
    String username,
    String loginSession,
    String tenantId
) {}
