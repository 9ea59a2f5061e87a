package com.example.tenantgate.domain.entity;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Decoded token payload. Lives for a single request and is never persisted.
 * Timestamps carry second precision, matching the iat/exp wire format.
 */
public record Claims(
    String user,
    String loginSession,
    String tenantId,
    Instant issuedAt,
    Instant expiresAt
) {

  public Claims {
    Objects.requireNonNull(user, "user");
    Objects.requireNonNull(loginSession, "loginSession");
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(issuedAt, "issuedAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
    issuedAt = issuedAt.truncatedTo(ChronoUnit.SECONDS);
    expiresAt = expiresAt.truncatedTo(ChronoUnit.SECONDS);
    if (!expiresAt.isAfter(issuedAt)) {
      throw new IllegalArgumentException("expiresAt must be after issuedAt");
    }
  }
}
