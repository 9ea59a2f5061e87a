package com.example.tenantgate.security;

import java.time.Clock;
import java.time.Instant;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Rejects tokens whose exp claim is absent or not strictly in the future. No clock skew is granted.
 */
public class ExpiryValidator implements OAuth2TokenValidator<Jwt> {

  public static final String EXPIRED_ERROR_CODE = "token_expired";

  private final Clock clock;

  public ExpiryValidator(Clock clock) {
    this.clock = clock;
  }

  @Override
  public OAuth2TokenValidatorResult validate(Jwt jwt) {
    Instant expiresAt = jwt.getExpiresAt();
    if (expiresAt == null) {
      return OAuth2TokenValidatorResult.failure(
          new OAuth2Error("invalid_token", "Missing exp claim", null));
    }
    if (!clock.instant().isBefore(expiresAt)) {
      return OAuth2TokenValidatorResult.failure(
          new OAuth2Error(EXPIRED_ERROR_CODE, "Token expired at " + expiresAt, null));
    }
    return OAuth2TokenValidatorResult.success();
  }
}
