package com.example.tenantgate.security;

import com.example.tenantgate.domain.entity.Claims;
import com.example.tenantgate.exception.TokenException;
import com.example.tenantgate.service.SessionValidator;
import com.example.tenantgate.service.TenantPoolManager;
import com.example.tenantgate.service.TokenCodec;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-request authentication state machine:
 * bypass check, token extraction, decoding, tenant resolution, session verification.
 *
 * <p>Tenants must be provisioned beforehand: resolution uses the cache-only
 * {@link TenantPoolManager#getTenantPool(String)} and never builds a pool on the request path.
 *
 * <p>Infrastructure failures (timeouts, cache failures) are not rejections; they propagate to the
 * caller as exceptions so they are never mistaken for a bad credential.
 */
@Slf4j
public class AuthenticationGate {

  private static final String METHOD_OPTIONS = "OPTIONS";
  private static final String BEARER_PREFIX = "bearer ";

  private final TokenCodec tokenCodec;
  private final TenantPoolManager tenantPoolManager;
  private final SessionValidator sessionValidator;
  private final List<String> bypassPrefixes;

  public AuthenticationGate(TokenCodec tokenCodec,
                            TenantPoolManager tenantPoolManager,
                            SessionValidator sessionValidator,
                            List<String> bypassPrefixes) {
    this.tokenCodec = tokenCodec;
    this.tenantPoolManager = tenantPoolManager;
    this.sessionValidator = sessionValidator;
    this.bypassPrefixes = List.copyOf(bypassPrefixes);
  }

  public GateDecision evaluate(String method, String path, String authorizationHeader) {
    if (isBypassed(method, path)) {
      log.trace("Authentication bypassed for {} {}", method, path);
      return GateDecision.bypassed();
    }

    Optional<String> token = extractToken(authorizationHeader);
    if (token.isEmpty()) {
      return reject(AuthenticationFailure.MISSING_TOKEN, path, null);
    }

    Claims claims;
    try {
      claims = tokenCodec.decode(token.get());
    } catch (TokenException e) {
      AuthenticationFailure failure = e.getError() == TokenException.TokenError.MALFORMED
          ? AuthenticationFailure.MALFORMED_TOKEN
          : AuthenticationFailure.INVALID_SIGNATURE_OR_EXPIRED;
      log.debug("Token rejected: {} ({})", e.getError(), e.getMessage());
      return reject(failure, path, null);
    }

    Optional<DataSource> pool = tenantPoolManager.getTenantPool(claims.tenantId());
    if (pool.isEmpty()) {
      return reject(AuthenticationFailure.TENANT_NOT_FOUND, path, claims);
    }

    if (!sessionValidator.isValidSession(claims, pool.get())) {
      return reject(AuthenticationFailure.SESSION_INVALIDATED, path, claims);
    }

    log.debug("Authenticated user {} for tenant {}", claims.user(), claims.tenantId());
    return GateDecision.authorized(claims, pool.get());
  }

  /**
   * OPTIONS requests and paths under a configured prefix skip authentication.
   * Prefixes are checked in configuration order.
   */
  boolean isBypassed(String method, String path) {
    if (METHOD_OPTIONS.equalsIgnoreCase(method)) {
      return true;
    }
    if (path == null) {
      return false;
    }
    for (String prefix : bypassPrefixes) {
      if (path.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  static Optional<String> extractToken(String authorizationHeader) {
    if (authorizationHeader == null
        || authorizationHeader.length() < BEARER_PREFIX.length()
        || !authorizationHeader.substring(0, BEARER_PREFIX.length())
        .toLowerCase(Locale.ROOT).equals(BEARER_PREFIX)) {
      return Optional.empty();
    }
    String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }

  private GateDecision reject(AuthenticationFailure failure, String path, Claims claims) {
    if (claims != null) {
      log.warn("Authentication rejected for {}: {} (tenant={}, user={})",
               path, failure, claims.tenantId(), claims.user());
    } else {
      log.warn("Authentication rejected for {}: {}", path, failure);
    }
    return GateDecision.rejected(failure);
  }
}
