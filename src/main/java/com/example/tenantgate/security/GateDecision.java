package com.example.tenantgate.security;

import com.example.tenantgate.domain.entity.Claims;
import javax.sql.DataSource;

/**
 * Outcome of running one request through the {@link AuthenticationGate}.
 */
public record GateDecision(
    Outcome outcome,
    AuthenticationFailure failure,
    Claims claims,
    DataSource pool
) {

  public enum Outcome {
    BYPASSED,
    AUTHORIZED,
    REJECTED
  }

  public static GateDecision bypassed() {
    return new GateDecision(Outcome.BYPASSED, null, null, null);
  }

  public static GateDecision authorized(Claims claims, DataSource pool) {
    return new GateDecision(Outcome.AUTHORIZED, null, claims, pool);
  }

  public static GateDecision rejected(AuthenticationFailure failure) {
    return new GateDecision(Outcome.REJECTED, failure, null, null);
  }
}
