package com.example.tenantgate.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.tenantgate.domain.entity.Claims;
import com.example.tenantgate.exception.DatabaseTimeoutException;
import com.example.tenantgate.security.GateDecision.Outcome;
import com.example.tenantgate.service.SessionValidator;
import com.example.tenantgate.service.TenantPoolManager;
import com.example.tenantgate.service.TokenCodec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import javax.crypto.spec.SecretKeySpec;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("AuthenticationGate")
class AuthenticationGateTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final List<String> BYPASS = List.of(
      "/api/auth/signup", "/api/auth/login", "/api/ping", "/health", "/api-doc");

  private final TokenCodec tokenCodec = new TokenCodec(
      new SecretKeySpec("0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8),
                        "HmacSHA256"),
      Duration.ofHours(1), Clock.fixed(NOW, ZoneOffset.UTC));
  private final SessionValidator sessionValidator = mock(SessionValidator.class);
  private final DataSource acmePool = mock(DataSource.class);

  private TenantPoolManager tenantPoolManager;
  private AuthenticationGate gate;

  @BeforeEach
  void setUp() {
    tenantPoolManager = new TenantPoolManager(
        mock(DataSource.class), tenantId -> Optional.empty(), (tenantId, dbUrl) -> acmePool);
    tenantPoolManager.addTenantPool("acme", acmePool);
    gate = new AuthenticationGate(tokenCodec, tenantPoolManager, sessionValidator, BYPASS);
  }

  private String bearer(String user, String tenantId) {
    return "Bearer " + tokenCodec.issue(user, "session-1", tenantId);
  }

  @Test
  @DisplayName("valid token for a provisioned tenant is authorized with the tenant pool")
  void authorized() {
    when(sessionValidator.isValidSession(any(Claims.class), eq(acmePool))).thenReturn(true);

    GateDecision decision = gate.evaluate("GET", "/api/address-book", bearer("alice", "acme"));

    assertThat(decision.outcome()).isEqualTo(Outcome.AUTHORIZED);
    assertThat(decision.pool()).isSameAs(acmePool);
    assertThat(decision.claims().user()).isEqualTo("alice");
    assertThat(decision.claims().tenantId()).isEqualTo("acme");
  }

  @ParameterizedTest
  @ValueSource(strings = {"OPTIONS", "options"})
  @DisplayName("OPTIONS is let through without looking at headers")
  void optionsBypasses(String method) {
    GateDecision decision = gate.evaluate(method, "/api/address-book", null);

    assertThat(decision.outcome()).isEqualTo(Outcome.BYPASSED);
    verifyNoInteractions(sessionValidator);
  }

  @ParameterizedTest
  @ValueSource(strings = {"/health", "/health/ready", "/api/auth/login", "/api-doc/swagger", "/api/ping"})
  @DisplayName("paths under a bypass prefix are let through without a token")
  void bypassPrefixes(String path) {
    assertThat(gate.evaluate("GET", path, null).outcome()).isEqualTo(Outcome.BYPASSED);
  }

  @Test
  @DisplayName("bypass matching is by exact prefix, not by path segment or case")
  void bypassIsExactPrefix() {
    assertThat(gate.isBypassed("GET", "/healthz")).isTrue();
    assertThat(gate.isBypassed("GET", "/HEALTH")).isFalse();
    assertThat(gate.isBypassed("GET", "/api/auth/logout")).isFalse();
    assertThat(gate.isBypassed("GET", null)).isFalse();
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "Basic abc", "Bearer", "Bearer    ", "Token abc"})
  @DisplayName("missing or non-bearer authorization is a missing token")
  void missingToken(String header) {
    GateDecision decision = gate.evaluate("GET", "/api/address-book", header);

    assertThat(decision.outcome()).isEqualTo(Outcome.REJECTED);
    assertThat(decision.failure()).isEqualTo(AuthenticationFailure.MISSING_TOKEN);
  }

  @Test
  @DisplayName("absent authorization header is a missing token")
  void absentHeader() {
    assertThat(gate.evaluate("GET", "/api/address-book", null).failure())
        .isEqualTo(AuthenticationFailure.MISSING_TOKEN);
  }

  @Test
  @DisplayName("the bearer scheme is matched case-insensitively")
  void bearerIsCaseInsensitive() {
    String token = tokenCodec.issue("alice", "session-1", "acme");

    assertThat(AuthenticationGate.extractToken("bearer " + token)).contains(token);
    assertThat(AuthenticationGate.extractToken("BEARER " + token)).contains(token);
    assertThat(AuthenticationGate.extractToken("BeArEr  " + token + " ")).contains(token);
  }

  @Test
  @DisplayName("undecodable token is rejected as malformed")
  void malformedToken() {
    assertThat(gate.evaluate("GET", "/api/address-book", "Bearer garbage").failure())
        .isEqualTo(AuthenticationFailure.MALFORMED_TOKEN);
  }

  @Test
  @DisplayName("expired token is rejected before any database work")
  void expiredToken() {
    String expired = tokenCodec.encode(new Claims("alice", "session-1", "acme",
                                                  NOW.minusSeconds(7200), NOW.minusSeconds(3600)));

    GateDecision decision = gate.evaluate("GET", "/api/address-book", "Bearer " + expired);

    assertThat(decision.failure()).isEqualTo(AuthenticationFailure.INVALID_SIGNATURE_OR_EXPIRED);
    verifyNoInteractions(sessionValidator);
  }

  @Test
  @DisplayName("token for a tenant without a cached pool is rejected and no pool is built")
  void unprovisionedTenant() {
    GateDecision decision = gate.evaluate("GET", "/api/address-book", bearer("alice", "globex"));

    assertThat(decision.failure()).isEqualTo(AuthenticationFailure.TENANT_NOT_FOUND);
    assertThat(tenantPoolManager.getTenantPool("globex")).isEmpty();
    verifyNoInteractions(sessionValidator);
  }

  @Test
  @DisplayName("token whose login session no longer matches is rejected")
  void revokedSession() {
    when(sessionValidator.isValidSession(any(Claims.class), eq(acmePool))).thenReturn(false);

    assertThat(gate.evaluate("GET", "/api/address-book", bearer("alice", "acme")).failure())
        .isEqualTo(AuthenticationFailure.SESSION_INVALIDATED);
  }

  @Test
  @DisplayName("database timeouts propagate instead of becoming a rejection")
  void timeoutPropagates() {
    when(sessionValidator.isValidSession(any(Claims.class), eq(acmePool)))
        .thenThrow(new DatabaseTimeoutException("timed out"));

    assertThatThrownBy(() -> gate.evaluate("GET", "/api/address-book", bearer("alice", "acme")))
        .isInstanceOf(DatabaseTimeoutException.class);
  }
}
