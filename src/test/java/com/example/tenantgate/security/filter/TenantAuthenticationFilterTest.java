package com.example.tenantgate.security.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.tenantgate.domain.entity.Claims;
import com.example.tenantgate.domain.entity.TenantPrincipal;
import com.example.tenantgate.exception.DatabaseTimeoutException;
import com.example.tenantgate.exception.TenantCacheException;
import com.example.tenantgate.security.AuthenticationGate;
import com.example.tenantgate.security.TenantRequestContext;
import com.example.tenantgate.service.SessionValidator;
import com.example.tenantgate.service.TenantPoolManager;
import com.example.tenantgate.service.TokenCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.crypto.spec.SecretKeySpec;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Servlet mock tests for {@link TenantAuthenticationFilter}; no Spring context is started.
 */
@DisplayName("TenantAuthenticationFilter")
class TenantAuthenticationFilterTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final String INVALID_TOKEN_BODY = "{\"message\":\"Invalid token!\",\"data\":\"\"}";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final TokenCodec tokenCodec = new TokenCodec(
      new SecretKeySpec("0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8),
                        "HmacSHA256"),
      Duration.ofHours(1), Clock.fixed(NOW, ZoneOffset.UTC));
  private final SessionValidator sessionValidator = mock(SessionValidator.class);
  private final DataSource acmePool = mock(DataSource.class);
  private final AtomicBoolean chainInvoked = new AtomicBoolean();
  private final FilterChain recordingChain = (req, resp) -> chainInvoked.set(true);

  private TenantAuthenticationFilter filter;

  @BeforeEach
  void setUp() {
    TenantPoolManager manager = new TenantPoolManager(
        mock(DataSource.class), tenantId -> Optional.empty(), (tenantId, dbUrl) -> acmePool);
    manager.addTenantPool("acme", acmePool);
    AuthenticationGate gate = new AuthenticationGate(
        tokenCodec, manager, sessionValidator, List.of("/api/auth/login", "/health"));
    filter = new TenantAuthenticationFilter(gate, objectMapper);
  }

  @AfterEach
  void cleanup() {
    SecurityContextHolder.clearContext();
  }

  @Test
  @DisplayName("GET /health without a header reaches the handler")
  void healthBypass() throws Exception {
    var request = new MockHttpServletRequest("GET", "/health");
    var response = new MockHttpServletResponse();

    filter.doFilter(request, response, recordingChain);

    assertThat(chainInvoked).isTrue();
    assertThat(response.getStatus()).isEqualTo(200);
  }

  @Test
  @DisplayName("bypass prefixes match below a non-root context path")
  void healthBypassUnderContextPath() throws Exception {
    var request = new MockHttpServletRequest("GET", "/ctx/health/ready");
    request.setContextPath("/ctx");
    var response = new MockHttpServletResponse();

    filter.doFilter(request, response, recordingChain);

    assertThat(chainInvoked).isTrue();
    assertThat(response.getStatus()).isEqualTo(200);
  }

  @Test
  @DisplayName("the context path itself never satisfies a bypass prefix")
  void contextPathDoesNotBypass() throws Exception {
    var request = new MockHttpServletRequest("GET", "/health/api/address-book");
    request.setContextPath("/health");
    var response = new MockHttpServletResponse();

    filter.doFilter(request, response, recordingChain);

    assertThat(chainInvoked).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  @DisplayName("expired token gets 401 with the invalid token envelope and no handler call")
  void expiredToken() throws Exception {
    String expired = tokenCodec.encode(new Claims("alice", "session-1", "acme",
                                                  NOW.minusSeconds(7200), NOW.minusSeconds(1)));
    var request = new MockHttpServletRequest("GET", "/api/address-book");
    request.addHeader("Authorization", "Bearer " + expired);
    var response = new MockHttpServletResponse();

    filter.doFilter(request, response, recordingChain);

    assertThat(chainInvoked).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(response.getContentType()).startsWith("application/json");
    assertThat(response.getContentAsString()).isEqualTo(INVALID_TOKEN_BODY);
  }

  @Test
  @DisplayName("every rejection reason produces the same response")
  void uniformRejection() throws Exception {
    var missing = new MockHttpServletResponse();
    filter.doFilter(new MockHttpServletRequest("GET", "/api/address-book"), missing, recordingChain);

    var unknownTenant = new MockHttpServletResponse();
    var request = new MockHttpServletRequest("GET", "/api/address-book");
    request.addHeader("Authorization", "Bearer " + tokenCodec.issue("alice", "s", "globex"));
    filter.doFilter(request, unknownTenant, recordingChain);

    assertThat(missing.getStatus()).isEqualTo(unknownTenant.getStatus()).isEqualTo(401);
    assertThat(missing.getContentAsString())
        .isEqualTo(unknownTenant.getContentAsString())
        .isEqualTo(INVALID_TOKEN_BODY);
    assertThat(chainInvoked).isFalse();
  }

  @Test
  @DisplayName("authorized request carries the tenant pool, claims and principal into the chain")
  void authorizedBindsContext() throws Exception {
    when(sessionValidator.isValidSession(any(Claims.class), any(DataSource.class))).thenReturn(true);
    var capturedPool = new AtomicReference<DataSource>();
    var capturedAuth = new AtomicReference<Authentication>();
    FilterChain capturingChain = (req, resp) -> {
      capturedPool.set(TenantRequestContext.requirePool((HttpServletRequest) req));
      capturedAuth.set(SecurityContextHolder.getContext().getAuthentication());
    };
    var request = new MockHttpServletRequest("GET", "/api/address-book");
    request.addHeader("Authorization", "Bearer " + tokenCodec.issue("alice", "session-1", "acme"));

    filter.doFilter(request, new MockHttpServletResponse(), capturingChain);

    assertThat(capturedPool.get()).isSameAs(acmePool);
    assertThat(TenantRequestContext.requireClaims(request).user()).isEqualTo("alice");
    assertThat(capturedAuth.get().getPrincipal())
        .isInstanceOfSatisfying(TenantPrincipal.class, principal -> {
          assertThat(principal.username()).isEqualTo("alice");
          assertThat(principal.tenantId()).isEqualTo("acme");
        });
  }

  @Test
  @DisplayName("a session query timeout answers 503, not 401")
  void timeoutIsServiceUnavailable() throws Exception {
    AuthenticationGate gate = mock(AuthenticationGate.class);
    when(gate.evaluate(anyString(), anyString(), any()))
        .thenThrow(new DatabaseTimeoutException("timed out"));
    var response = new MockHttpServletResponse();

    new TenantAuthenticationFilter(gate, objectMapper)
        .doFilter(new MockHttpServletRequest("GET", "/api/address-book"), response, recordingChain);

    assertThat(response.getStatus()).isEqualTo(503);
    assertThat(response.getContentAsString())
        .isEqualTo("{\"message\":\"Service temporarily unavailable\",\"data\":\"\"}");
    assertThat(chainInvoked).isFalse();
  }

  @Test
  @DisplayName("a broken tenant cache answers 500")
  void cacheFailureIsInternalError() throws Exception {
    AuthenticationGate gate = mock(AuthenticationGate.class);
    when(gate.evaluate(anyString(), anyString(), any()))
        .thenThrow(new TenantCacheException("cache down", new IllegalStateException()));
    var response = new MockHttpServletResponse();

    new TenantAuthenticationFilter(gate, objectMapper)
        .doFilter(new MockHttpServletRequest("GET", "/api/address-book"), response, recordingChain);

    assertThat(response.getStatus()).isEqualTo(500);
    assertThat(chainInvoked).isFalse();
  }
}
