package com.example.tenantgate.security.filter;

import com.example.tenantgate.domain.entity.Claims;
import com.example.tenantgate.domain.entity.TenantPrincipal;
import com.example.tenantgate.exception.DatabaseTimeoutException;
import com.example.tenantgate.security.AuthenticationGate;
import com.example.tenantgate.security.GateDecision;
import com.example.tenantgate.security.TenantRequestContext;
import com.example.tenantgate.web.rest.ApiConstants.Messages;
import com.example.tenantgate.web.rest.dto.ResponseBody;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/**
 * Servlet adapter for the {@link AuthenticationGate}.
 * Authorized requests carry the tenant pool as a request attribute; rejected requests receive a
 * uniform 401 and never reach a handler.
 */
@Slf4j
@RequiredArgsConstructor
public class TenantAuthenticationFilter extends OncePerRequestFilter {

  private final AuthenticationGate authenticationGate;
  private final ObjectMapper objectMapper;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    GateDecision decision;
    try {
      // Bypass prefixes are relative to the application, not to the server root
      decision = authenticationGate.evaluate(
          request.getMethod(),
          UrlPathHelper.defaultInstance.getPathWithinApplication(request),
          request.getHeader(HttpHeaders.AUTHORIZATION));
    } catch (DatabaseTimeoutException e) {
      log.error("Authentication timed out for {} {}", request.getMethod(), request.getRequestURI(), e);
      writeError(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, Messages.SERVICE_UNAVAILABLE);
      return;
    } catch (RuntimeException e) {
      log.error("Authentication failed unexpectedly for {} {}",
                request.getMethod(), request.getRequestURI(), e);
      writeError(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, Messages.INTERNAL_ERROR);
      return;
    }

    switch (decision.outcome()) {
      case BYPASSED -> filterChain.doFilter(request, response);
      case AUTHORIZED -> {
        Claims claims = decision.claims();
        TenantRequestContext.bind(request, claims, decision.pool());
        TenantPrincipal principal = new TenantPrincipal(
            claims.user(), claims.tenantId(), claims.expiresAt().getEpochSecond());
        SecurityContextHolder.getContext().setAuthentication(
            new UsernamePasswordAuthenticationToken(principal, null, Collections.emptyList()));
        filterChain.doFilter(request, response);
      }
      case REJECTED -> writeError(response, HttpServletResponse.SC_UNAUTHORIZED, Messages.INVALID_TOKEN);
    }
  }

  private void writeError(HttpServletResponse response, int status, String message) throws IOException {
    response.setStatus(status);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(response.getWriter(), ResponseBody.message(message));
  }
}
