package com.example.tenantgate.web.rest.controller;

import com.example.tenantgate.domain.entity.Claims;
import com.example.tenantgate.domain.entity.SessionInfo;
import com.example.tenantgate.exception.TenantNotFoundException;
import com.example.tenantgate.security.TenantRequestContext;
import com.example.tenantgate.service.LoginSessionService;
import com.example.tenantgate.service.SessionValidator;
import com.example.tenantgate.service.TenantPoolManager;
import com.example.tenantgate.web.rest.ApiConstants.Messages;
import com.example.tenantgate.web.rest.dto.LoginRequest;
import com.example.tenantgate.web.rest.dto.ResponseBody;
import com.example.tenantgate.web.rest.dto.TokenResponse;
import jakarta.servlet.http.HttpServletRequest;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Login session REST controller.
 * Authenticated endpoints read the claims and tenant pool the authentication gate bound to the
 * request; login resolves the pool itself from the tenant named in the body.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class SessionController implements SessionAPI {

  private final TenantPoolManager tenantPoolManager;
  private final SessionValidator sessionValidator;
  private final LoginSessionService loginSessionService;
  private final HttpServletRequest request;

  /**
   * Only provisioned tenants can log in; a login never builds a pool.
   */
  @Override
  public ResponseEntity<ResponseBody<TokenResponse>> login(LoginRequest loginRequest) {
    String tenantId = loginRequest.tenantId();
    DataSource pool = tenantPoolManager.getTenantPool(tenantId)
        .orElseThrow(() -> new TenantNotFoundException(tenantId));

    String token = loginSessionService.login(tenantId, loginRequest.usernameOrEmail(),
                                             loginRequest.password(), pool);
    return ResponseEntity.ok(new ResponseBody<>(Messages.LOGIN_SUCCESS, TokenResponse.bearer(token)));
  }

  @Override
  public ResponseEntity<ResponseBody<Map<String, Object>>> getCurrentUser() {
    Claims claims = TenantRequestContext.requireClaims(request);
    DataSource pool = TenantRequestContext.requirePool(request);

    SessionInfo session = sessionValidator.findSessionInfo(claims, pool);

    Map<String, Object> user = new LinkedHashMap<>();
    user.put("username", session.username());
    user.put("tenantId", session.tenantId());
    user.put("issuedAt", claims.issuedAt().getEpochSecond());
    user.put("expiresAt", claims.expiresAt().getEpochSecond());

    return ResponseEntity.ok(new ResponseBody<>(Messages.FETCH_SUCCESS, user));
  }

  @Override
  public ResponseEntity<ResponseBody<String>> logout() {
    Claims claims = TenantRequestContext.requireClaims(request);
    DataSource pool = TenantRequestContext.requirePool(request);

    loginSessionService.endSession(claims.tenantId(), claims.user(), pool);
    return ResponseEntity.ok(ResponseBody.message(Messages.LOGOUT_SUCCESS));
  }
}
