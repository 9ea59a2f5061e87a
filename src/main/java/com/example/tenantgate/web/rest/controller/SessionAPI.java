package com.example.tenantgate.web.rest.controller;

import static com.example.tenantgate.web.rest.ApiConstants.ApiPath.*;

import com.example.tenantgate.web.rest.dto.LoginRequest;
import com.example.tenantgate.web.rest.dto.ResponseBody;
import com.example.tenantgate.web.rest.dto.TokenResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Login session API.
 * Login is on the bypass list; every other endpoint runs behind the authentication gate and uses
 * the caller's tenant pool.
 */
@Tag(
    name = "Session Management",
    description = "Login, current user and logout endpoints"
)
@RequestMapping(
    value = API_BASE + AUTH,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SessionAPI {

  @Operation(
      summary = "Login",
      description = "Verifies credentials against the tenant's users and issues a bearer token"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Token issued"),
      @ApiResponse(responseCode = "400", description = "Invalid request or unknown tenant"),
      @ApiResponse(responseCode = "401", description = "Invalid username or password"),
      @ApiResponse(responseCode = "503", description = "Tenant database timed out")
  })
  @PostMapping(value = LOGIN, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<ResponseBody<TokenResponse>> login(@Valid @RequestBody LoginRequest loginRequest);

  @Operation(
      summary = "Get current user",
      description = "Returns the user and tenant bound to the presented token"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "User returned"),
      @ApiResponse(responseCode = "401", description = "Missing, invalid or revoked token"),
      @ApiResponse(responseCode = "404", description = "User no longer exists"),
      @ApiResponse(responseCode = "503", description = "Tenant database timed out")
  })
  @SecurityRequirement(name = "bearerAuth")
  @GetMapping(value = ME)
  ResponseEntity<ResponseBody<Map<String, Object>>> getCurrentUser();

  /**
   * Clears the user's login session. Every token issued for it stops working immediately.
   */
  @Operation(
      summary = "Logout",
      description = "Revokes every outstanding token of the current user"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session cleared"),
      @ApiResponse(responseCode = "401", description = "Missing, invalid or revoked token"),
      @ApiResponse(responseCode = "503", description = "Tenant database timed out")
  })
  @SecurityRequirement(name = "bearerAuth")
  @PostMapping(value = LOGOUT)
  ResponseEntity<ResponseBody<String>> logout();
}
