package com.example.tenantgate.web.rest.controller;

import static com.example.tenantgate.web.rest.ApiConstants.ApiPath.HEALTH_BASE;
import static com.example.tenantgate.web.rest.ApiConstants.ApiPath.LIVE;
import static com.example.tenantgate.web.rest.ApiConstants.ApiPath.READY;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Unauthenticated probes. The path prefix is on the gate's bypass list.
 */
@Tag(name = "Health", description = "Process, tenant cache and catalog probes")
@RequestMapping(value = HEALTH_BASE, produces = MediaType.APPLICATION_JSON_VALUE)
public interface HealthAPI {

  @Operation(
      summary = "Process status with tenant cache figures",
      description = "Reports cached pool and URL counts plus pool cache hits and misses. "
          + "Never touches a database."
  )
  @ApiResponse(responseCode = "200", description = "Process is up")
  @GetMapping
  ResponseEntity<Map<String, Object>> health();

  @Operation(summary = "Liveness probe", description = "Fails only when heap usage is critical")
  @ApiResponse(responseCode = "200", description = "Process is alive")
  @ApiResponse(responseCode = "503", description = "Heap exhausted, restart the container")
  @GetMapping(LIVE)
  ResponseEntity<Map<String, Object>> liveness();

  @Operation(
      summary = "Readiness probe",
      description = "Ready when the tenant catalog answers a count of provisioned tenants"
  )
  @ApiResponse(responseCode = "200", description = "Catalog reachable")
  @ApiResponse(responseCode = "503", description = "Catalog unreachable or failing")
  @GetMapping(READY)
  ResponseEntity<Map<String, Object>> readiness();
}
