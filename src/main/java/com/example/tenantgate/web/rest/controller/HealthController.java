package com.example.tenantgate.web.rest.controller;

import com.example.tenantgate.adapter.catalog.CatalogHealthClient;
import com.example.tenantgate.adapter.catalog.CatalogHealthResponse;
import com.example.tenantgate.service.TenantPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Health Check Controller
 *
 * Note: Health endpoints don't throw exceptions to GlobalErrorHandler
 * as they need to return specific status codes for monitoring tools.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  private static final double MEMORY_USAGE_CRITICAL_PERCENT = 90.0;
  private static final long CATALOG_RESPONSE_TIME_WARNING_MS = 500L;
  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";
  private static final String STATUS_LIVE = "LIVE";
  private static final String STATUS_DEAD = "DEAD";

  private final CatalogHealthClient catalogHealthClient;
  private final TenantPoolManager tenantPoolManager;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    TenantPoolManager.Stats stats = tenantPoolManager.stats();
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "tenantPools", Map.of(
            "cachedPools", stats.cachedPools(),
            "cachedUrls", stats.cachedUrls(),
            "hits", stats.poolHits(),
            "misses", stats.poolMisses()),
        "timestamp", System.currentTimeMillis()
                                   ));
  }

  /**
   * Liveness probe - checks JVM health
   */
  @Override
  public ResponseEntity<Map<String, Object>> liveness() {
    Runtime runtime = Runtime.getRuntime();
    long maxMemory = runtime.maxMemory();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();

    double memoryUsagePercent = (double) usedMemory / maxMemory * 100;

    Map<String, Object> response = new HashMap<>();
    response.put("memoryUsagePercent", String.format("%.2f", memoryUsagePercent));

    if (memoryUsagePercent < MEMORY_USAGE_CRITICAL_PERCENT) {
      response.put("status", STATUS_LIVE);
      return ResponseEntity.ok(response);
    }

    log.warn("Liveness check failed: memory usage {}%", memoryUsagePercent);
    response.put("status", STATUS_DEAD);
    return ResponseEntity.status(503).body(response);
  }

  /**
   * Readiness probe - the catalog must answer, otherwise no new tenant can be resolved
   */
  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    CatalogHealthResponse catalogHealth = catalogHealthClient.checkHealth();

    Map<String, Object> catalogStatus = new HashMap<>();
    catalogStatus.put("status", catalogHealth.healthy() ? STATUS_UP : STATUS_DOWN);
    catalogStatus.put("responseTimeMs", catalogHealth.responseTimeMs());
    catalogStatus.put("knownTenants", catalogHealth.knownTenants());
    if (catalogHealth.error() != null) {
      catalogStatus.put("error", catalogHealth.error());
    }

    boolean isReady = catalogHealth.healthy();
    if (catalogHealth.responseTimeMs() > CATALOG_RESPONSE_TIME_WARNING_MS) {
      log.warn("Catalog responded slowly: {}ms", catalogHealth.responseTimeMs());
    }
    if (!isReady) {
      log.warn("Readiness check failed: catalog unavailable ({})", catalogHealth.error());
    }

    Map<String, Object> status = new HashMap<>();
    status.put("catalog", catalogStatus);
    status.put("cachedTenants", tenantPoolManager.cachedTenantIds().size());
    status.put("ready", isReady);
    status.put("timestamp", System.currentTimeMillis());

    return ResponseEntity.status(isReady ? 200 : 503).body(status);
  }
}
