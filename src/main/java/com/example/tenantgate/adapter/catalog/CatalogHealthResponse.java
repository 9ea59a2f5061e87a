package com.example.tenantgate.adapter.catalog;

/**
 * Catalog database health check response
 */
public record CatalogHealthResponse(
    boolean healthy,
    long responseTimeMs,
    String databaseProduct,
    int knownTenants,
    String error
) {
  public static CatalogHealthResponse healthy(long responseTimeMs, String databaseProduct,
                                              int knownTenants) {
    return new CatalogHealthResponse(true, responseTimeMs, databaseProduct, knownTenants, null);
  }

  public static CatalogHealthResponse unhealthy(String error) {
    return new CatalogHealthResponse(false, 0, null, 0, error);
  }
}
