package com.example.tenantgate.adapter.catalog;

import com.example.tenantgate.domain.entity.TenantRecord;
import java.util.Optional;

/**
 * Read access to the catalog of tenants and the databases they live in.
 */
public interface TenantCatalog {

  /**
   * Looks up the catalog row for a tenant.
   */
  Optional<TenantRecord> findById(String tenantId);
}
