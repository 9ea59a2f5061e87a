package com.example.tenantgate.config;

import com.example.tenantgate.properties.ApplicationProperties;
import com.example.tenantgate.service.TenantPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Provisions the configured tenants at startup. The authentication gate only serves tenants whose
 * pool is already cached, so tenants listed here are reachable from the first request on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TenantPoolPreloader implements ApplicationRunner {

  private final TenantPoolManager tenantPoolManager;
  private final ApplicationProperties properties;

  @Override
  public void run(ApplicationArguments args) {
    int provisioned = 0;
    for (String tenantId : properties.tenantPool().preloadTenants()) {
      try {
        tenantPoolManager.getOrCreatePool(tenantId);
        provisioned++;
      } catch (RuntimeException e) {
        log.error("Failed to provision pool for tenant {}", tenantId, e);
      }
    }
    log.info("Provisioned {} of {} configured tenant pool(s)",
             provisioned, properties.tenantPool().preloadTenants().size());
  }
}
