package com.example.tenantgate.service;

import com.example.tenantgate.adapter.catalog.TenantCatalog;
import com.example.tenantgate.adapter.datasource.TenantDataSourceFactory;
import com.example.tenantgate.domain.entity.TenantRecord;
import com.example.tenantgate.exception.TenantCacheException;
import com.example.tenantgate.exception.TenantNotFoundException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Registry of per-tenant connection pools, created once at startup and shared by every request.
 *
 * <p>Holds the main catalog pool plus two unbounded caches: tenant id to pool, and tenant id to
 * database URL. Both are populated lazily and live until explicitly invalidated.
 *
 * <p>{@link #getOrCreatePool(String)} is deliberately not atomic. Pool construction happens
 * outside any cache lock, so two first-time callers for the same tenant may each build a pool.
 * Both pools stay usable by the caller that built them; the cache keeps whichever was written
 * last. Every pool the manager builds is tracked until it is handed to a caller through removal,
 * so a pool displaced from the cache is still closed at shutdown.
 *
 * <p>Every failure of the cache structure itself surfaces as {@link TenantCacheException},
 * on reads as well as writes. The two exceptions are the URL cache write during resolution and
 * the pool cache write after construction: both are logged and the resolved value is still
 * returned.
 */
@Slf4j
public class TenantPoolManager implements AutoCloseable {

  private final DataSource mainPool;
  private final TenantCatalog catalog;
  private final TenantDataSourceFactory dataSourceFactory;
  private final Cache<String, DataSource> tenantPools;
  private final Cache<String, String> tenantUrls;
  private final Set<DataSource> ownedPools = ConcurrentHashMap.newKeySet();

  public TenantPoolManager(DataSource mainPool,
                           TenantCatalog catalog,
                           TenantDataSourceFactory dataSourceFactory) {
    this(mainPool, catalog, dataSourceFactory,
         Caffeine.newBuilder().recordStats().build(),
         Caffeine.newBuilder().recordStats().build());
  }

  TenantPoolManager(DataSource mainPool,
                    TenantCatalog catalog,
                    TenantDataSourceFactory dataSourceFactory,
                    Cache<String, DataSource> tenantPools,
                    Cache<String, String> tenantUrls) {
    this.mainPool = mainPool;
    this.catalog = catalog;
    this.dataSourceFactory = dataSourceFactory;
    this.tenantPools = tenantPools;
    this.tenantUrls = tenantUrls;
  }

  public DataSource getMainPool() {
    return mainPool;
  }

  /**
   * Cache-only lookup. Never consults the catalog and never builds a pool.
   */
  public Optional<DataSource> getTenantPool(String tenantId) {
    requireTenantId(tenantId);
    return Optional.ofNullable(
        guard("read pool cache", tenantId, () -> tenantPools.getIfPresent(tenantId)));
  }

  /**
   * Registers a pool for a pre-provisioned tenant. A different pool previously cached for the
   * tenant is closed.
   */
  public void addTenantPool(String tenantId, DataSource pool) {
    requireTenantId(tenantId);
    DataSource previous = guard("write pool cache", tenantId,
                                () -> tenantPools.asMap().put(tenantId, pool));
    ownedPools.add(pool);
    log.info("Tenant pool registered for {}", tenantId);
    if (previous != null && previous != pool) {
      ownedPools.remove(previous);
      closePool(tenantId, previous);
      log.info("Replaced tenant pool closed for {}", tenantId);
    }
  }

  /**
   * Removes the cached pool. The pool is handed back open; closing it is up to the caller.
   */
  public Optional<DataSource> removeTenantPool(String tenantId) {
    requireTenantId(tenantId);
    DataSource removed = guard("remove from pool cache", tenantId,
                               () -> tenantPools.asMap().remove(tenantId));
    if (removed != null) {
      ownedPools.remove(removed);
      log.info("Tenant pool removed for {}", tenantId);
    }
    return Optional.ofNullable(removed);
  }

  /**
   * Returns the tenant's pool, resolving its database URL through the catalog and building the
   * pool on first use.
   *
   * @throws TenantNotFoundException if the catalog has no row for the tenant
   * @throws com.example.tenantgate.exception.PoolConstructionException if the pool cannot be built
   * @throws TenantCacheException if the pool cache cannot be read
   */
  public DataSource getOrCreatePool(String tenantId) {
    Optional<DataSource> cached = getTenantPool(tenantId);
    if (cached.isPresent()) {
      return cached.get();
    }

    String dbUrl = resolveDbUrl(tenantId);
    DataSource pool = dataSourceFactory.create(tenantId, dbUrl);
    ownedPools.add(pool);

    try {
      tenantPools.put(tenantId, pool);
      log.info("Tenant pool created and cached for {}", tenantId);
    } catch (RuntimeException e) {
      log.error("Tenant pool for {} was created but could not be cached; "
                    + "the next request will build another", tenantId, e);
    }
    return pool;
  }

  /**
   * Forgets the cached database URL of one tenant. Must be called whenever the tenant's catalog
   * row changes its db_url, otherwise the stale URL keeps being served.
   */
  public void clearTenantUrlCache(String tenantId) {
    requireTenantId(tenantId);
    guard("clear URL cache", tenantId, () -> {
      tenantUrls.invalidate(tenantId);
      return null;
    });
    log.debug("URL cache cleared for tenant {}", tenantId);
  }

  public void clearAllUrlCaches() {
    guard("clear URL cache", "*", () -> {
      tenantUrls.invalidateAll();
      return null;
    });
    log.info("URL cache cleared for all tenants");
  }

  /**
   * Drops everything cached for a tenant. The pool removal decides the result; clearing the URL
   * cache afterwards is best effort.
   */
  public Optional<DataSource> removeTenantCompletely(String tenantId) {
    Optional<DataSource> removed = removeTenantPool(tenantId);
    try {
      clearTenantUrlCache(tenantId);
    } catch (TenantCacheException e) {
      log.warn("Pool removed for tenant {} but its URL cache entry could not be cleared",
               tenantId, e);
    }
    return removed;
  }

  public List<String> cachedTenantIds() {
    return guard("read pool cache", "*", () -> List.copyOf(tenantPools.asMap().keySet()));
  }

  public Stats stats() {
    return guard("read cache stats", "*", () -> {
      CacheStats poolStats = tenantPools.stats();
      return new Stats(
          tenantPools.estimatedSize(),
          tenantUrls.estimatedSize(),
          poolStats.hitCount(),
          poolStats.missCount());
    });
  }

  /**
   * Closes every cached tenant pool and every pool built here that lost its cache slot to a
   * concurrent builder. Pools handed out by removal are left to their new owner. The main pool is
   * owned by the application context.
   */
  @Override
  public void close() {
    Set<DataSource> closed = Collections.newSetFromMap(new IdentityHashMap<>());
    for (var entry : tenantPools.asMap().entrySet()) {
      if (closed.add(entry.getValue())) {
        closePool(entry.getKey(), entry.getValue());
      }
    }
    for (DataSource pool : ownedPools) {
      if (closed.add(pool)) {
        closePool("<displaced>", pool);
      }
    }
    ownedPools.clear();
    tenantPools.invalidateAll();
    tenantUrls.invalidateAll();
    log.info("Tenant pools closed ({} in total)", closed.size());
  }

  private String resolveDbUrl(String tenantId) {
    String cachedUrl = guard("read URL cache", tenantId, () -> tenantUrls.getIfPresent(tenantId));
    if (cachedUrl != null) {
      return cachedUrl;
    }

    TenantRecord tenant = catalog.findById(tenantId)
        .orElseThrow(() -> new TenantNotFoundException(tenantId));

    try {
      tenantUrls.put(tenantId, tenant.dbUrl());
    } catch (RuntimeException e) {
      log.warn("Could not cache database URL for tenant {}", tenantId, e);
    }
    return tenant.dbUrl();
  }

  private void closePool(String tenantId, DataSource pool) {
    if (pool instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close pool for tenant {}", tenantId, e);
      }
    }
  }

  private <T> T guard(String operation, String tenantId, Supplier<T> action) {
    try {
      return action.get();
    } catch (RuntimeException e) {
      log.error("Tenant cache failure during '{}' for tenant {}", operation, tenantId, e);
      throw new TenantCacheException("Tenant cache failure during " + operation, e);
    }
  }

  private static void requireTenantId(String tenantId) {
    if (!StringUtils.hasText(tenantId)) {
      throw new IllegalArgumentException("Tenant id must not be blank");
    }
  }

  /**
   * Point-in-time cache figures for health reporting.
   */
  public record Stats(
      long cachedPools,
      long cachedUrls,
      long poolHits,
      long poolMisses
  ) {}
}
