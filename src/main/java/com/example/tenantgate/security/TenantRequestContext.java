package com.example.tenantgate.security;

import com.example.tenantgate.domain.entity.Claims;
import jakarta.servlet.http.HttpServletRequest;
import javax.sql.DataSource;
import lombok.experimental.UtilityClass;

/**
 * Well-known request attributes set by the authentication gate on the authorized path.
 */
@UtilityClass
public class TenantRequestContext {

  public static final String POOL_ATTRIBUTE = TenantRequestContext.class.getName() + ".POOL";
  public static final String CLAIMS_ATTRIBUTE = TenantRequestContext.class.getName() + ".CLAIMS";

  public static void bind(HttpServletRequest request, Claims claims, DataSource pool) {
    request.setAttribute(CLAIMS_ATTRIBUTE, claims);
    request.setAttribute(POOL_ATTRIBUTE, pool);
  }

  /**
   * Returns the tenant pool of an authenticated request.
   *
   * @throws IllegalStateException if the gate did not run for this request; a programming error
   */
  public static DataSource requirePool(HttpServletRequest request) {
    Object pool = request.getAttribute(POOL_ATTRIBUTE);
    if (!(pool instanceof DataSource dataSource)) {
      throw new IllegalStateException("No tenant pool bound to request " + request.getRequestURI());
    }
    return dataSource;
  }

  public static Claims requireClaims(HttpServletRequest request) {
    Object claims = request.getAttribute(CLAIMS_ATTRIBUTE);
    if (!(claims instanceof Claims bound)) {
      throw new IllegalStateException("No claims bound to request " + request.getRequestURI());
    }
    return bound;
  }
}
