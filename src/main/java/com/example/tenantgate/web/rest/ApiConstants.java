package com.example.tenantgate.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String API_BASE = "/api";
    public static final String HEALTH_BASE = "/health";

    // Auth paths
    public static final String AUTH = "/auth";
    public static final String LOGIN = "/login";
    public static final String LOGOUT = "/logout";
    public static final String ME = "/me";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  public static final class Messages {
    public static final String INVALID_TOKEN = "Invalid token!";
    public static final String SERVICE_UNAVAILABLE = "Service temporarily unavailable";
    public static final String INTERNAL_ERROR = "Internal server error";
    public static final String LOGIN_SUCCESS = "Login successfully";
    public static final String LOGIN_FAILED = "Invalid username or password";
    public static final String TENANT_NOT_FOUND = "Tenant not found";
    public static final String LOGOUT_SUCCESS = "Logout successfully";
    public static final String FETCH_SUCCESS = "Ok";

    private Messages() {}
  }

  private ApiConstants() {}
}
