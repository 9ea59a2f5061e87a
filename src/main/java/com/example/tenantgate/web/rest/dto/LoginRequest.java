package com.example.tenantgate.web.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
    @JsonProperty("username_or_email")
    @NotBlank(message = "Username or email cannot be empty")
    @Size(max = 255, message = "Username or email too long (max 255 characters)")
    String usernameOrEmail,

    @NotBlank(message = "Password cannot be empty")
    @Size(max = 128, message = "Password too long (max 128 characters)")
    String password,

    @JsonProperty("tenant_id")
    @NotBlank(message = "Tenant id cannot be empty")
    String tenantId
) {
  @Override
  public String toString() {
    return "LoginRequest[usernameOrEmail=" + usernameOrEmail + ", tenantId=" + tenantId + "]";
  }
}
