package com.example.tenantgate.web.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType
) {

  public static TokenResponse bearer(String accessToken) {
    return new TokenResponse(accessToken, "bearer");
  }
}
