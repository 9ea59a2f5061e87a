package com.example.tenantgate.web.rest.dto;

/**
 * Standard response envelope: {@code {"message": ..., "data": ...}}.
 */
public record ResponseBody<T>(
    String message,
    T data
) {

  public static final String EMPTY = "";

  public static ResponseBody<String> message(String message) {
    return new ResponseBody<>(message, EMPTY);
  }
}
