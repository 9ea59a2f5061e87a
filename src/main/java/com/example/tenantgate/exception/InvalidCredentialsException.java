package com.example.tenantgate.exception;

/**
 * Login rejected: unknown user, inactive user or wrong password. Callers are not told which.
 */
public class InvalidCredentialsException extends SessionException {
  public InvalidCredentialsException(String message) {
    super(message);
  }
}
