package com.example.tenantgate.exception;

/**
 * No user row matches the username and login session carried by a token.
 */
public class SessionNotFoundException extends SessionException {
  public SessionNotFoundException(String message) {
    super(message);
  }
}
