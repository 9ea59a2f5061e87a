package com.example.tenantgate.exception;

/**
 * The session query itself failed for a reason other than a timeout.
 */
public class SessionLookupException extends SessionException {
  public SessionLookupException(String message, Throwable cause) {
    super(message, cause);
  }
}
