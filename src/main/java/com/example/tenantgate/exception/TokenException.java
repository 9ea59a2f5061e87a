package com.example.tenantgate.exception;

/**
 * Token Exception
 */
public class TokenException extends RuntimeException {

  /**
   * Why a token was refused.
   */
  public enum TokenError {
    MALFORMED,
    INVALID_SIGNATURE,
    EXPIRED
  }

  private final TokenError error;

  public TokenException(TokenError error, String message) {
    super(message);
    this.error = error;
  }

  public TokenException(TokenError error, String message, Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  public TokenError getError() {
    return error;
  }
}
