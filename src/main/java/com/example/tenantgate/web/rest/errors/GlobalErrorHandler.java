package com.example.tenantgate.web.rest.errors;

import com.example.tenantgate.exception.DatabaseTimeoutException;
import com.example.tenantgate.exception.InvalidCredentialsException;
import com.example.tenantgate.exception.PoolConstructionException;
import com.example.tenantgate.exception.SessionLookupException;
import com.example.tenantgate.exception.SessionNotFoundException;
import com.example.tenantgate.exception.TenantCacheException;
import com.example.tenantgate.exception.TenantNotFoundException;
import com.example.tenantgate.exception.TokenException;
import com.example.tenantgate.web.rest.ApiConstants.Messages;
import com.example.tenantgate.web.rest.dto.ResponseBody;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.util.stream.Collectors;

/**
 * Global Error Handler
 *
 * Maps exceptions raised by handlers onto the standard {"message", "data"} envelope without
 * exposing internal details. Infrastructure failures are logged with their cause; client errors
 * are not.
 */
@Slf4j
@RestControllerAdvice
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class GlobalErrorHandler {

  @ExceptionHandler(TokenException.class)
  public ResponseEntity<ResponseBody<String>> handleTokenException(
      TokenException ex, WebRequest request) {
    log.warn("Token rejected on {}: {}", extractPath(request), ex.getError());
    return respond(HttpStatus.UNAUTHORIZED, Messages.INVALID_TOKEN);
  }

  @ExceptionHandler(InvalidCredentialsException.class)
  public ResponseEntity<ResponseBody<String>> handleInvalidCredentials(
      InvalidCredentialsException ex, WebRequest request) {
    return respond(HttpStatus.UNAUTHORIZED, Messages.LOGIN_FAILED);
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ResponseBody<String>> handleSessionNotFound(
      SessionNotFoundException ex, WebRequest request) {
    log.debug("Session not found on {}", extractPath(request));
    return respond(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(TenantNotFoundException.class)
  public ResponseEntity<ResponseBody<String>> handleTenantNotFound(
      TenantNotFoundException ex, WebRequest request) {
    log.warn("Unknown tenant {} on {}", ex.getTenantId(), extractPath(request));
    return respond(HttpStatus.BAD_REQUEST, Messages.TENANT_NOT_FOUND);
  }

  @ExceptionHandler(DatabaseTimeoutException.class)
  public ResponseEntity<ResponseBody<String>> handleTimeout(
      DatabaseTimeoutException ex, WebRequest request) {
    log.error("Database timeout on {}", extractPath(request), ex);
    return respond(HttpStatus.SERVICE_UNAVAILABLE, Messages.SERVICE_UNAVAILABLE);
  }

  @ExceptionHandler({
      PoolConstructionException.class,
      TenantCacheException.class,
      SessionLookupException.class
  })
  public ResponseEntity<ResponseBody<String>> handleInfrastructureException(
      RuntimeException ex, WebRequest request) {
    log.error("Tenant infrastructure error on {}", extractPath(request), ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, Messages.INTERNAL_ERROR);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ResponseBody<String>> handleValidationException(
      MethodArgumentNotValidException ex, WebRequest request) {
    String errors = ex.getBindingResult().getFieldErrors().stream()
        .map(FieldError::getDefaultMessage)
        .collect(Collectors.joining(", "));
    return respond(HttpStatus.BAD_REQUEST, errors);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ResponseBody<String>> handleUnreadableBody(
      HttpMessageNotReadableException ex, WebRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "Malformed request body");
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ResponseBody<String>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    return respond(HttpStatus.METHOD_NOT_ALLOWED,
                   String.format("Method %s not supported", ex.getMethod()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ResponseBody<String>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error on {}", extractPath(request), ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, Messages.INTERNAL_ERROR);
  }

  private ResponseEntity<ResponseBody<String>> respond(HttpStatus status, String message) {
    return new ResponseEntity<>(ResponseBody.message(message), status);
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }
}
