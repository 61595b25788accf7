package com.notisync.server.api;

import com.notisync.common.rules.InvalidRuleException;
import com.notisync.server.service.BatchTooLargeException;
import com.notisync.server.service.InvalidNotificationException;
import com.notisync.server.service.NotificationNotFoundException;
import com.notisync.server.service.RuleNotFoundException;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(InvalidRuleException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRule(InvalidRuleException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.INVALID_RULE, ex.getMessage());
  }

  @ExceptionHandler(InvalidNotificationException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidNotification(
      InvalidNotificationException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.INVALID_NOTIFICATION, ex.getMessage());
  }

  @ExceptionHandler(BatchTooLargeException.class)
  public ResponseEntity<ApiErrorResponse> handleBatchTooLarge(BatchTooLargeException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BATCH_TOO_LARGE, ex.getMessage());
  }

  @ExceptionHandler({NotificationNotFoundException.class, RuleNotFoundException.class})
  public ResponseEntity<ApiErrorResponse> handleNotFound(RuntimeException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }
}
