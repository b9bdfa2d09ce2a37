/*
 * どこで: Commerce API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: 検証/未存在/遷移競合/永続化失敗を統一フォーマットで返すため
 */
package com.ecommerce.commerce.api;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ValidationFailedException.class)
  public ResponseEntity<ApiErrorResponse> handleValidationFailed(ValidationFailedException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.VALIDATION_FAILED, ex.getMessage(), ex.getViolations()));
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(ResourceNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.NOT_FOUND, ex.getMessage());
  }

  // InvalidOrderTransitionException より具体的な型が優先される。
  @ExceptionHandler(OrderNotCancellableException.class)
  public ResponseEntity<ApiErrorResponse> handleNotCancellable(OrderNotCancellableException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.ORDER_NOT_CANCELLABLE, ex.getMessage());
  }

  @ExceptionHandler(InvalidOrderTransitionException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidTransition(
      InvalidOrderTransitionException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.INVALID_STATUS_TRANSITION, ex.getMessage());
  }

  @ExceptionHandler(OrderStatusConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleStatusConflict(OrderStatusConflictException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.ORDER_STATUS_CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(IdempotencyConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleIdempotencyConflict(
      IdempotencyConflictException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.IDEMPOTENCY_KEY_CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(CatalogConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleCatalogConflict(CatalogConflictException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.CATALOG_CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(OrderPersistenceException.class)
  public ResponseEntity<ApiErrorResponse> handleOrderPersistence(OrderPersistenceException ex) {
    // 詳細は OrderPersister 側で記録済み。
    return error(
        HttpStatus.SERVICE_UNAVAILABLE, ApiErrorCode.PERSISTENCE_ERROR, ex.getMessage());
  }

  @ExceptionHandler({DataAccessException.class, TransactionException.class})
  public ResponseEntity<ApiErrorResponse> handleStorageFailure(RuntimeException ex) {
    logger.error("storage failure type={}", ex.getClass().getSimpleName(), ex);
    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiErrorCode.PERSISTENCE_ERROR,
        "storage is temporarily unavailable");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return badRequest(ex.getParameterName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(MessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleHandlerMethodValidation(
      HandlerMethodValidationException ex) {
    final String message =
        ex.getAllErrors().stream()
            .map(MessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSON パーサの内部文言は露出しない。
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

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
