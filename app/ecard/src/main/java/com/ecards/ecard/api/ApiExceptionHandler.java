package com.ecards.ecard.api;

import com.ecards.ecard.artwork.ArtworkStorageException;
import com.ecards.ecard.service.ArtworkNotFoundException;
import com.ecards.ecard.service.CardAccessDeniedException;
import com.ecards.ecard.service.CardNotFoundException;
import com.ecards.ecard.service.DeliveryFailedException;
import com.ecards.ecard.service.InvalidCardRequestException;
import com.ecards.ecard.service.TemplateNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(CardNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleCardNotFound(CardNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("ECARD_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(TemplateNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleTemplateNotFound(TemplateNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("ECARD_TEMPLATE_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(ArtworkNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleArtworkNotFound(ArtworkNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("ECARD_ARTWORK_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(InvalidCardRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidCardRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ECARD_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ECARD_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler({
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestPartException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiErrorResponse> handleMalformed(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ECARD_BAD_REQUEST", "malformed request"));
  }

  @ExceptionHandler(CardAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(CardAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse("ECARD_FORBIDDEN", ex.getMessage()));
  }

  @ExceptionHandler(DuplicateKeyException.class)
  public ResponseEntity<ApiErrorResponse> handleDuplicate(DuplicateKeyException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("ECARD_CONFLICT", "resource already exists"));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(new ApiErrorResponse("ECARD_UPLOAD_TOO_LARGE", "upload exceeds the size limit"));
  }

  @ExceptionHandler(DeliveryFailedException.class)
  public ResponseEntity<ApiErrorResponse> handleDeliveryFailed(DeliveryFailedException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ApiErrorResponse("ECARD_DELIVERY_FAILED", ex.getMessage()));
  }

  @ExceptionHandler(ArtworkStorageException.class)
  public ResponseEntity<ApiErrorResponse> handleArtworkStorage(ArtworkStorageException ex) {
    logger.error("artwork storage failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("ECARD_STORAGE_ERROR", "artwork storage failure"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled request failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("ECARD_INTERNAL_ERROR", "internal error"));
  }
}
