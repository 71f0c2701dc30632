package org.a11yrag.retrieval_service.config;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.exceptions.FailureReason;
import org.a11yrag.retrieval_service.exceptions.InvalidRetrievalRequestException;
import org.a11yrag.retrieval_service.exceptions.RetrievalException;
import org.a11yrag.retrieval_service.rest.ApiError;
import org.a11yrag.retrieval_service.rest.RestResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(RetrievalException.class)
  public ResponseEntity<RestResponse<Void>> handleRetrieval(RetrievalException ex) {
    FailureReason reason = ex.getReason();
    HttpStatus status = statusFor(reason);
    String field =
        ex instanceof InvalidRetrievalRequestException
            ? ((InvalidRetrievalRequestException) ex).getField()
            : null;
    if (reason == FailureReason.CONFIGURATION_ERROR) {
      log.error("Configuration error: {}", ex.getMessage(), ex);
    } else {
      log.debug("Request failed with {}: {}", reason, ex.getMessage());
    }
    ApiError error = new ApiError(reason.name(), field, ex.getMessage(), status.value());
    return ResponseEntity.status(status)
        .body(RestResponse.error("Retrieval failed", List.of(error)));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<RestResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
    List<ApiError> errors = new ArrayList<>();
    for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
      errors.add(
          new ApiError(
              FailureReason.INVALID_REQUEST.name(),
              fieldError.getField(),
              fieldError.getDefaultMessage(),
              HttpStatus.BAD_REQUEST.value()));
    }
    return ResponseEntity.badRequest().body(RestResponse.error("Invalid request", errors));
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<RestResponse<Void>> handleUnreadable(Exception ex) {
    ApiError error =
        new ApiError(
            FailureReason.INVALID_REQUEST.name(),
            null,
            "Malformed request",
            HttpStatus.BAD_REQUEST.value());
    return ResponseEntity.badRequest().body(RestResponse.error("Invalid request", List.of(error)));
  }

  // Catch-all for other exceptions
  @ExceptionHandler(Exception.class)
  public ResponseEntity<RestResponse<Void>> handleGeneric(Exception ex) {
    log.error("Unexpected error", ex);
    ApiError error =
        new ApiError(
            FailureReason.INTERNAL_ERROR.name(),
            null,
            "Internal server error",
            HttpStatus.INTERNAL_SERVER_ERROR.value());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(RestResponse.error("Operation failed", List.of(error)));
  }

  static HttpStatus statusFor(FailureReason reason) {
    switch (reason) {
      case RETRIEVAL_UNAVAILABLE:
        return HttpStatus.SERVICE_UNAVAILABLE;
      case DEADLINE_EXCEEDED:
        return HttpStatus.GATEWAY_TIMEOUT;
      case INVALID_REQUEST:
        return HttpStatus.BAD_REQUEST;
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }
}
