package org.a11yrag.retrieval_service.exceptions;

import lombok.Getter;

@Getter
public class InvalidRetrievalRequestException extends RetrievalException {

  /** Request field that failed validation, or {@code null} if not field-specific. */
  private final String field;

  public InvalidRetrievalRequestException(String field, String message) {
    super(FailureReason.INVALID_REQUEST, message);
    this.field = field;
  }
}
