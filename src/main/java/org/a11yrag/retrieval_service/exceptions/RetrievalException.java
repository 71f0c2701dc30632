package org.a11yrag.retrieval_service.exceptions;

import lombok.Getter;

/**
 * Umbrella exception for all retrieval-related errors.
 *
 * <p>Every subclass carries a {@link FailureReason} so the REST layer can map it to a stable,
 * machine-readable error code without inspecting exception types or messages.
 */
@Getter
public class RetrievalException extends RuntimeException {

  private final FailureReason reason;

  public RetrievalException(FailureReason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public RetrievalException(FailureReason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }
}
