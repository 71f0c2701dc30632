package org.a11yrag.retrieval_service.exceptions;

/** Every dispatched partition search failed or timed out. Callers may retry. */
public class RetrievalUnavailableException extends RetrievalException {

  public RetrievalUnavailableException(String message) {
    super(FailureReason.RETRIEVAL_UNAVAILABLE, message);
  }
}
