package org.a11yrag.retrieval_service.exceptions;

/** The request deadline passed before classification and expansion completed. */
public class DeadlineExceededException extends RetrievalException {

  public DeadlineExceededException(String message) {
    super(FailureReason.DEADLINE_EXCEEDED, message);
  }
}
