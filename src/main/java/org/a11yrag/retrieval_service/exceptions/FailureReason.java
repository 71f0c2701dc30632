package org.a11yrag.retrieval_service.exceptions;

/** Machine-readable reason codes reported to callers of the retrieval pipeline. */
public enum FailureReason {
  CONFIGURATION_ERROR,
  RETRIEVAL_UNAVAILABLE,
  DEADLINE_EXCEEDED,
  INVALID_REQUEST,
  INTERNAL_ERROR
}
