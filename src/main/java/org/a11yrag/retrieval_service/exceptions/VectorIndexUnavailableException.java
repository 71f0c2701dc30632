package org.a11yrag.retrieval_service.exceptions;

/**
 * Signals that a partition's vector index cannot answer right now (closed, not opened, embedding
 * failed). Distinguishable from programming errors so the fan-out can absorb it and carry on with
 * the remaining partitions.
 */
public class VectorIndexUnavailableException extends RuntimeException {

  public VectorIndexUnavailableException(String message) {
    super(message);
  }

  public VectorIndexUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
