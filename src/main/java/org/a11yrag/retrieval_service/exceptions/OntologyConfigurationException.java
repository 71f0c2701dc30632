package org.a11yrag.retrieval_service.exceptions;

/**
 * Raised when an ontology schema cannot be turned into a servable graph: unreadable or malformed
 * JSON, duplicate or dangling concept ids, or a cycle in the parent/child hierarchy.
 *
 * <p>Fatal at startup. During an administrative reload it aborts the reload and the previous
 * snapshot keeps serving.
 */
public class OntologyConfigurationException extends RetrievalException {

  public OntologyConfigurationException(String message) {
    super(FailureReason.CONFIGURATION_ERROR, message);
  }

  public OntologyConfigurationException(String message, Throwable cause) {
    super(FailureReason.CONFIGURATION_ERROR, message, cause);
  }
}
