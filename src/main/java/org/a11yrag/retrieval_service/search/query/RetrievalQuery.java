package org.a11yrag.retrieval_service.search.query;

import java.time.Instant;
import java.util.Objects;
import org.a11yrag.retrieval_service.model.Partition;
import org.a11yrag.retrieval_service.search.intent.Intent;

/**
 * A single retrieval request after validation. Lives for one request only.
 *
 * @param text raw query text, not blank
 * @param documentType optional partition filter, null for none
 * @param intentOverride optional intent that bypasses classification, null for none
 * @param deadline instant by which the whole request must complete
 */
public record RetrievalQuery(
    String text, Partition documentType, Intent intentOverride, Instant deadline) {

  public RetrievalQuery {
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(deadline, "deadline must not be null");
  }

  public static RetrievalQuery of(String text, Instant deadline) {
    return new RetrievalQuery(text, null, null, deadline);
  }

  public boolean hasDocumentTypeFilter() {
    return documentType != null;
  }
}
