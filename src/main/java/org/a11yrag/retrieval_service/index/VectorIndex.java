package org.a11yrag.retrieval_service.index;

import java.util.List;
import org.a11yrag.retrieval_service.exceptions.VectorIndexUnavailableException;
import org.a11yrag.retrieval_service.model.Partition;

/** Nearest-neighbour search over the chunks of one partition. */
public interface VectorIndex {

  Partition partition();

  /**
   * Returns up to {@code topK} chunks most similar to the text, best first.
   *
   * @throws VectorIndexUnavailableException if the index cannot answer (closed, not opened,
   *     embedding or I/O failure); implementations must fail rather than block indefinitely
   */
  List<IndexedHit> query(String text, int topK);
}
