package org.a11yrag.retrieval_service.index;

import java.util.Optional;
import org.a11yrag.retrieval_service.model.Partition;

/** Looks up the vector index serving a partition. */
@FunctionalInterface
public interface VectorIndexRegistry {

  Optional<VectorIndex> find(Partition partition);
}
