package org.a11yrag.retrieval_service.search.routing;

import java.util.Objects;
import org.a11yrag.retrieval_service.model.Partition;

/**
 * One partition selected for search and its prior weight for fusion.
 *
 * @param partition partition to search
 * @param weight prior weight in [0,1]
 */
public record PartitionRoute(Partition partition, double weight) {

  public PartitionRoute {
    Objects.requireNonNull(partition, "partition must not be null");
    if (weight < 0.0 || weight > 1.0 || Double.isNaN(weight)) {
      throw new IllegalArgumentException("Route weight must be in [0,1], got " + weight);
    }
  }
}
