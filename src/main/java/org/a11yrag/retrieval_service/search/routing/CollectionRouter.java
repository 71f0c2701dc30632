package org.a11yrag.retrieval_service.search.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.config.RoutingConfig;
import org.a11yrag.retrieval_service.model.Partition;
import org.a11yrag.retrieval_service.search.intent.Intent;
import org.a11yrag.retrieval_service.search.query.ExpandedQuery;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * Chooses the partitions to search and their prior weights.
 *
 * <p>An explicit document-type filter wins: only that partition is searched, with weight 1.0.
 * Otherwise the intent row of the routing table applies; {@link Intent#UNKNOWN} searches every
 * partition with a uniform weight. Routes are ordered by weight, highest first, then by partition
 * declaration order.
 */
@Slf4j
@Component
public class CollectionRouter implements InitializingBean {

  private static final Comparator<PartitionRoute> ROUTE_ORDER =
      Comparator.comparingDouble(PartitionRoute::weight)
          .reversed()
          .thenComparing(PartitionRoute::partition);

  private final RoutingConfig routingConfig;
  private final Map<Intent, List<PartitionRoute>> table = new EnumMap<>(Intent.class);

  public CollectionRouter(RoutingConfig routingConfig) {
    this.routingConfig = routingConfig;
  }

  @Override
  public void afterPropertiesSet() {
    table.clear();
    table.putAll(defaultTable());
    applyOverrides(routingConfig.getTable());

    List<PartitionRoute> all = new ArrayList<>();
    for (Partition partition : Partition.values()) {
      all.add(new PartitionRoute(partition, routingConfig.getUnknownWeight()));
    }
    table.put(Intent.UNKNOWN, List.copyOf(all));
    table.forEach((intent, routes) -> log.debug("Routing {} -> {}", intent, routes));
  }

  /**
   * @param intent classified intent
   * @param expandedQuery expanded query, consulted for the document-type filter
   * @return non-empty ordered list of routes
   */
  public List<PartitionRoute> route(Intent intent, ExpandedQuery expandedQuery) {
    Partition filter = expandedQuery.query().documentType();
    if (filter != null) {
      return List.of(new PartitionRoute(filter, 1.0));
    }
    return table.getOrDefault(intent, table.get(Intent.UNKNOWN));
  }

  /** Routing table in effect, for diagnostics. */
  public Map<Intent, List<PartitionRoute>> getTable() {
    return Collections.unmodifiableMap(table);
  }

  static Map<Intent, List<PartitionRoute>> defaultTable() {
    Map<Intent, List<PartitionRoute>> defaults = new EnumMap<>(Intent.class);
    defaults.put(
        Intent.RESEARCH,
        routes(Partition.ACADEMIC, 1.0, Partition.STANDARDS, 0.4, Partition.BLOGS, 0.3));
    defaults.put(
        Intent.STANDARDS,
        routes(Partition.STANDARDS, 1.0, Partition.BLOGS, 0.5, Partition.ACADEMIC, 0.3));
    defaults.put(
        Intent.IMPLEMENTATION,
        routes(Partition.BLOGS, 1.0, Partition.AUDITS, 0.8, Partition.STANDARDS, 0.3));
    defaults.put(
        Intent.TESTING,
        routes(Partition.TRANSCRIPTS, 1.0, Partition.AUDITS, 0.8, Partition.BLOGS, 0.2));
    defaults.put(Intent.NEWS, routes(Partition.NEWSLETTERS, 1.0, Partition.BLOGS, 0.8));
    return defaults;
  }

  private void applyOverrides(Map<String, Map<String, Double>> overrides) {
    if (overrides == null) {
      return;
    }
    overrides.forEach(
        (intentName, row) -> {
          Intent intent =
              Intent.fromName(intentName)
                  .orElseThrow(
                      () ->
                          new IllegalStateException(
                              "Unknown intent in retrieval.routing.table: " + intentName));
          if (intent == Intent.UNKNOWN) {
            throw new IllegalStateException(
                "UNKNOWN intent is routed by retrieval.routing.unknown-weight");
          }
          List<PartitionRoute> routes = new ArrayList<>();
          row.forEach(
              (partitionName, weight) -> {
                Partition partition =
                    Partition.fromName(partitionName)
                        .orElseThrow(
                            () ->
                                new IllegalStateException(
                                    "Unknown partition in retrieval.routing.table."
                                        + intentName
                                        + ": "
                                        + partitionName));
                routes.add(new PartitionRoute(partition, weight));
              });
          if (routes.isEmpty()) {
            throw new IllegalStateException("Empty routing row for intent " + intentName);
          }
          routes.sort(ROUTE_ORDER);
          table.put(intent, List.copyOf(routes));
          log.info("Routing for {} overridden: {}", intent, routes);
        });
  }

  private static List<PartitionRoute> routes(Object... partitionsAndWeights) {
    List<PartitionRoute> routes = new ArrayList<>();
    for (int i = 0; i < partitionsAndWeights.length; i += 2) {
      routes.add(
          new PartitionRoute(
              (Partition) partitionsAndWeights[i], (Double) partitionsAndWeights[i + 1]));
    }
    routes.sort(ROUTE_ORDER);
    return List.copyOf(routes);
  }
}
