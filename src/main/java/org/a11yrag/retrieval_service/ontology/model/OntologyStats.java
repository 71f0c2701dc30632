package org.a11yrag.retrieval_service.ontology.model;

import java.util.Map;

/** Summary counts for a loaded ontology snapshot. */
public record OntologyStats(
    String version,
    int conceptCount,
    int synonymCount,
    int hierarchyEdgeCount,
    Map<RelationKind, Integer> relationCounts) {}
