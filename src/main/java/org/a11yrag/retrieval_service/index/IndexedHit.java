package org.a11yrag.retrieval_service.index;

import org.a11yrag.retrieval_service.model.SourceMetadata;

/** One nearest neighbour returned by a {@link VectorIndex}; score is in [0,1]. */
public record IndexedHit(String documentId, String chunkId, double score, SourceMetadata metadata) {}
