package org.a11yrag.retrieval_service.index;

import java.util.Objects;
import org.a11yrag.retrieval_service.model.SourceMetadata;

/** A pre-chunked piece of a source document, ready to be embedded and indexed. */
public record IndexedChunk(String documentId, String chunkId, String text, SourceMetadata metadata) {

  public IndexedChunk {
    Objects.requireNonNull(documentId, "documentId must not be null");
    Objects.requireNonNull(chunkId, "chunkId must not be null");
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(metadata, "metadata must not be null");
    Objects.requireNonNull(metadata.documentType(), "metadata.documentType must not be null");
  }

  public String key() {
    return documentId + "#" + chunkId;
  }
}
