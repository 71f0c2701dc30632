package org.a11yrag.retrieval_service.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.a11yrag.retrieval_service.model.Partition;
import org.a11yrag.retrieval_service.model.SourceMetadata;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Reads pre-chunked documents from a JSON array:
 *
 * <pre>{@code
 * [{"documentId": "wcag-2.2", "chunkId": "1.4.3", "text": "...", "partition": "standards",
 *   "authorId": "w3c", "affiliation": "W3C", "publicationDate": "2023-10-05",
 *   "title": "...", "superseded": false}]
 * }</pre>
 */
@Component
public class ChunkSeedLoader {

  private final Logger logger = LogManager.getLogger(ChunkSeedLoader.class.getName());

  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper = new ObjectMapper();

  public ChunkSeedLoader(ResourceLoader resourceLoader) {
    this.resourceLoader = resourceLoader;
  }

  /**
   * @param location Spring resource location of the seed file
   * @return chunks in file order
   * @throws IllegalStateException if the file is missing, malformed or a chunk is invalid
   */
  public List<IndexedChunk> load(String location) {
    logger.debug("Loading chunk seed from {}", location);
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new IllegalStateException("Chunk seed not found: " + location);
    }
    List<ChunkSeed> seeds;
    try (InputStream is = resource.getInputStream()) {
      seeds = objectMapper.readValue(is, new TypeReference<List<ChunkSeed>>() {});
    } catch (IOException e) {
      throw new IllegalStateException("Chunk seed unreadable: " + location, e);
    }

    List<IndexedChunk> chunks = new ArrayList<>(seeds.size());
    for (ChunkSeed seed : seeds) {
      chunks.add(toChunk(seed));
    }
    logger.info("{} chunks read from {}", chunks.size(), location);
    return chunks;
  }

  private IndexedChunk toChunk(ChunkSeed seed) {
    String id = seed.getDocumentId() + "#" + seed.getChunkId();
    if (StringUtils.isAnyBlank(seed.getDocumentId(), seed.getChunkId(), seed.getText())) {
      throw new IllegalStateException("Chunk " + id + " lacks documentId, chunkId or text");
    }
    Partition partition =
        Partition.fromName(seed.getPartition())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Unknown partition '" + seed.getPartition() + "' for chunk " + id));
    LocalDate date;
    try {
      date = seed.getPublicationDate() == null ? null : LocalDate.parse(seed.getPublicationDate());
    } catch (DateTimeParseException e) {
      throw new IllegalStateException("Invalid publicationDate for chunk " + id, e);
    }
    SourceMetadata metadata =
        new SourceMetadata(
            seed.getAuthorId(),
            seed.getAffiliation(),
            date,
            partition,
            seed.getTitle(),
            seed.isSuperseded());
    return new IndexedChunk(seed.getDocumentId(), seed.getChunkId(), seed.getText(), metadata);
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class ChunkSeed {
    private String documentId;
    private String chunkId;
    private String text;
    private String partition;
    private String authorId;
    private String affiliation;
    private String publicationDate;
    private String title;
    private boolean superseded;
  }
}
