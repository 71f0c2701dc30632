package org.a11yrag.retrieval_service.index;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.config.PartitionIndexConfig;
import org.a11yrag.retrieval_service.model.Partition;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.stereotype.Component;

/**
 * Opens one {@link LuceneVectorIndex} per partition and serves them to the fan-out. Indexes live in
 * {@code index.base-dir/<collection name>}, or in memory when no base directory is configured.
 */
@Slf4j
@Component
public class PartitionIndexManager implements VectorIndexRegistry {

  private final PartitionIndexConfig config;
  private final Embedder embedder;
  private final Map<Partition, LuceneVectorIndex> indexes = new EnumMap<>(Partition.class);

  public PartitionIndexManager(PartitionIndexConfig config, Embedder embedder) {
    this.config = config;
    this.embedder = embedder;
  }

  /**
   * Opens the index of every partition that is not open yet.
   *
   * @throws IllegalStateException if an index cannot be opened
   */
  public synchronized void openAll() {
    for (Partition partition : Partition.values()) {
      if (!indexes.containsKey(partition)) {
        log.info(
            "Opening index {} [{}]",
            partition.getCollectionName(),
            config.isInMemory() ? "in-memory" : resolvePath(partition));
        indexes.put(partition, LuceneVectorIndex.open(partition, openDirectory(partition), embedder));
      }
    }
  }

  @Override
  public synchronized Optional<VectorIndex> find(Partition partition) {
    LuceneVectorIndex index = indexes.get(partition);
    return index == null || !index.isOpen() ? Optional.empty() : Optional.of(index);
  }

  /**
   * Routes each chunk to the index of its partition.
   *
   * @return number of chunks indexed
   * @throws IllegalStateException if the partition of a chunk has no open index
   */
  public int indexChunks(Collection<IndexedChunk> chunks) {
    Map<Partition, List<IndexedChunk>> byPartition = new EnumMap<>(Partition.class);
    for (IndexedChunk chunk : chunks) {
      byPartition
          .computeIfAbsent(chunk.metadata().documentType(), p -> new ArrayList<>())
          .add(chunk);
    }
    byPartition.forEach(
        (partition, list) -> {
          LuceneVectorIndex index = indexes.get(partition);
          if (index == null) {
            throw new IllegalStateException("No open index for partition " + partition);
          }
          index.index(list);
          log.info("{} chunks indexed into {}", list.size(), partition.getCollectionName());
        });
    return chunks.size();
  }

  /** Live chunk count per open partition. */
  public synchronized Map<Partition, Integer> sizes() {
    Map<Partition, Integer> sizes = new EnumMap<>(Partition.class);
    indexes.forEach(
        (partition, index) -> {
          if (index.isOpen()) {
            sizes.put(partition, index.size());
          }
        });
    return sizes;
  }

  @PreDestroy
  public synchronized void closeAll() {
    log.info("Closing all vector indexes...");
    indexes.values().forEach(LuceneVectorIndex::close);
    indexes.clear();
  }

  private Directory openDirectory(Partition partition) {
    if (config.isInMemory()) {
      return new ByteBuffersDirectory();
    }
    Path path = resolvePath(partition);
    try {
      return FSDirectory.open(path);
    } catch (IOException e) {
      log.error("Error opening index directory {}", path, e);
      throw new IllegalStateException("Failed to open index directory " + path, e);
    }
  }

  private Path resolvePath(Partition partition) {
    return Paths.get(config.getBaseDir(), partition.getCollectionName());
  }
}
