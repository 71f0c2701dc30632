package org.a11yrag.retrieval_service;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.authority.service.AuthorityService;
import org.a11yrag.retrieval_service.config.PartitionIndexConfig;
import org.a11yrag.retrieval_service.index.ChunkSeedLoader;
import org.a11yrag.retrieval_service.index.IndexedChunk;
import org.a11yrag.retrieval_service.index.PartitionIndexManager;
import org.a11yrag.retrieval_service.ontology.service.OntologyService;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Service responsible for initializing application components upon startup.
 *
 * <p>This service listens for the {@link ApplicationReadyEvent} and runs, in order:
 *
 * <ol>
 *   <li>Ontology schema loading and validation
 *   <li>Authority records loading
 *   <li>Opening one vector index per partition
 *   <li>Indexing the chunk seed file, if one is configured
 * </ol>
 *
 * <p>Any failure stops the application from serving.
 */
@Slf4j
@Service
public class InitializationService {

  private final OntologyService ontologyService;
  private final AuthorityService authorityService;
  private final PartitionIndexManager partitionIndexManager;
  private final ChunkSeedLoader chunkSeedLoader;
  private final PartitionIndexConfig partitionIndexConfig;

  public InitializationService(
      OntologyService ontologyService,
      AuthorityService authorityService,
      PartitionIndexManager partitionIndexManager,
      ChunkSeedLoader chunkSeedLoader,
      PartitionIndexConfig partitionIndexConfig) {
    this.ontologyService = ontologyService;
    this.authorityService = authorityService;
    this.partitionIndexManager = partitionIndexManager;
    this.chunkSeedLoader = chunkSeedLoader;
    this.partitionIndexConfig = partitionIndexConfig;
  }

  /**
   * @throws IllegalStateException if any component fails to initialize
   */
  @EventListener(ApplicationReadyEvent.class)
  public void initialize() {
    log.debug("Application initialization started");

    try {
      ontologyService.loadOntology();

      authorityService.loadRecords();

      log.info("Opening vector indexes...");
      partitionIndexManager.openAll();

      String seed = partitionIndexConfig.getSeedLocation();
      if (seed != null && !seed.isBlank()) {
        List<IndexedChunk> chunks = chunkSeedLoader.load(seed);
        partitionIndexManager.indexChunks(chunks);
      }
      log.info("Vector indexes ready: {}", partitionIndexManager.sizes());

      log.info("Application initialization completed successfully");
    } catch (Exception e) {
      log.error("Application initialization failed", e);
      throw new IllegalStateException("Failed to initialize application components", e);
    }
  }
}
