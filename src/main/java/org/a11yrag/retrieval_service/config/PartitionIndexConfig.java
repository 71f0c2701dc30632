package org.a11yrag.retrieval_service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Per-partition vector index settings, prefix {@code index}. */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "index")
public class PartitionIndexConfig {

  /** Root directory holding one sub-directory per partition. Blank keeps indexes in memory. */
  private String baseDir;

  /** Optional chunk seed file indexed at startup. */
  private String seedLocation;

  /** Embedding vector length. */
  private int dimension = 256;

  public boolean isInMemory() {
    return baseDir == null || baseDir.isBlank();
  }
}
