package org.a11yrag.retrieval_service.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Overrides for the intent to partition routing table, e.g. {@code
 * retrieval.routing.table.RESEARCH.ACADEMIC=1.0}. Intents present here replace the built-in row
 * for that intent entirely.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "retrieval.routing")
public class RoutingConfig {

  private Map<String, Map<String, Double>> table = new LinkedHashMap<>();
  private double unknownWeight = 0.5;
}
