package org.a11yrag.retrieval_service.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Authority store location and per-partition default levels ({@code authority.defaults.AUDITS=2}).
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "authority")
public class AuthorityConfig {

  private String recordsLocation = "classpath:authority/authority-records.json";
  private Map<String, Integer> defaults = new LinkedHashMap<>();
}
