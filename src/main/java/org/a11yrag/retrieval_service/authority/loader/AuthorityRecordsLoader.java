package org.a11yrag.retrieval_service.authority.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.a11yrag.retrieval_service.authority.model.AuthorProfile;
import org.a11yrag.retrieval_service.authority.model.AuthorityLevel;
import org.a11yrag.retrieval_service.authority.model.AuthoritySnapshot;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Reads known authors from a Spring resource:
 *
 * <pre>{@code
 * {"version": "2024-05",
 *  "authors": [{"id": "steve-faulkner", "name": "Steve Faulkner", "aliases": [],
 *               "level": 4, "expertise": ["html", "aria"]}]}
 * }</pre>
 */
@Component
public class AuthorityRecordsLoader {

  private final Logger logger = LogManager.getLogger(AuthorityRecordsLoader.class.getName());

  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper = new ObjectMapper();

  public AuthorityRecordsLoader(ResourceLoader resourceLoader) {
    this.resourceLoader = resourceLoader;
  }

  /**
   * @throws IllegalStateException if the resource is missing, malformed or has invalid entries
   */
  public AuthoritySnapshot loadFromResource(String resourceLocation) {
    logger.debug("Loading authority records from {}", resourceLocation);
    Resource resource = resourceLoader.getResource(resourceLocation);
    if (!resource.exists()) {
      throw new IllegalStateException("Authority records not found: " + resourceLocation);
    }
    AuthorityRecordsDto dto;
    try (InputStream is = resource.getInputStream()) {
      dto = objectMapper.readValue(is, AuthorityRecordsDto.class);
    } catch (IOException e) {
      throw new IllegalStateException("Authority records unreadable: " + resourceLocation, e);
    }
    return toSnapshot(dto);
  }

  AuthoritySnapshot toSnapshot(AuthorityRecordsDto dto) {
    List<AuthorProfile> profiles = new ArrayList<>();
    Set<String> ids = new HashSet<>();
    for (AuthorityRecordsDto.AuthorDto author : dto.getAuthors()) {
      if (StringUtils.isAnyBlank(author.getId(), author.getName())) {
        throw new IllegalStateException("Author entry without id or name: " + author);
      }
      if (!ids.add(author.getId())) {
        throw new IllegalStateException("Duplicate author id: " + author.getId());
      }
      AuthorityLevel level;
      try {
        level = AuthorityLevel.fromValue(author.getLevel());
      } catch (IllegalArgumentException e) {
        throw new IllegalStateException("Invalid level for author " + author.getId(), e);
      }
      profiles.add(
          new AuthorProfile(
              author.getId(),
              author.getName(),
              author.getAliases(),
              level,
              author.getExpertise() == null ? Set.of() : new HashSet<>(author.getExpertise())));
    }
    try {
      return new AuthoritySnapshot(dto.getVersion(), profiles);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(e.getMessage(), e);
    }
  }
}
