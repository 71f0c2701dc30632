package org.a11yrag.retrieval_service.authority.service;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.authority.model.AuthorityBasis;
import org.a11yrag.retrieval_service.authority.model.AuthorityLevel;
import org.a11yrag.retrieval_service.authority.model.AuthorityRecord;
import org.a11yrag.retrieval_service.config.AuthorityConfig;
import org.a11yrag.retrieval_service.model.DocumentHit;
import org.a11yrag.retrieval_service.model.Partition;
import org.a11yrag.retrieval_service.model.SourceMetadata;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * Resolves the authority of a hit's source. Lookup order:
 *
 * <ol>
 *   <li>known author in the {@link AuthorityStore}; for multi-author strings the highest level
 *       among known authors wins
 *   <li>affiliation keywords (standards bodies, vendors, academia, accessibility consultancies)
 *   <li>default level of the hit's partition
 * </ol>
 *
 * Never fails and never writes to the store.
 */
@Slf4j
@Component
public class AuthorityResolver implements InitializingBean {

  static final Map<Partition, AuthorityLevel> DEFAULT_LEVELS = new EnumMap<>(Partition.class);

  static {
    DEFAULT_LEVELS.put(Partition.STANDARDS, AuthorityLevel.NORMATIVE);
    DEFAULT_LEVELS.put(Partition.ACADEMIC, AuthorityLevel.PEER_REVIEWED);
    DEFAULT_LEVELS.put(Partition.AUDITS, AuthorityLevel.PROFESSIONAL);
    DEFAULT_LEVELS.put(Partition.TRANSCRIPTS, AuthorityLevel.PROFESSIONAL);
    DEFAULT_LEVELS.put(Partition.BLOGS, AuthorityLevel.COMMUNITY);
    DEFAULT_LEVELS.put(Partition.NEWSLETTERS, AuthorityLevel.COMMUNITY);
  }

  /** Evaluated in order; the first matching rule decides. */
  private static final List<AffiliationRule> AFFILIATION_RULES =
      List.of(
          AffiliationRule.of(
              AuthorityLevel.NORMATIVE, "w3c", "world wide web consortium", "iso"),
          AffiliationRule.of(
              AuthorityLevel.PROFESSIONAL,
              "google",
              "microsoft",
              "apple",
              "mozilla",
              "adobe",
              "facebook",
              "meta"),
          AffiliationRule.of(
              AuthorityLevel.PEER_REVIEWED, "university", "college", "institute", "research"),
          AffiliationRule.of(
              AuthorityLevel.PROFESSIONAL,
              "accessibility",
              "usability",
              "inclusive",
              "deque",
              "tpg",
              "paciello"));

  private final AuthorityStore authorityStore;
  private final AuthorityConfig authorityConfig;
  private final Map<Partition, AuthorityLevel> defaults = new EnumMap<>(Partition.class);

  public AuthorityResolver(AuthorityStore authorityStore, AuthorityConfig authorityConfig) {
    this.authorityStore = authorityStore;
    this.authorityConfig = authorityConfig;
  }

  @Override
  public void afterPropertiesSet() {
    defaults.clear();
    defaults.putAll(DEFAULT_LEVELS);
    authorityConfig
        .getDefaults()
        .forEach(
            (name, level) -> {
              Partition partition =
                  Partition.fromName(name)
                      .orElseThrow(
                          () ->
                              new IllegalStateException(
                                  "Unknown partition in authority.defaults: " + name));
              try {
                defaults.put(partition, AuthorityLevel.fromValue(level));
              } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid authority.defaults." + name, e);
              }
            });
  }

  /**
   * @param hit a retrieved hit
   * @return the authority record of the hit's source, never null
   */
  public AuthorityRecord resolve(DocumentHit hit) {
    SourceMetadata metadata = hit.metadata();
    String authorId = metadata.authorId();

    Optional<AuthorityRecord> known = lookupKnown(authorId);
    if (known.isPresent()) {
      return known.get();
    }

    Optional<AuthorityLevel> fromAffiliation = levelFromAffiliation(metadata.affiliation());
    if (fromAffiliation.isPresent()) {
      return new AuthorityRecord(
          authorId, fromAffiliation.get(), Set.of(), AuthorityBasis.AFFILIATION);
    }

    Partition type = metadata.documentType() != null ? metadata.documentType() : hit.partition();
    log.debug("No authority for author '{}', using {} default", authorId, type);
    return new AuthorityRecord(
        authorId, defaultLevel(type), Set.of(), AuthorityBasis.DOCUMENT_TYPE_DEFAULT);
  }

  public AuthorityLevel defaultLevel(Partition partition) {
    AuthorityLevel level = defaults.get(partition);
    return level != null ? level : DEFAULT_LEVELS.get(partition);
  }

  private Optional<AuthorityRecord> lookupKnown(String authorId) {
    if (authorId == null || authorId.isBlank()) {
      return Optional.empty();
    }
    Optional<AuthorityRecord> whole = authorityStore.lookup(authorId);
    if (whole.isPresent()) {
      return whole;
    }
    List<String> authors = AuthorNameNormalizer.splitAuthors(authorId);
    if (authors.size() < 2) {
      return Optional.empty();
    }
    AuthorityRecord best = null;
    for (String author : authors) {
      Optional<AuthorityRecord> record = authorityStore.lookup(author);
      if (record.isPresent()
          && (best == null || record.get().level().value() > best.level().value())) {
        best = record.get();
      }
    }
    return Optional.ofNullable(best).map(record -> record.withAuthorId(authorId));
  }

  static Optional<AuthorityLevel> levelFromAffiliation(String affiliation) {
    if (affiliation == null || affiliation.isBlank()) {
      return Optional.empty();
    }
    String lower = affiliation.toLowerCase(Locale.ROOT);
    for (AffiliationRule rule : AFFILIATION_RULES) {
      if (rule.pattern().matcher(lower).find()) {
        return Optional.of(rule.level());
      }
    }
    return Optional.empty();
  }

  private record AffiliationRule(AuthorityLevel level, Pattern pattern) {

    static AffiliationRule of(AuthorityLevel level, String... keywords) {
      StringBuilder regex = new StringBuilder("\\b(?:");
      for (int i = 0; i < keywords.length; i++) {
        if (i > 0) {
          regex.append('|');
        }
        regex.append(Pattern.quote(keywords[i]));
      }
      regex.append(")\\b");
      return new AffiliationRule(level, Pattern.compile(regex.toString()));
    }
  }
}
