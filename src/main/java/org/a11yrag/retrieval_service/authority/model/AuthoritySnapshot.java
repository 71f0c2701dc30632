package org.a11yrag.retrieval_service.authority.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.a11yrag.retrieval_service.authority.service.AuthorNameNormalizer;

/**
 * Immutable set of known authors indexed by normalised id, name and aliases. Replaced as a whole
 * on reload.
 */
public final class AuthoritySnapshot {

  private final String version;
  private final List<AuthorProfile> profiles;
  private final Map<String, AuthorProfile> byKey;

  public AuthoritySnapshot(String version, List<AuthorProfile> profiles) {
    this.version = version == null ? "unknown" : version;
    this.profiles = List.copyOf(profiles);
    Map<String, AuthorProfile> keys = new LinkedHashMap<>();
    for (AuthorProfile profile : this.profiles) {
      register(keys, profile.id(), profile);
      register(keys, profile.name(), profile);
      profile.aliases().forEach(alias -> register(keys, alias, profile));
    }
    this.byKey = Map.copyOf(keys);
  }

  public static AuthoritySnapshot empty() {
    return new AuthoritySnapshot("empty", List.of());
  }

  public String getVersion() {
    return version;
  }

  public List<AuthorProfile> getProfiles() {
    return profiles;
  }

  public int size() {
    return profiles.size();
  }

  /** Exact lookup on a normalised id, name or alias, then first/last-name fuzzy match. */
  public Optional<AuthorProfile> find(String authorIdOrName) {
    String key = AuthorNameNormalizer.normalize(authorIdOrName);
    if (key.isEmpty()) {
      return Optional.empty();
    }
    AuthorProfile exact = byKey.get(key);
    if (exact != null) {
      return Optional.of(exact);
    }
    for (AuthorProfile profile : profiles) {
      if (AuthorNameNormalizer.fuzzyMatches(key, AuthorNameNormalizer.normalize(profile.name()))) {
        return Optional.of(profile);
      }
    }
    return Optional.empty();
  }

  private static void register(Map<String, AuthorProfile> keys, String raw, AuthorProfile profile) {
    String key = AuthorNameNormalizer.normalize(raw);
    if (key.isEmpty()) {
      return;
    }
    AuthorProfile existing = keys.putIfAbsent(key, profile);
    if (existing != null && !existing.id().equals(profile.id())) {
      throw new IllegalArgumentException(
          "Authors '" + existing.id() + "' and '" + profile.id() + "' share the key '" + key + "'");
    }
  }
}
