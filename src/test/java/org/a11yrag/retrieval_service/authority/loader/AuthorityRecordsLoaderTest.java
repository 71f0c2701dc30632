package org.a11yrag.retrieval_service.authority.loader;

import static org.junit.jupiter.api.Assertions.*;

import org.a11yrag.retrieval_service.authority.model.AuthorityLevel;
import org.a11yrag.retrieval_service.authority.model.AuthoritySnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

class AuthorityRecordsLoaderTest {
  private AuthorityRecordsLoader loader;

  @BeforeEach
  void setUp() {
    loader = new AuthorityRecordsLoader(new DefaultResourceLoader());
  }

  @Test
  void loadFromResource_withTestRecords_indexesNamesAndAliases() {
    AuthoritySnapshot snapshot = loader.loadFromResource("classpath:authority/test-authority.json");

    assertEquals("test", snapshot.getVersion());
    assertEquals(4, snapshot.size());
    assertEquals("w3c-wai", snapshot.find("WAI").orElseThrow().id());
    assertEquals(AuthorityLevel.EXPERT_INTERPRETIVE, snapshot.find("leonie watson").orElseThrow().level());
    assertTrue(snapshot.find("Nobody Known").isEmpty());
  }

  @Test
  void loadFromResource_withBundledRecords_loads() {
    AuthoritySnapshot snapshot =
        loader.loadFromResource("classpath:authority/authority-records.json");

    assertTrue(snapshot.size() >= 18);
    assertEquals(AuthorityLevel.NORMATIVE, snapshot.find("Michael Cooper").orElseThrow().level());
  }

  @Test
  void loadFromResource_withDuplicateIds_throwsException() {
    IllegalStateException ex =
        assertThrows(
            IllegalStateException.class,
            () -> loader.loadFromResource("classpath:authority/duplicate-authority.json"));
    assertTrue(ex.getMessage().contains("Duplicate author id"));
  }

  @Test
  void loadFromResource_withLevelOutOfRange_throwsException() {
    IllegalStateException ex =
        assertThrows(
            IllegalStateException.class,
            () -> loader.loadFromResource("classpath:authority/bad-level-authority.json"));
    assertTrue(ex.getMessage().contains("Invalid level"));
  }

  @Test
  void loadFromResource_withMissingFile_throwsException() {
    assertThrows(
        IllegalStateException.class, () -> loader.loadFromResource("classpath:authority/none.json"));
  }
}
