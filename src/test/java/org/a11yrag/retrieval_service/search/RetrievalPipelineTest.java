package org.a11yrag.retrieval_service.search;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.a11yrag.retrieval_service.authority.loader.AuthorityRecordsLoader;
import org.a11yrag.retrieval_service.authority.model.AuthorityBasis;
import org.a11yrag.retrieval_service.authority.service.AuthorityResolver;
import org.a11yrag.retrieval_service.authority.service.AuthorityService;
import org.a11yrag.retrieval_service.config.AuthorityConfig;
import org.a11yrag.retrieval_service.config.DomainConfig;
import org.a11yrag.retrieval_service.config.OntologyConfig;
import org.a11yrag.retrieval_service.config.PartitionIndexConfig;
import org.a11yrag.retrieval_service.config.RetrievalConfig;
import org.a11yrag.retrieval_service.config.RoutingConfig;
import org.a11yrag.retrieval_service.exceptions.DeadlineExceededException;
import org.a11yrag.retrieval_service.exceptions.InvalidRetrievalRequestException;
import org.a11yrag.retrieval_service.exceptions.RetrievalUnavailableException;
import org.a11yrag.retrieval_service.exceptions.VectorIndexUnavailableException;
import org.a11yrag.retrieval_service.index.HashingEmbedder;
import org.a11yrag.retrieval_service.index.IndexedChunk;
import org.a11yrag.retrieval_service.index.IndexedHit;
import org.a11yrag.retrieval_service.index.PartitionIndexManager;
import org.a11yrag.retrieval_service.index.VectorIndex;
import org.a11yrag.retrieval_service.index.VectorIndexRegistry;
import org.a11yrag.retrieval_service.model.Partition;
import org.a11yrag.retrieval_service.model.SourceMetadata;
import org.a11yrag.retrieval_service.ontology.domain.DomainClassifier;
import org.a11yrag.retrieval_service.ontology.domain.DomainScore;
import org.a11yrag.retrieval_service.ontology.loader.OntologySchemaLoader;
import org.a11yrag.retrieval_service.ontology.mapper.OntologySchemaMapper;
import org.a11yrag.retrieval_service.ontology.service.DefaultOntologyValidator;
import org.a11yrag.retrieval_service.ontology.service.OntologyService;
import org.a11yrag.retrieval_service.search.fanout.SearchFanout;
import org.a11yrag.retrieval_service.search.fusion.FusionRanker;
import org.a11yrag.retrieval_service.search.fusion.RankedResult;
import org.a11yrag.retrieval_service.search.intent.Intent;
import org.a11yrag.retrieval_service.search.intent.IntentClassifier;
import org.a11yrag.retrieval_service.search.query.QueryVariant;
import org.a11yrag.retrieval_service.search.query.QueryExpander;
import org.a11yrag.retrieval_service.search.routing.CollectionRouter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

@DisplayName("RetrievalPipeline Tests")
class RetrievalPipelineTest {

  private static final Clock FIXED = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);

  private ExecutorService executor;
  private PartitionIndexManager indexManager;
  private RetrievalConfig retrievalConfig;
  private QueryExpander queryExpander;
  private DomainClassifier domainClassifier;
  private CollectionRouter router;
  private AuthorityResolver authorityResolver;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
    DefaultResourceLoader resourceLoader = new DefaultResourceLoader();

    OntologyConfig ontologyConfig = new OntologyConfig();
    ontologyConfig.setSchemaLocation("classpath:ontology/accessibility-ontology.json");
    ontologyConfig.setStopwords("how, to, fix, issues, the, a, for");
    ontologyConfig.setPhrases("color contrast, text contrast, non-text contrast, focus indicator");
    ontologyConfig.afterPropertiesSet();
    OntologyService ontologyService =
        new OntologyService(
            new OntologySchemaLoader(new OntologySchemaMapper(), resourceLoader),
            new DefaultOntologyValidator(),
            ontologyConfig);
    ontologyService.loadOntology();

    retrievalConfig = new RetrievalConfig();
    retrievalConfig.afterPropertiesSet();
    queryExpander = new QueryExpander(ontologyService, ontologyConfig, retrievalConfig);
    domainClassifier = new DomainClassifier(new DomainConfig(), ontologyService);

    router = new CollectionRouter(new RoutingConfig());
    router.afterPropertiesSet();

    AuthorityConfig authorityConfig = new AuthorityConfig();
    authorityConfig.setRecordsLocation("classpath:authority/test-authority.json");
    AuthorityService authorityService =
        new AuthorityService(new AuthorityRecordsLoader(resourceLoader), authorityConfig);
    authorityService.loadRecords();
    authorityResolver = new AuthorityResolver(authorityService, authorityConfig);
    authorityResolver.afterPropertiesSet();

    indexManager = new PartitionIndexManager(new PartitionIndexConfig(), new HashingEmbedder(128));
    indexManager.openAll();
    indexManager.indexChunks(
        List.of(
            chunk(
                "wcag-2.2",
                "sc-1.4.3",
                "Contrast minimum: text has a color contrast ratio of at least 4.5:1.",
                "w3c-wai",
                LocalDate.of(2023, 10, 5),
                Partition.STANDARDS),
            chunk(
                "audit-2024-017",
                "finding-3",
                "Fix: color contrast of the login button raised to 4.6:1.",
                null,
                LocalDate.of(2024, 3, 14),
                Partition.AUDITS),
            chunk(
                "blog-contrast",
                "p2",
                "How I fix colour contrast issues in design systems.",
                "Leonie Watson",
                LocalDate.of(2022, 2, 1),
                Partition.BLOGS),
            chunk(
                "blog-focus",
                "p1",
                "A visible focus indicator helps keyboard users.",
                "scott-ohara",
                LocalDate.of(2021, 9, 9),
                Partition.BLOGS)));
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    indexManager.closeAll();
    executor.shutdownNow();
    executor.awaitTermination(5, TimeUnit.SECONDS);
  }

  private static IndexedChunk chunk(
      String documentId,
      String chunkId,
      String text,
      String authorId,
      LocalDate date,
      Partition partition) {
    return new IndexedChunk(documentId, chunkId, text, SourceMetadata.of(authorId, date, partition));
  }

  private RetrievalPipeline pipeline(VectorIndexRegistry registry, Clock clock) {
    return new RetrievalPipeline(
        new IntentClassifier(),
        domainClassifier,
        queryExpander,
        router,
        new SearchFanout(executor, registry, retrievalConfig, clock),
        authorityResolver,
        new FusionRanker(retrievalConfig, clock),
        retrievalConfig,
        clock);
  }

  private RetrievalPipeline pipeline() {
    return pipeline(indexManager, FIXED);
  }

  private static List<String> keys(RetrievalResponse response) {
    return response.results().stream().map(r -> r.documentId() + "#" + r.chunkId()).toList();
  }

  private static List<Double> scores(RetrievalResponse response) {
    return response.results().stream().map(RankedResult::score).toList();
  }

  private static RankedResult resultFor(RetrievalResponse response, String documentId) {
    return response.results().stream()
        .filter(r -> r.documentId().equals(documentId))
        .findFirst()
        .orElseThrow();
  }

  /** Index that always fails, standing in for an unreachable partition. */
  private static VectorIndex failing(Partition partition) {
    return new VectorIndex() {
      @Override
      public Partition partition() {
        return partition;
      }

      @Override
      public List<IndexedHit> query(String text, int topK) {
        throw new VectorIndexUnavailableException("Index " + partition + " is offline");
      }
    };
  }

  /** Delegates to a real index after a random pause, so completion order varies between runs. */
  private static VectorIndex delayed(VectorIndex delegate) {
    return new VectorIndex() {
      @Override
      public Partition partition() {
        return delegate.partition();
      }

      @Override
      public List<IndexedHit> query(String text, int topK) {
        try {
          Thread.sleep(ThreadLocalRandom.current().nextLong(0, 25));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new VectorIndexUnavailableException("Interrupted", e);
        }
        return delegate.query(text, topK);
      }
    };
  }

  @Nested
  @DisplayName("End to end")
  class EndToEndTests {

    @Test
    @DisplayName("Should classify, expand, route and rank an implementation query")
    void shouldRetrieveImplementationQuery() {
      RetrievalResponse response = pipeline().retrieve(RetrievalRequest.of("how to fix color contrast issues"));

      assertEquals(Intent.IMPLEMENTATION, response.intent());
      assertFalse(response.intentOverridden());
      assertEquals("how to fix color contrast issues", response.variants().get(0).text());
      assertTrue(response.expandedTerms().contains("colour contrast"));
      assertEquals(Partition.BLOGS, response.routes().get(0).partition());
      assertFalse(response.degraded());
      int searches = response.variants().size() * response.routes().size();
      assertEquals(searches, response.fanout().dispatched());
      assertEquals(searches, response.fanout().succeeded());

      List<RankedResult> results = response.results();
      assertFalse(results.isEmpty());
      for (int i = 0; i < results.size(); i++) {
        assertEquals(i + 1, results.get(i).rank());
        if (i > 0) {
          assertTrue(results.get(i - 1).score() >= results.get(i).score());
        }
      }
      assertEquals(
          results.size(), keys(response).stream().distinct().count(), "results must be unique");
    }

    @Test
    @DisplayName("Should expand color contrast and rank the normative source above the audit")
    void shouldExpandAndRankByAuthority() {
      RetrievalResponse response = pipeline().retrieve(RetrievalRequest.of("how to fix color contrast issues"));

      assertTrue(response.expandedTerms().contains("color accessibility"));
      assertTrue(response.expandedTerms().contains("contrast ratio"));
      List<String> variants = response.variants().stream().map(QueryVariant::text).toList();
      assertTrue(variants.contains("how to fix color accessibility issues"), variants.toString());
      assertTrue(variants.contains("how to fix contrast ratio issues"), variants.toString());

      RankedResult standard = resultFor(response, "wcag-2.2");
      RankedResult audit = resultFor(response, "audit-2024-017");
      assertEquals(5, standard.authorityLevel());
      assertEquals(2, audit.authorityLevel());
      assertTrue(standard.rank() < audit.rank());
    }

    @Test
    @DisplayName("Should report the domains the query touches")
    void shouldReportDomains() {
      RetrievalResponse response =
          pipeline().retrieve(RetrievalRequest.of("color contrast for low vision and screen readers"));

      List<String> domains = response.domains().stream().map(DomainScore::domain).toList();
      assertEquals(List.of("visual", "css"), domains);
      assertEquals(List.of("low vision", "screen reader"), response.domains().get(0).matchedTerms());
    }

    @Test
    @DisplayName("Should attach authority from the authority records")
    void shouldResolveAuthority() {
      RetrievalResponse response = pipeline().retrieve(RetrievalRequest.of("how to fix color contrast issues"));

      RankedResult standard =
          response.results().stream()
              .filter(r -> r.documentId().equals("wcag-2.2"))
              .findFirst()
              .orElseThrow();
      assertEquals(5, standard.authorityLevel());
      assertEquals(AuthorityBasis.KNOWN_AUTHOR, standard.authorityBasis());
    }

    @Test
    @DisplayName("Should return identical rankings for identical requests")
    void shouldBeDeterministic() {
      RetrievalPipeline pipeline = pipeline();
      RetrievalResponse first = pipeline.retrieve(RetrievalRequest.of("how to fix color contrast issues"));
      RetrievalResponse second = pipeline.retrieve(RetrievalRequest.of("how to fix color contrast issues"));

      assertEquals(keys(first), keys(second));
      assertEquals(first.variants(), second.variants());
    }

    @Test
    @DisplayName("Should return identical rankings when partitions answer in varying order")
    void shouldBeDeterministicUnderVaryingLatency() {
      RetrievalPipeline pipeline =
          pipeline(partition -> indexManager.find(partition).map(RetrievalPipelineTest::delayed), FIXED);

      RetrievalResponse first = pipeline.retrieve(RetrievalRequest.of("how to fix color contrast issues"));
      RetrievalResponse second = pipeline.retrieve(RetrievalRequest.of("how to fix color contrast issues"));

      assertFalse(first.degraded());
      assertEquals(keys(first), keys(second));
      assertEquals(scores(first), scores(second));
      assertEquals(keys(pipeline().retrieve(RetrievalRequest.of("how to fix color contrast issues"))), keys(first));
    }

    @Test
    @DisplayName("Should search only the filtered document type")
    void shouldApplyDocumentTypeFilter() {
      RetrievalResponse response =
          pipeline()
              .retrieve(new RetrievalRequest("color contrast", "standards", null, null, null));

      assertEquals(1, response.routes().size());
      assertTrue(response.results().stream().allMatch(r -> r.partition() == Partition.STANDARDS));
    }

    @Test
    @DisplayName("Should honour an intent override and the result count")
    void shouldHonourOverrides() {
      RetrievalResponse response =
          pipeline()
              .retrieve(new RetrievalRequest("color contrast", null, "standards", null, 1));

      assertEquals(Intent.STANDARDS, response.intent());
      assertTrue(response.intentOverridden());
      assertEquals(Partition.STANDARDS, response.routes().get(0).partition());
      assertEquals(1, response.results().size());
    }
  }

  @Nested
  @DisplayName("Failures")
  class FailureTests {

    @Test
    @DisplayName("Should reject blank queries")
    void shouldRejectBlankQuery() {
      InvalidRetrievalRequestException ex =
          assertThrows(
              InvalidRetrievalRequestException.class,
              () -> pipeline().retrieve(RetrievalRequest.of("   ")));
      assertEquals("query", ex.getField());
    }

    @Test
    @DisplayName("Should reject unknown filters and intents")
    void shouldRejectUnknownNames() {
      RetrievalPipeline pipeline = pipeline();

      InvalidRetrievalRequestException type =
          assertThrows(
              InvalidRetrievalRequestException.class,
              () -> pipeline.retrieve(new RetrievalRequest("contrast", "podcasts", null, null, null)));
      InvalidRetrievalRequestException intent =
          assertThrows(
              InvalidRetrievalRequestException.class,
              () -> pipeline.retrieve(new RetrievalRequest("contrast", null, "gossip", null, null)));

      assertEquals("documentType", type.getField());
      assertEquals("intent", intent.getField());
    }

    @Test
    @DisplayName("Should return degraded results from the partition that still answers")
    void shouldDegradeWhenSomePartitionsFail() {
      RetrievalPipeline pipeline =
          pipeline(
              partition ->
                  partition == Partition.BLOGS
                      ? indexManager.find(partition)
                      : Optional.of(failing(partition)),
              FIXED);

      RetrievalResponse response = pipeline.retrieve(RetrievalRequest.of("how to fix color contrast issues"));

      assertEquals(3, response.routes().size());
      assertTrue(response.degraded());
      int variants = response.variants().size();
      assertEquals(variants * 3, response.fanout().dispatched());
      assertEquals(variants * 2, response.fanout().failed());
      assertEquals(variants, response.fanout().succeeded());
      assertFalse(response.results().isEmpty());
      assertTrue(response.results().stream().allMatch(r -> r.partition() == Partition.BLOGS));
    }

    @Test
    @DisplayName("Should fail when the deadline passes before the search starts")
    void shouldFailOnDeadline() {
      RetrievalPipeline pipeline = pipeline(indexManager, new SteppingClock(50));

      assertThrows(
          DeadlineExceededException.class,
          () -> pipeline.retrieve(new RetrievalRequest("color contrast", null, null, 10L, null)));
    }

    @Test
    @DisplayName("Should fail when no partition can be searched")
    void shouldFailWithoutIndexes() {
      RetrievalPipeline pipeline = pipeline(partition -> Optional.empty(), FIXED);

      assertThrows(
          RetrievalUnavailableException.class,
          () -> pipeline.retrieve(RetrievalRequest.of("color contrast")));
    }
  }

  /** Advances by a fixed step every time it is read. */
  private static final class SteppingClock extends Clock {
    private final long stepMillis;
    private Instant now = Instant.parse("2024-06-01T10:00:00Z");

    SteppingClock(long stepMillis) {
      this.stepMillis = stepMillis;
    }

    @Override
    public synchronized Instant instant() {
      Instant current = now;
      now = now.plusMillis(stepMillis);
      return current;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }
  }
}
