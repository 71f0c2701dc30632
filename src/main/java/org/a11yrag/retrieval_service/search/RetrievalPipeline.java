package org.a11yrag.retrieval_service.search;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.authority.service.AuthorityResolver;
import org.a11yrag.retrieval_service.config.RetrievalConfig;
import org.a11yrag.retrieval_service.exceptions.DeadlineExceededException;
import org.a11yrag.retrieval_service.exceptions.InvalidRetrievalRequestException;
import org.a11yrag.retrieval_service.model.Partition;
import org.a11yrag.retrieval_service.ontology.domain.DomainClassifier;
import org.a11yrag.retrieval_service.ontology.domain.DomainScore;
import org.a11yrag.retrieval_service.search.fanout.FanoutResult;
import org.a11yrag.retrieval_service.search.fanout.SearchFanout;
import org.a11yrag.retrieval_service.search.fusion.FusionRanker;
import org.a11yrag.retrieval_service.search.fusion.RankedResult;
import org.a11yrag.retrieval_service.search.intent.Intent;
import org.a11yrag.retrieval_service.search.intent.IntentClassifier;
import org.a11yrag.retrieval_service.search.query.ExpandedQuery;
import org.a11yrag.retrieval_service.search.query.QueryExpander;
import org.a11yrag.retrieval_service.search.query.RetrievalQuery;
import org.a11yrag.retrieval_service.search.routing.CollectionRouter;
import org.a11yrag.retrieval_service.search.routing.PartitionRoute;
import org.springframework.stereotype.Service;

/**
 * Runs one request through classification, expansion, routing, fan-out and fusion.
 *
 * <p>The deadline is fixed when the request arrives. If it has passed before the fan-out starts
 * the request fails with {@link DeadlineExceededException}; during the fan-out it only cuts
 * searches short. Everything except the fan-out runs on the calling thread.
 */
@Slf4j
@Service
public class RetrievalPipeline {

  private final IntentClassifier intentClassifier;
  private final DomainClassifier domainClassifier;
  private final QueryExpander queryExpander;
  private final CollectionRouter collectionRouter;
  private final SearchFanout searchFanout;
  private final AuthorityResolver authorityResolver;
  private final FusionRanker fusionRanker;
  private final RetrievalConfig retrievalConfig;
  private final Clock clock;

  public RetrievalPipeline(
      IntentClassifier intentClassifier,
      DomainClassifier domainClassifier,
      QueryExpander queryExpander,
      CollectionRouter collectionRouter,
      SearchFanout searchFanout,
      AuthorityResolver authorityResolver,
      FusionRanker fusionRanker,
      RetrievalConfig retrievalConfig,
      Clock clock) {
    this.intentClassifier = intentClassifier;
    this.domainClassifier = domainClassifier;
    this.queryExpander = queryExpander;
    this.collectionRouter = collectionRouter;
    this.searchFanout = searchFanout;
    this.authorityResolver = authorityResolver;
    this.fusionRanker = fusionRanker;
    this.retrievalConfig = retrievalConfig;
    this.clock = clock;
  }

  /**
   * @param request caller request
   * @return ranked results, possibly degraded
   * @throws InvalidRetrievalRequestException if the query is blank or a filter name is unknown
   * @throws DeadlineExceededException if the deadline passed before the fan-out
   * @throws org.a11yrag.retrieval_service.exceptions.RetrievalUnavailableException if every
   *     search failed or timed out
   */
  public RetrievalResponse retrieve(RetrievalRequest request) {
    Instant start = clock.instant();
    RetrievalQuery query = toQuery(request, start);
    int resultCount =
        request.resultCount() != null ? request.resultCount() : retrievalConfig.getResultCount();
    return retrieve(query, resultCount, start);
  }

  RetrievalResponse retrieve(RetrievalQuery query, int resultCount, Instant start) {
    boolean overridden = query.intentOverride() != null;
    Intent intent = overridden ? query.intentOverride() : intentClassifier.classify(query.text());

    List<DomainScore> domains = domainClassifier.classify(query.text());
    ExpandedQuery expanded = queryExpander.expand(query, intent);
    List<PartitionRoute> routes = collectionRouter.route(intent, expanded);
    log.debug(
        "Intent {}{}, domains {}, routes {}",
        intent,
        overridden ? " (override)" : "",
        domains.stream().map(DomainScore::domain).toList(),
        routes);

    Instant now = clock.instant();
    if (!now.isBefore(query.deadline())) {
      throw new DeadlineExceededException(
          String.format(
              "Deadline exceeded after %d ms, before search started",
              Duration.between(start, now).toMillis()));
    }
    Instant fanoutDeadline = now.plusMillis(retrievalConfig.getFanoutTimeoutMs());
    if (fanoutDeadline.isAfter(query.deadline())) {
      fanoutDeadline = query.deadline();
    }

    FanoutResult fanout = searchFanout.search(expanded, routes, fanoutDeadline);
    List<RankedResult> results =
        fusionRanker.rank(fanout.hits(), authorityResolver::resolve, resultCount);

    long tookMs = Duration.between(start, clock.instant()).toMillis();
    log.info(
        "Retrieved '{}': intent={} variants={} routes={} hits={} results={} degraded={} took={}ms",
        query.text(),
        intent,
        expanded.variants().size(),
        routes.size(),
        fanout.hits().size(),
        results.size(),
        fanout.degraded(),
        tookMs);

    return new RetrievalResponse(
        query.text(),
        intent,
        overridden,
        domains,
        expanded.expandedTerms(),
        expanded.variants(),
        routes,
        results,
        fanout.degraded(),
        fanout.stats(),
        tookMs);
  }

  private RetrievalQuery toQuery(RetrievalRequest request, Instant start) {
    if (request == null || request.query() == null || request.query().isBlank()) {
      throw new InvalidRetrievalRequestException("query", "Query text must not be blank");
    }
    Partition documentType = null;
    if (request.documentType() != null && !request.documentType().isBlank()) {
      documentType =
          Partition.fromName(request.documentType())
              .orElseThrow(
                  () ->
                      new InvalidRetrievalRequestException(
                          "documentType", "Unknown document type: " + request.documentType()));
    }
    Intent intent = null;
    if (request.intent() != null && !request.intent().isBlank()) {
      intent =
          Intent.fromName(request.intent())
              .orElseThrow(
                  () ->
                      new InvalidRetrievalRequestException(
                          "intent", "Unknown intent: " + request.intent()));
    }
    long timeoutMs =
        request.timeoutMs() != null ? request.timeoutMs() : retrievalConfig.getDefaultTimeoutMs();
    if (timeoutMs <= 0) {
      throw new InvalidRetrievalRequestException("timeoutMs", "Timeout must be positive");
    }
    if (request.resultCount() != null && request.resultCount() <= 0) {
      throw new InvalidRetrievalRequestException("resultCount", "Result count must be positive");
    }
    return new RetrievalQuery(
        request.query().trim(), documentType, intent, start.plusMillis(timeoutMs));
  }
}
