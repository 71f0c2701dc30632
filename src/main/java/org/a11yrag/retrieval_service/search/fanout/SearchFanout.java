package org.a11yrag.retrieval_service.search.fanout;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.config.RetrievalConfig;
import org.a11yrag.retrieval_service.exceptions.RetrievalUnavailableException;
import org.a11yrag.retrieval_service.exceptions.VectorIndexUnavailableException;
import org.a11yrag.retrieval_service.index.IndexedHit;
import org.a11yrag.retrieval_service.index.VectorIndex;
import org.a11yrag.retrieval_service.index.VectorIndexRegistry;
import org.a11yrag.retrieval_service.model.DocumentHit;
import org.a11yrag.retrieval_service.search.query.ExpandedQuery;
import org.a11yrag.retrieval_service.search.query.QueryVariant;
import org.a11yrag.retrieval_service.search.routing.PartitionRoute;
import org.springframework.stereotype.Component;

/**
 * Runs every (variant, partition) search concurrently on the search executor and gathers the hits.
 *
 * <p>All searches share one deadline. Searches still running at the deadline are cancelled and
 * counted as timed out; searches that throw are logged and counted as failed. Only when no search
 * succeeds does the fan-out fail, with {@link RetrievalUnavailableException}.
 */
@Slf4j
@Component
public class SearchFanout {

  private final ExecutorService searchExecutor;
  private final VectorIndexRegistry indexRegistry;
  private final RetrievalConfig retrievalConfig;
  private final Clock clock;

  public SearchFanout(
      ExecutorService searchExecutor,
      VectorIndexRegistry indexRegistry,
      RetrievalConfig retrievalConfig,
      Clock clock) {
    this.searchExecutor = searchExecutor;
    this.indexRegistry = indexRegistry;
    this.retrievalConfig = retrievalConfig;
    this.clock = clock;
  }

  /**
   * @param expandedQuery variants to search
   * @param routes partitions to search, with their prior weights
   * @param deadline instant after which unfinished searches are abandoned
   * @return hits of all successful searches plus per-search outcomes
   * @throws RetrievalUnavailableException if every search failed or timed out
   */
  public FanoutResult search(
      ExpandedQuery expandedQuery, List<PartitionRoute> routes, Instant deadline) {
    List<Dispatched> dispatched = new ArrayList<>();
    for (QueryVariant variant : expandedQuery.variants()) {
      for (PartitionRoute route : routes) {
        dispatched.add(dispatch(variant, route));
      }
    }

    List<SearchTaskOutcome> outcomes = new ArrayList<>(dispatched.size());
    for (Dispatched task : dispatched) {
      outcomes.add(await(task, deadline));
    }

    List<DocumentHit> hits = new ArrayList<>();
    int succeeded = 0;
    int failed = 0;
    int timedOut = 0;
    for (SearchTaskOutcome outcome : outcomes) {
      switch (outcome.status()) {
        case SUCCESS:
          succeeded++;
          hits.addAll(outcome.hits());
          break;
        case TIMED_OUT:
          timedOut++;
          break;
        default:
          failed++;
      }
    }
    FanoutStats stats = new FanoutStats(outcomes.size(), succeeded, failed, timedOut);
    log.debug("Fan-out finished: {}, {} hits", stats, hits.size());

    if (succeeded == 0) {
      throw new RetrievalUnavailableException(
          String.format(
              "All %d partition searches failed (%d errors, %d timeouts)",
              outcomes.size(), failed, timedOut));
    }
    return new FanoutResult(hits, outcomes, stats);
  }

  private Dispatched dispatch(QueryVariant variant, PartitionRoute route) {
    try {
      return new Dispatched(variant, route, searchExecutor.submit(task(variant, route)));
    } catch (RejectedExecutionException e) {
      log.warn(
          "Search rejected [variant='{}', partition={}]: executor saturated",
          variant.text(),
          route.partition());
      return new Dispatched(variant, route, null);
    }
  }

  private Callable<SearchTaskOutcome> task(QueryVariant variant, PartitionRoute route) {
    return () -> {
      long started = System.nanoTime();
      VectorIndex index =
          indexRegistry
              .find(route.partition())
              .orElseThrow(
                  () ->
                      new VectorIndexUnavailableException(
                          "No index for partition " + route.partition()));
      List<IndexedHit> indexed = index.query(variant.text(), retrievalConfig.getTopK());
      List<DocumentHit> hits = new ArrayList<>(indexed.size());
      for (IndexedHit hit : indexed) {
        hits.add(
            new DocumentHit(
                hit.documentId(),
                hit.chunkId(),
                hit.score(),
                route.partition(),
                route.weight(),
                variant.provenance(),
                hit.metadata()));
      }
      return SearchTaskOutcome.success(variant, route, hits, elapsedMs(started));
    };
  }

  private SearchTaskOutcome await(Dispatched task, Instant deadline) {
    if (task.future == null) {
      return SearchTaskOutcome.error(task.variant, task.route, "rejected", 0);
    }
    long remainingMs = Math.max(0, Duration.between(clock.instant(), deadline).toMillis());
    try {
      return task.future.get(remainingMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      task.future.cancel(true);
      log.warn(
          "Search timed out [variant='{}', partition={}]",
          task.variant.text(),
          task.route.partition());
      return SearchTaskOutcome.timedOut(task.variant, task.route);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      String kind = cause.getClass().getSimpleName();
      if (cause instanceof VectorIndexUnavailableException) {
        log.warn(
            "Search failed [variant='{}', partition={}]: {} - {}",
            task.variant.text(),
            task.route.partition(),
            kind,
            cause.getMessage());
      } else {
        log.warn(
            "Search failed [variant='{}', partition={}]: {}",
            task.variant.text(),
            task.route.partition(),
            kind,
            cause);
      }
      return SearchTaskOutcome.error(task.variant, task.route, kind, -1);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      task.future.cancel(true);
      return SearchTaskOutcome.error(task.variant, task.route, "interrupted", -1);
    }
  }

  private static long elapsedMs(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000L;
  }

  private record Dispatched(
      QueryVariant variant, PartitionRoute route, Future<SearchTaskOutcome> future) {}
}
