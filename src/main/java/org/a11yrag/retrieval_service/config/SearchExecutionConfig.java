package org.a11yrag.retrieval_service.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SearchExecutionConfig {

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService searchExecutor(@Value("${search.execution.pool-size:8}") int poolSize) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable, "search-fanout-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(Math.max(2, poolSize), threadFactory);
  }

  @Bean
  public Clock retrievalClock() {
    return Clock.systemUTC();
  }
}
