package com.flamingo.ai.lawindex.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors used by the indexing pipeline. */
@Configuration
public class AsyncConfig {

  /** Parses statutes in parallel, one task per document. */
  @Bean(name = "lawParsingExecutor")
  public Executor lawParsingExecutor(LawIndexConfig config) {
    int parallelism = Math.max(1, config.getIndexing().getParallelism());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism);
    executor.setMaxPoolSize(parallelism);
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("law-parse-");
    executor.initialize();
    return executor;
  }
}
