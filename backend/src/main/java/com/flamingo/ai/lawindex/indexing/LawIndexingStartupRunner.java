package com.flamingo.ai.lawindex.indexing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the indexing pipeline once on startup when {@code law-index.indexing.run-on-startup} is
 * {@code true}. A failed run is logged and does not stop the application.
 */
@Component
@ConditionalOnProperty(prefix = "law-index.indexing", name = "run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class LawIndexingStartupRunner implements CommandLineRunner {

  private final LawIndexingService indexingService;

  @Override
  public void run(String... args) {
    try {
      log.info("Starting law indexing...");
      IndexingReport report = indexingService.indexAll();
      log.info(
          "Law indexing complete: {} laws, {} articles, {} indexed",
          report.documentsParsed(),
          report.articlesExtracted(),
          report.recordsIndexed());
    } catch (Exception e) {
      log.error("Law indexing failed: {}", e.getMessage(), e);
    }
  }
}
