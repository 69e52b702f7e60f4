package com.flamingo.ai.lawindex.indexing;

import com.flamingo.ai.lawindex.ingestion.LawSourceLoader;
import com.flamingo.ai.lawindex.model.ArticleRecord;
import com.flamingo.ai.lawindex.model.LawSource;
import com.flamingo.ai.lawindex.model.LegalDocument;
import com.flamingo.ai.lawindex.parsing.StatuteParser;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Orchestrates statute indexing: load, parse, extract article records, index.
 *
 * <p>Each statute is parsed as an independent task on the {@code lawParsingExecutor}; parsing
 * shares no state between documents, so no coordination beyond collecting the results in input
 * order is needed.
 */
@Service
@Slf4j
public class LawIndexingService {

  private final LawSourceLoader sourceLoader;
  private final StatuteParser parser;
  private final ArticleRecordExtractor recordExtractor;
  private final ArticleIndexer indexer;
  private final Executor parsingExecutor;
  private final MeterRegistry meterRegistry;

  public LawIndexingService(
      LawSourceLoader sourceLoader,
      StatuteParser parser,
      ArticleRecordExtractor recordExtractor,
      ArticleIndexer indexer,
      @Qualifier("lawParsingExecutor") Executor parsingExecutor,
      MeterRegistry meterRegistry) {
    this.sourceLoader = sourceLoader;
    this.parser = parser;
    this.recordExtractor = recordExtractor;
    this.indexer = indexer;
    this.parsingExecutor = parsingExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Runs the full pipeline over the configured dataset.
   *
   * @return counts for the run
   */
  @Timed(value = "law.indexing", description = "Time to index the law dataset")
  public IndexingReport indexAll() {
    try {
      List<LawSource> sources = sourceLoader.load();
      List<LegalDocument> documents = parseAll(sources);
      List<ArticleRecord> records = extractRecords(documents);
      log.info("Built {} article records from {} laws", records.size(), documents.size());

      int indexed = records.isEmpty() ? 0 : indexer.index(records);
      meterRegistry.counter("law.indexing.success").increment();
      log.info("Indexed {} article records", indexed);
      return new IndexingReport(documents.size(), records.size(), indexed);
    } catch (RuntimeException e) {
      meterRegistry.counter("law.indexing.failure").increment();
      log.error("Law indexing failed: {}", e.getMessage());
      throw e;
    }
  }

  /**
   * Parses statutes concurrently.
   *
   * @param sources statutes to parse
   * @return parsed documents in the same order as {@code sources}
   */
  public List<LegalDocument> parseAll(List<LawSource> sources) {
    List<CompletableFuture<LegalDocument>> futures = new ArrayList<>(sources.size());
    for (LawSource source : sources) {
      futures.add(
          CompletableFuture.supplyAsync(
              () -> parser.parse(source.lawIdentifier(), source.rawText()), parsingExecutor));
    }

    List<LegalDocument> documents = new ArrayList<>(futures.size());
    for (CompletableFuture<LegalDocument> future : futures) {
      try {
        documents.add(future.join());
      } catch (CompletionException e) {
        if (e.getCause() instanceof RuntimeException cause) {
          throw cause;
        }
        throw e;
      }
    }
    return documents;
  }

  /**
   * Builds the article records of the given documents.
   *
   * @param documents parsed statutes
   * @return records of all documents, grouped by document in input order
   */
  public List<ArticleRecord> extractRecords(List<LegalDocument> documents) {
    List<ArticleRecord> records = new ArrayList<>();
    for (LegalDocument document : documents) {
      records.addAll(recordExtractor.extract(document));
    }
    return records;
  }
}
