package com.flamingo.ai.lawindex.indexing;

import com.flamingo.ai.lawindex.config.LawIndexConfig;
import com.flamingo.ai.lawindex.exception.ArticleIndexingException;
import com.flamingo.ai.lawindex.model.ArticleRecord;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link ArticleIndexer} backed by a LangChain4j {@link EmbeddingStore}.
 *
 * <p>Each record becomes a {@link TextSegment} whose text is the article content and whose
 * metadata is {@link ArticleRecord#metadata()}. The store id is derived from the citation, so an
 * article indexed again replaces its previous entry. Records are embedded and stored batch by
 * batch, so a retried embedding call never stores a batch twice. An {@link InMemoryEmbeddingStore}
 * is serialized to the configured store path once all batches are stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingStoreArticleIndexer implements ArticleIndexer {

  private final ArticleEmbeddingService embeddingService;
  private final EmbeddingStore<TextSegment> embeddingStore;
  private final LawIndexConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  public int index(List<ArticleRecord> records) {
    Map<String, TextSegment> segmentsById = new LinkedHashMap<>();
    for (ArticleRecord record : records) {
      if (record.content().isBlank()) {
        log.warn("Skipping {} with empty content", record.citation());
        continue;
      }
      TextSegment segment = TextSegment.from(record.content(), Metadata.from(record.metadata()));
      if (segmentsById.put(idFor(record), segment) != null) {
        log.warn("{} appears more than once, keeping the last occurrence", record.citation());
      }
    }
    List<String> ids = new ArrayList<>(segmentsById.keySet());
    List<TextSegment> segments = new ArrayList<>(segmentsById.values());

    int batchSize = Math.max(1, config.getIndexing().getBatchSize());
    int stored = 0;
    for (int start = 0; start < segments.size(); start += batchSize) {
      int end = Math.min(start + batchSize, segments.size());
      List<String> batchIds = ids.subList(start, end);
      List<TextSegment> batch = segments.subList(start, end);
      List<Embedding> embeddings = embeddingService.embedBatch(batch);
      try {
        // re-indexing a law replaces its articles instead of adding copies
        embeddingStore.removeAll(batchIds);
        embeddingStore.addAll(batchIds, embeddings, batch);
      } catch (RuntimeException e) {
        meterRegistry.counter("law.store.failure").increment();
        throw new ArticleIndexingException("Failed to store articles: " + e.getMessage(), e);
      }
      stored += batch.size();
      log.info("Stored {}/{} articles", stored, segments.size());
    }

    meterRegistry.counter("law.store.indexed").increment(stored);
    persist();
    return stored;
  }

  /** Stable store id of an article, derived from its citation. */
  static String idFor(ArticleRecord record) {
    return UUID.nameUUIDFromBytes(record.citation().getBytes(StandardCharsets.UTF_8)).toString();
  }

  private void persist() {
    if (!(embeddingStore instanceof InMemoryEmbeddingStore<TextSegment> inMemoryStore)) {
      return;
    }
    Path storePath = Path.of(config.getIndexing().getStorePath());
    try {
      Path parent = storePath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      inMemoryStore.serializeToFile(storePath);
      log.info("Embedding store saved to {}", storePath);
    } catch (IOException | RuntimeException e) {
      throw new ArticleIndexingException(
          "Failed to save embedding store to " + storePath + ": " + e.getMessage(), e);
    }
  }
}
