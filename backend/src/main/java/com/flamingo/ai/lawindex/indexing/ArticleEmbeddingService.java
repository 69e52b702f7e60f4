package com.flamingo.ai.lawindex.indexing;

import com.flamingo.ai.lawindex.exception.ArticleIndexingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Embeds batches of article segments with the configured {@link EmbeddingModel}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleEmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a batch of segments.
   *
   * @param segments article segments
   * @return one embedding per segment, in the same order
   */
  @Timed(value = "law.embedding.batch", description = "Time to embed a batch of articles")
  @Retry(name = "lawIndexing", fallbackMethod = "embedBatchFallback")
  public List<Embedding> embedBatch(List<TextSegment> segments) {
    log.debug("Embedding batch of {} articles", segments.size());
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<Embedding> embeddings = response.content();
    if (embeddings == null || embeddings.size() != segments.size()) {
      throw new ArticleIndexingException(
          String.format(
              "Embedding model returned %d vectors for %d articles",
              embeddings == null ? 0 : embeddings.size(), segments.size()));
    }
    meterRegistry.counter("law.embedding.success").increment(segments.size());
    return embeddings;
  }

  @SuppressWarnings("unused")
  private List<Embedding> embedBatchFallback(List<TextSegment> segments, Throwable t) {
    log.error("Embedding batch of {} articles failed: {}", segments.size(), t.getMessage());
    meterRegistry.counter("law.embedding.failure").increment(segments.size());
    throw new ArticleIndexingException("Failed to embed articles", t);
  }
}
