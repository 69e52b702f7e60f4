package com.flamingo.ai.lawindex.indexing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import com.flamingo.ai.lawindex.exception.ArticleIndexingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ArticleEmbeddingService Tests")
class ArticleEmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;

  private SimpleMeterRegistry meterRegistry;
  private ArticleEmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    embeddingService = new ArticleEmbeddingService(embeddingModel, meterRegistry);
  }

  @Test
  @DisplayName("should return one embedding per segment")
  void shouldEmbedBatch() {
    List<TextSegment> segments =
        List.of(TextSegment.from("Điều 1. Phạm vi\n"), TextSegment.from("Điều 2. Đối tượng\n"));
    List<Embedding> vectors =
        List.of(Embedding.from(new float[] {0.1f, 0.2f}), Embedding.from(new float[] {0.3f, 0.4f}));
    when(embeddingModel.embedAll(anyList())).thenReturn(Response.from(vectors));

    List<Embedding> result = embeddingService.embedBatch(segments);

    assertThat(result).isEqualTo(vectors);
    assertThat(meterRegistry.counter("law.embedding.success").count()).isEqualTo(2.0);
  }

  @Test
  @DisplayName("should fail when the model returns a different number of vectors")
  void shouldFailOnSizeMismatch() {
    List<TextSegment> segments =
        List.of(TextSegment.from("Điều 1. Phạm vi\n"), TextSegment.from("Điều 2. Đối tượng\n"));
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(Embedding.from(new float[] {0.1f}))));

    assertThatThrownBy(() -> embeddingService.embedBatch(segments))
        .isInstanceOf(ArticleIndexingException.class)
        .hasMessageContaining("1 vectors for 2 articles");
  }
}
