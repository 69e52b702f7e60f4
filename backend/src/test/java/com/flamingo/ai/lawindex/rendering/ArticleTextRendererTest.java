package com.flamingo.ai.lawindex.rendering;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.lawindex.model.Article;
import com.flamingo.ai.lawindex.model.Clause;
import com.flamingo.ai.lawindex.model.Point;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ArticleTextRenderer Tests")
class ArticleTextRendererTest {

  private final ArticleTextRenderer renderer = new ArticleTextRenderer();

  private final Article article =
      new Article(
          "1",
          "Phạm vi",
          List.of(new Clause("1", "Nội dung A", List.of(new Point("a", "Chi tiết")))));

  @Test
  @DisplayName("should render bare labels without citation expansion")
  void shouldRenderBareLabels() {
    String text = renderer.render(article, false);

    assertThat(text).isEqualTo("Điều 1. Phạm vi\n1. Nội dung A\na) Chi tiết\n");
  }

  @Test
  @DisplayName("should embed clause and article labels in every line with citation expansion")
  void shouldRenderExpandedCitations() {
    String text = renderer.render(article, true);

    assertThat(text)
        .isEqualTo(
            "Điều 1. Phạm vi\n"
                + "Khoản 1. Điều 1 Nội dung A\n"
                + "Điểm a) Khoản 1. Điều 1  Chi tiết\n");
  }

  @Test
  @DisplayName("should render only the header line for an article without clauses")
  void shouldRenderHeaderOnly() {
    String text = renderer.render(new Article("5đ", "Quy định bổ sung", List.of()), true);

    assertThat(text).isEqualTo("Điều 5đ. Quy định bổ sung\n");
  }

  @Test
  @DisplayName("should render clauses and points in order, one line each")
  void shouldRenderInOrder() {
    Article multi =
        new Article(
            "10",
            "Quyền",
            List.of(
                new Clause("1", "k1", List.of(new Point("a", "p1"), new Point("đ", "p2"))),
                new Clause("2", "k2", List.of())));

    String text = renderer.render(multi, false);

    assertThat(text.split("\n", -1))
        .containsExactly("Điều 10. Quyền", "1. k1", "a) p1", "đ) p2", "2. k2", "");
  }

  @Test
  @DisplayName("should produce identical output when rendering the same article twice")
  void shouldBeIdempotent() {
    assertThat(renderer.render(article, true)).isEqualTo(renderer.render(article, true));
    assertThat(renderer.render(article, false)).isEqualTo(renderer.render(article, false));
  }
}
