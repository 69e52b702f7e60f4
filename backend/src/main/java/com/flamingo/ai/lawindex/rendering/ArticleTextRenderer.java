package com.flamingo.ai.lawindex.rendering;

import com.flamingo.ai.lawindex.model.Article;
import com.flamingo.ai.lawindex.model.Clause;
import com.flamingo.ai.lawindex.model.LegalVocabulary;
import com.flamingo.ai.lawindex.model.Point;
import org.springframework.stereotype.Component;

/**
 * Flattens an {@link Article} into the canonical text block handed to indexing.
 *
 * <p>Output is one line per node, each terminated by {@code \n}:
 *
 * <pre>
 * Điều 1. Phạm vi
 * 1. Nội dung A
 * a) Chi tiết
 * </pre>
 *
 * <p>With citation expansion every clause line is labelled {@code "Khoản <n>"} and carries the
 * article label, and every point line is labelled {@code "Điểm <x>"} and carries its clause's
 * label followed by the article label, so each line can be cited on its own:
 *
 * <pre>
 * Khoản 1. Điều 1 Nội dung A
 * Điểm a) Khoản 1. Điều 1  Chi tiết
 * </pre>
 */
@Component
public class ArticleTextRenderer {

  /**
   * Renders an article.
   *
   * @param article the article to render
   * @param expandCitation whether clause and point lines carry their full citation path
   * @return the rendered text, ending with a line break
   */
  public String render(Article article, boolean expandCitation) {
    String articleLabel = LegalVocabulary.ARTICLE + " " + article.number();
    StringBuilder sb = new StringBuilder();
    sb.append(articleLabel).append(". ").append(article.content()).append('\n');

    String clausePrefix = expandCitation ? articleLabel + " " : "";
    for (Clause clause : article.clauses()) {
      String clauseLabel =
          expandCitation ? LegalVocabulary.CLAUSE + " " + clause.number() : clause.number();
      sb.append(clauseLabel).append(". ").append(clausePrefix).append(clause.content());
      sb.append('\n');

      // point lines repeat the clause line's label verbatim, including its trailing dot
      String pointPrefix = expandCitation ? clauseLabel + ". " + clausePrefix + " " : "";
      for (Point point : clause.points()) {
        String pointLabel =
            expandCitation ? LegalVocabulary.POINT + " " + point.letter() : point.letter();
        sb.append(pointLabel).append(") ").append(pointPrefix).append(point.content());
        sb.append('\n');
      }
    }
    return sb.toString();
  }
}
