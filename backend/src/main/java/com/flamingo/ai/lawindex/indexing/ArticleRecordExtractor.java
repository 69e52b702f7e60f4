package com.flamingo.ai.lawindex.indexing;

import com.flamingo.ai.lawindex.config.LawIndexConfig;
import com.flamingo.ai.lawindex.model.Article;
import com.flamingo.ai.lawindex.model.ArticleRecord;
import com.flamingo.ai.lawindex.model.Chapter;
import com.flamingo.ai.lawindex.model.LegalDocument;
import com.flamingo.ai.lawindex.postprocess.ArticleTextPostProcessor;
import com.flamingo.ai.lawindex.rendering.ArticleTextRenderer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns every article of a parsed statute into an {@link ArticleRecord}: render, strip trailing
 * boilerplate, attach the citation. The preamble and chapter free text are not indexed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ArticleRecordExtractor {

  private final ArticleTextRenderer renderer;
  private final ArticleTextPostProcessor postProcessor;
  private final LawIndexConfig config;

  /**
   * Extracts the records of one document.
   *
   * @param document parsed statute
   * @return one record per article, in document order
   */
  public List<ArticleRecord> extract(LegalDocument document) {
    boolean expandCitation = config.getRendering().isExpandCitation();
    List<ArticleRecord> records = new ArrayList<>();
    for (Chapter chapter : document.chapters()) {
      for (Article article : chapter.articles()) {
        String content = postProcessor.process(renderer.render(article, expandCitation));
        if (content.isBlank()) {
          log.warn(
              "Article {} of '{}' is empty after boilerplate removal",
              article.number(),
              document.lawIdentifier());
        }
        records.add(ArticleRecord.of(article.number(), content, document.lawIdentifier()));
      }
    }
    return records;
  }
}
