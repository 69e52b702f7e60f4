package com.flamingo.ai.lawindex.parsing;

import com.flamingo.ai.lawindex.model.Article;
import com.flamingo.ai.lawindex.model.Chapter;
import com.flamingo.ai.lawindex.model.Clause;
import com.flamingo.ai.lawindex.model.LegalDocument;
import com.flamingo.ai.lawindex.model.LegalVocabulary;
import com.flamingo.ai.lawindex.model.Point;
import com.flamingo.ai.lawindex.model.Preamble;
import com.flamingo.ai.lawindex.model.RootNode;
import com.google.common.base.CharMatcher;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link StatuteParser} that folds classified lines into a chapter / article / clause / point tree
 * in a single forward pass.
 *
 * <p>Each call works on its own {@link ParseState}, which tracks the innermost open node at every
 * depth. A line either opens a deeper node, opens a sibling (closing everything below it), or is
 * appended to the innermost open node. Clause and point headers only open a node when their parent
 * is open; otherwise they are appended as plain text, so numbered prose outside an article never
 * becomes structure.
 *
 * <p>Nodes are accumulated in mutable builders local to the call and frozen into immutable records
 * once the last line has been consumed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HierarchicalStatuteParser implements StatuteParser {

  private final LegalLineClassifier classifier;

  @Override
  public LegalDocument parse(String lawIdentifier, String rawText) {
    ParseState state = new ParseState();
    if (rawText != null) {
      for (String rawLine : rawText.split("\n")) {
        String line = CharMatcher.whitespace().trimFrom(rawLine);
        if (line.isEmpty()) {
          continue;
        }
        state.accept(classifier.classify(line));
      }
    }

    LegalDocument document = state.build(lawIdentifier);
    if (log.isDebugEnabled()) {
      log.debug(
          "Parsed '{}': {} chapters, {} articles, preamble={}",
          lawIdentifier,
          document.chapters().size(),
          document.articleCount(),
          document.preamble().isPresent());
    }
    return document;
  }

  /** Open-node pointers and accumulated roots for one parse call. */
  private static final class ParseState {

    private final List<Object> roots = new ArrayList<>();
    private PreambleBuilder preamble;
    private ChapterBuilder openChapter;
    private ArticleBuilder openArticle;
    private ClauseBuilder openClause;
    private PointBuilder openPoint;

    void accept(ClassifiedLine line) {
      switch (line.kind()) {
        case CHAPTER_HEADER -> openChapter(line);
        case ARTICLE_HEADER -> openArticle(line);
        case CLAUSE_HEADER -> {
          if (openArticle == null) {
            appendPlain(line.asPlain());
          } else {
            openClause(line);
          }
        }
        case POINT_HEADER -> {
          if (openClause == null) {
            appendPlain(line.asPlain());
          } else {
            openPoint(line);
          }
        }
        case PLAIN -> appendPlain(line);
      }
    }

    private void openChapter(ClassifiedLine line) {
      openChapter = new ChapterBuilder(line.line(), false);
      roots.add(openChapter);
      openArticle = null;
      openClause = null;
      openPoint = null;
    }

    private void openArticle(ClassifiedLine line) {
      if (openChapter == null) {
        openChapter = new ChapterBuilder(LegalVocabulary.DEFAULT_CHAPTER_HEADER, true);
        roots.add(openChapter);
      }
      openArticle = new ArticleBuilder(line.label(), line.rest());
      openChapter.articles.add(openArticle);
      openClause = null;
      openPoint = null;
    }

    private void openClause(ClassifiedLine line) {
      openClause = new ClauseBuilder(line.label(), line.rest());
      openArticle.clauses.add(openClause);
      openPoint = null;
    }

    private void openPoint(ClassifiedLine line) {
      openPoint = new PointBuilder(line.label(), line.rest());
      openClause.points.add(openPoint);
    }

    private void appendPlain(ClassifiedLine line) {
      String text = line.line();
      if (openPoint != null) {
        openPoint.content.append(' ').append(text);
      } else if (openClause != null) {
        openClause.content.append(' ').append(text);
      } else if (openArticle != null) {
        openArticle.content.append(' ').append(text);
      } else if (openChapter != null) {
        openChapter.freeContent.append(' ').append(text);
      } else if (preamble == null) {
        preamble = new PreambleBuilder(text);
        roots.add(preamble);
      } else {
        preamble.text.append(' ').append(text);
      }
    }

    LegalDocument build(String lawIdentifier) {
      List<RootNode> built = new ArrayList<>(roots.size());
      for (Object root : roots) {
        if (root instanceof PreambleBuilder p) {
          built.add(new Preamble(p.text.toString()));
        } else if (root instanceof ChapterBuilder c) {
          built.add(c.build());
        }
      }
      return new LegalDocument(lawIdentifier, built);
    }
  }

  private static final class PreambleBuilder {
    private final StringBuilder text;

    PreambleBuilder(String first) {
      this.text = new StringBuilder(first);
    }
  }

  private static final class ChapterBuilder {
    private final String header;
    private final boolean synthesized;
    private final List<ArticleBuilder> articles = new ArrayList<>();
    private final StringBuilder freeContent = new StringBuilder();

    ChapterBuilder(String header, boolean synthesized) {
      this.header = header;
      this.synthesized = synthesized;
    }

    Chapter build() {
      return new Chapter(
          header,
          articles.stream().map(ArticleBuilder::build).toList(),
          freeContent.toString(),
          synthesized);
    }
  }

  private static final class ArticleBuilder {
    private final String number;
    private final StringBuilder content;
    private final List<ClauseBuilder> clauses = new ArrayList<>();

    ArticleBuilder(String number, String content) {
      this.number = number;
      this.content = new StringBuilder(content);
    }

    Article build() {
      return new Article(
          number, content.toString(), clauses.stream().map(ClauseBuilder::build).toList());
    }
  }

  private static final class ClauseBuilder {
    private final String number;
    private final StringBuilder content;
    private final List<PointBuilder> points = new ArrayList<>();

    ClauseBuilder(String number, String content) {
      this.number = number;
      this.content = new StringBuilder(content);
    }

    Clause build() {
      return new Clause(
          number, content.toString(), points.stream().map(PointBuilder::build).toList());
    }
  }

  private static final class PointBuilder {
    private final String letter;
    private final StringBuilder content;

    PointBuilder(String letter, String content) {
      this.letter = letter;
      this.content = new StringBuilder(content);
    }

    Point build() {
      return new Point(letter, content.toString());
    }
  }
}
