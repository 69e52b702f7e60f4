package com.flamingo.ai.lawindex.parsing;

import com.google.common.base.CharMatcher;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Classifies one trimmed statute line as a chapter, article, clause or point header, or as plain
 * continuation text.
 *
 * <p>Patterns are tried in the order chapter, article, clause, point; the first match wins. The
 * classifier is stateless: whether a clause or point header may actually open a node is decided by
 * {@link HierarchicalStatuteParser}.
 */
@Component
public class LegalLineClassifier {

  private static final Pattern CHAPTER =
      Pattern.compile(
          "^Chương\\s+([IVXLCDM]+|\\d+)",
          Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);

  /** Keyword is case-insensitive, the optional number suffix must be a lowercase letter. */
  private static final Pattern ARTICLE =
      Pattern.compile("^(?iu:Điều)\\s+(\\d+\\p{Ll}?)", Pattern.UNICODE_CHARACTER_CLASS);

  private static final Pattern CLAUSE =
      Pattern.compile("^(\\d+)\\.\\s*(.*)", Pattern.DOTALL | Pattern.UNICODE_CHARACTER_CLASS);

  private static final Pattern POINT =
      Pattern.compile("^(\\p{L})\\)\\s*(.*)", Pattern.DOTALL | Pattern.UNICODE_CHARACTER_CLASS);

  private static final Pattern ARTICLE_CONTENT_LEAD =
      Pattern.compile("^[.\\s]+", Pattern.UNICODE_CHARACTER_CLASS);

  /**
   * Classifies a line.
   *
   * @param line a trimmed, non-empty line
   * @return the classification; never {@code null}
   */
  public ClassifiedLine classify(String line) {
    if (CHAPTER.matcher(line).lookingAt()) {
      return ClassifiedLine.chapter(line);
    }

    Matcher article = ARTICLE.matcher(line);
    if (article.lookingAt()) {
      String rest = line.substring(article.end());
      rest = ARTICLE_CONTENT_LEAD.matcher(rest).replaceFirst("");
      rest = CharMatcher.whitespace().trimTrailingFrom(rest);
      return ClassifiedLine.article(article.group(1), rest, line);
    }

    Matcher clause = CLAUSE.matcher(line);
    if (clause.matches()) {
      return ClassifiedLine.clause(clause.group(1), clause.group(2), line);
    }

    Matcher point = POINT.matcher(line);
    if (point.matches()) {
      return ClassifiedLine.point(point.group(1), point.group(2), line);
    }

    return ClassifiedLine.plain(line);
  }
}
