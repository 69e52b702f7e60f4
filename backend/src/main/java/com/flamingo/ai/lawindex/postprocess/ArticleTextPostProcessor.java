package com.flamingo.ai.lawindex.postprocess;

import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Removes trailing boilerplate from rendered article text.
 *
 * <p>Rules run in order, each on the output of the previous one. A rule finds the first occurrence
 * of its marker and drops the marker and everything after it; text without the marker is returned
 * unchanged.
 *
 * <ol>
 *   <li>a section sub-heading such as {@code "Mục 2. "} that leaked into the last article of a
 *       chapter
 *   <li>the enactment sentence {@code "Luật này (đã) được Quốc hội ..."} closing the statute
 * </ol>
 */
@Slf4j
@Component
public class ArticleTextPostProcessor {

  @VisibleForTesting
  static final Pattern SECTION_HEADING = Pattern.compile("Mục \\d+\\p{Ll}?\\. ");

  @VisibleForTesting
  static final Pattern ENACTMENT_CLAUSE = Pattern.compile("Luật này (đã )?được Quốc hội");

  private static final List<Pattern> TRUNCATION_MARKERS =
      List.of(SECTION_HEADING, ENACTMENT_CLAUSE);

  /**
   * Applies all truncation rules.
   *
   * @param renderedText full rendered article text
   * @return the text cut before the first boilerplate marker
   */
  public String process(String renderedText) {
    String text = renderedText;
    for (Pattern marker : TRUNCATION_MARKERS) {
      text = truncateAt(marker, text);
    }
    return text;
  }

  private String truncateAt(Pattern marker, String text) {
    Matcher matcher = marker.matcher(text);
    if (!matcher.find()) {
      return text;
    }
    log.debug(
        "Truncating {} trailing chars at marker '{}'",
        text.length() - matcher.start(),
        matcher.group());
    return text.substring(0, matcher.start());
  }
}
