package com.flamingo.ai.lawindex.model;

import java.util.List;

/**
 * A chapter ("Chương") grouping the articles of a statute.
 *
 * @param headerText the full trimmed header line, e.g. {@code "Chương I QUY ĐỊNH CHUNG"}
 * @param articles articles in source order
 * @param freeContent plain lines between the header and the first article, each prefixed by a
 *     space; empty if there are none
 * @param synthesized {@code true} if the chapter was created to host articles that appeared before
 *     any chapter header
 */
public record Chapter(
    String headerText, List<Article> articles, String freeContent, boolean synthesized)
    implements RootNode {

  public Chapter {
    articles = List.copyOf(articles);
  }
}
