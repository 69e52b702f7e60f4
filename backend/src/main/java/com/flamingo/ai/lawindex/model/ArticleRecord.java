package com.flamingo.ai.lawindex.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single article prepared for the indexing collaborator.
 *
 * @param title article label, e.g. {@code "Điều 5"}
 * @param content rendered and post-processed article text
 * @param citation {@code title + " " + law}
 * @param law identifier of the source law
 */
public record ArticleRecord(String title, String content, String citation, String law) {

  /**
   * Builds a record for an article of the given law.
   *
   * @param articleNumber article number as written
   * @param content rendered text
   * @param lawIdentifier source law identifier
   * @return the record
   */
  public static ArticleRecord of(String articleNumber, String content, String lawIdentifier) {
    String title = LegalVocabulary.ARTICLE + " " + articleNumber;
    return new ArticleRecord(title, content, title + " " + lawIdentifier, lawIdentifier);
  }

  /** Metadata persisted alongside the embedding: {@code name, type, citation, law}. */
  public Map<String, Object> metadata() {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("name", title);
    metadata.put("type", LegalVocabulary.ARTICLE);
    metadata.put("citation", citation);
    metadata.put("law", law);
    return metadata;
  }
}
