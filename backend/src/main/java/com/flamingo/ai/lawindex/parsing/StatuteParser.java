package com.flamingo.ai.lawindex.parsing;

import com.flamingo.ai.lawindex.model.LegalDocument;

/**
 * Parses the raw text of one statute into a {@link LegalDocument} tree.
 *
 * <p>Implementations must be stateless so a single instance can parse many documents
 * concurrently. Parsing is total: every input, including {@code null} and the empty string,
 * produces a document.
 */
public interface StatuteParser {

  /**
   * Parses a statute.
   *
   * @param lawIdentifier identifier of the law, carried into the document
   * @param rawText line-oriented statute text
   * @return the document tree
   */
  LegalDocument parse(String lawIdentifier, String rawText);
}
