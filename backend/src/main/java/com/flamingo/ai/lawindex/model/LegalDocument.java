package com.flamingo.ai.lawindex.model;

import java.util.List;
import java.util.Optional;

/**
 * The immutable tree produced by parsing one statute.
 *
 * @param lawIdentifier identifier of the source law, used in citations
 * @param roots the optional {@link Preamble} (always first) followed by chapters in source order
 */
public record LegalDocument(String lawIdentifier, List<RootNode> roots) {

  public LegalDocument {
    roots = List.copyOf(roots);
  }

  /** Returns the chapters of this document in source order. */
  public List<Chapter> chapters() {
    return roots.stream().filter(Chapter.class::isInstance).map(Chapter.class::cast).toList();
  }

  public Optional<Preamble> preamble() {
    return roots.stream()
        .filter(Preamble.class::isInstance)
        .map(Preamble.class::cast)
        .findFirst();
  }

  /** Total number of articles across all chapters. */
  public int articleCount() {
    return chapters().stream().mapToInt(c -> c.articles().size()).sum();
  }
}
