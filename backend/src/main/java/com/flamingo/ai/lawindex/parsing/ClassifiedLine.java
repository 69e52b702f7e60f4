package com.flamingo.ai.lawindex.parsing;

/**
 * A trimmed line together with its structural classification.
 *
 * @param kind structural role
 * @param label article/clause number or point letter; {@code null} for chapters and plain lines
 * @param rest inline content following the marker; for chapters and plain lines the whole line
 * @param line the trimmed source line
 */
public record ClassifiedLine(LineKind kind, String label, String rest, String line) {

  static ClassifiedLine chapter(String line) {
    return new ClassifiedLine(LineKind.CHAPTER_HEADER, null, line, line);
  }

  static ClassifiedLine article(String number, String rest, String line) {
    return new ClassifiedLine(LineKind.ARTICLE_HEADER, number, rest, line);
  }

  static ClassifiedLine clause(String number, String rest, String line) {
    return new ClassifiedLine(LineKind.CLAUSE_HEADER, number, rest, line);
  }

  static ClassifiedLine point(String letter, String rest, String line) {
    return new ClassifiedLine(LineKind.POINT_HEADER, letter, rest, line);
  }

  static ClassifiedLine plain(String line) {
    return new ClassifiedLine(LineKind.PLAIN, null, line, line);
  }

  /** Returns the same line re-tagged as plain content. */
  public ClassifiedLine asPlain() {
    return plain(line);
  }
}
