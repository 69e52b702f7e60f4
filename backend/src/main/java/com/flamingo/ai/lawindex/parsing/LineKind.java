package com.flamingo.ai.lawindex.parsing;

/** Structural role of a single statute line. */
public enum LineKind {
  CHAPTER_HEADER,
  ARTICLE_HEADER,
  CLAUSE_HEADER,
  POINT_HEADER,
  PLAIN
}
