package com.flamingo.ai.lawindex.model;

/** Vietnamese statute keywords used when rendering and labelling articles. */
public final class LegalVocabulary {

  public static final String CHAPTER = "Chương";
  public static final String ARTICLE = "Điều";
  public static final String CLAUSE = "Khoản";
  public static final String POINT = "Điểm";

  /** Header given to the chapter synthesized for articles that precede any chapter header. */
  public static final String DEFAULT_CHAPTER_HEADER = CHAPTER + " 0";

  private LegalVocabulary() {}
}
