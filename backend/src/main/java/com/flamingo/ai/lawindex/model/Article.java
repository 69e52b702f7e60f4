package com.flamingo.ai.lawindex.model;

import java.util.List;

/**
 * A numbered article ("Điều"), the unit handed to indexing.
 *
 * @param number article number, digits with an optional trailing letter (e.g. {@code "5đ"})
 * @param content inline header text plus any continuation lines
 * @param clauses clauses in source order
 */
public record Article(String number, String content, List<Clause> clauses) {

  public Article {
    clauses = List.copyOf(clauses);
  }
}
