package com.flamingo.ai.lawindex.model;

import java.util.List;

/**
 * A numbered clause ("Khoản") of an {@link Article}.
 *
 * @param number the clause number as written
 * @param content clause text
 * @param points lettered points in source order
 */
public record Clause(String number, String content, List<Point> points) {

  public Clause {
    points = List.copyOf(points);
  }
}
