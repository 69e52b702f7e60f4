package com.flamingo.ai.lawindex.model;

/**
 * A lettered point ("Điểm") of a {@link Clause}.
 *
 * @param letter single letter as written, e.g. {@code "a"} or {@code "đ"}
 * @param content point text
 */
public record Point(String letter, String content) {}
