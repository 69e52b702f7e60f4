package com.flamingo.ai.lawindex.model;

/**
 * Free text found before the first chapter or article of a statute.
 *
 * @param text accumulated preamble lines joined by single spaces
 */
public record Preamble(String text) implements RootNode {}
