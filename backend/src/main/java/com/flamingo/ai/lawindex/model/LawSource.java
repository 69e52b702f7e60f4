package com.flamingo.ai.lawindex.model;

/**
 * One statute as delivered by the dataset loader.
 *
 * @param lawIdentifier identifier used in citations and record metadata
 * @param rawText the line-oriented statute text
 */
public record LawSource(String lawIdentifier, String rawText) {}
