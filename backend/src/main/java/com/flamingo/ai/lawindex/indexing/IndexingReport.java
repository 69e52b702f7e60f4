package com.flamingo.ai.lawindex.indexing;

/**
 * Outcome of one indexing run.
 *
 * @param documentsParsed statutes parsed after subject filtering
 * @param articlesExtracted article records built from those statutes
 * @param recordsIndexed records accepted by the indexer
 */
public record IndexingReport(int documentsParsed, int articlesExtracted, int recordsIndexed) {}
