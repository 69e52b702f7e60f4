package com.flamingo.ai.lawindex.model;

/**
 * A top-level node of a {@link LegalDocument}: either the {@link Preamble} or a {@link Chapter}.
 */
public interface RootNode {}
