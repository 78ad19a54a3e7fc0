package com.chimera.core.executor;

/**
 * A key/value pair extracted from output, not yet committed to a fact store.
 */
public record ParsedFact(String key, String value) {}
