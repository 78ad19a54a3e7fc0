package com.chimera.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * An observation scoped to one operation.
 *
 * @param key        fact key
 * @param value      fact value
 * @param provenance seed or producing link
 * @param version    fact store version assigned on append
 * @param createdAt  append time
 */
public record Fact(
    String key,
    String value,
    Provenance provenance,
    long version,
    Instant createdAt
) implements Serializable {}
