package com.chimera.core.model;

import java.io.Serializable;

/**
 * Where a fact came from: operator seed input or exactly one successful link.
 *
 * @param linkId producing link id, null for seeded facts
 */
public record Provenance(String linkId) implements Serializable {

    private static final Provenance SEED = new Provenance(null);

    public static Provenance seed() {
        return SEED;
    }

    public static Provenance link(String linkId) {
        if (linkId == null || linkId.isBlank()) {
            throw new IllegalArgumentException("linkId is required for link provenance");
        }
        return new Provenance(linkId);
    }

    public boolean isSeed() {
        return linkId == null;
    }

    @Override
    public String toString() {
        return isSeed() ? "seed" : "link:" + linkId;
    }
}
