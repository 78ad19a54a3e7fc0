package com.chimera.core.facts;

import java.util.Map;
import java.util.Set;

/**
 * Outcome of resolving a set of required fact keys: either one value per key,
 * or the keys that are still missing.
 *
 * @param values  chosen value per key, complete only when {@link #missing()} is empty
 * @param missing keys with no value yet
 */
public record FactResolution(Map<String, String> values, Set<String> missing) {

    public FactResolution {
        values = Map.copyOf(values);
        missing = Set.copyOf(missing);
    }

    public boolean isResolved() {
        return missing.isEmpty();
    }
}
