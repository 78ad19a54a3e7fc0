package com.chimera.core.model;

import java.io.Serializable;

/**
 * An (ability, agent) pair, the unit of idempotent scheduling.
 */
public record PairKey(String abilityId, String paw) implements Serializable {

    @Override
    public String toString() {
        return abilityId + "@" + paw;
    }
}
