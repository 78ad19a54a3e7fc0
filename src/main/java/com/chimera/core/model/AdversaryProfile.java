package com.chimera.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.OptionalInt;

/**
 * An ordered collection of abilities, optionally gated by tactic phases.
 *
 * @param id         profile id
 * @param name       display name
 * @param abilityIds abilities in scope, in catalog order for tie-breaking
 * @param phases     ordered tactic phases; empty disables phase gating
 */
public record AdversaryProfile(
    String id,
    String name,
    List<String> abilityIds,
    List<TacticPhase> phases
) implements Serializable {

    public AdversaryProfile {
        abilityIds = abilityIds == null ? List.of() : List.copyOf(abilityIds);
        phases = phases == null ? List.of() : List.copyOf(phases);
    }

    /** Index of the phase named by the tactic, or empty when the tactic is ungated. */
    public OptionalInt phaseIndex(String tactic) {
        if (tactic == null) return OptionalInt.empty();
        for (int i = 0; i < phases.size(); i++) {
            if (phases.get(i).name().equalsIgnoreCase(tactic)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public AdversaryProfile withAbilities(List<String> newAbilityIds) {
        return new AdversaryProfile(id, name, newAbilityIds, phases);
    }
}
