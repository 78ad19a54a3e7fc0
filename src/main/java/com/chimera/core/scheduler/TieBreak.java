package com.chimera.core.scheduler;

import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.model.AdversaryProfile;
import com.chimera.core.model.Link;

import java.util.Comparator;

/**
 * Deterministic ordering of abilities and links: tactic phase first, then
 * profile order, then creation order. Abilities whose tactic is not a
 * declared phase sort after every declared phase.
 */
public final class TieBreak {

    private final AdversaryProfile profile;
    private final AbilityCatalog catalog;

    public TieBreak(AdversaryProfile profile, AbilityCatalog catalog) {
        this.profile = profile;
        this.catalog = catalog;
    }

    public int phaseRank(String abilityId) {
        if (!catalog.contains(abilityId)) return Integer.MAX_VALUE;
        return profile.phaseIndex(catalog.ability(abilityId).tactic()).orElse(profile.phases().size());
    }

    public int abilityRank(String abilityId) {
        int index = profile.abilityIds().indexOf(abilityId);
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    public Comparator<String> abilities() {
        return Comparator.<String>comparingInt(this::phaseRank).thenComparingInt(this::abilityRank);
    }

    public Comparator<Link> links() {
        return Comparator.<Link>comparingInt(l -> phaseRank(l.abilityId()))
                .thenComparingInt(l -> abilityRank(l.abilityId()))
                .thenComparing(Link::createdAt)
                .thenComparingLong(Link::sequence);
    }
}
