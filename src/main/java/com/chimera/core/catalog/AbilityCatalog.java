package com.chimera.core.catalog;

import com.chimera.core.executor.ExecutorRegistry;
import com.chimera.core.executor.MissingFactException;
import com.chimera.core.executor.Placeholders;
import com.chimera.core.model.Ability;
import com.chimera.core.model.AdversaryProfile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, in-memory view of ability and adversary profile definitions.
 * Safe to share between threads; the engine never mutates it.
 * <p>
 * The required facts of an ability are its declared keys plus every
 * placeholder its command template references, so a link can never be
 * rendered with a dangling placeholder.
 */
public final class AbilityCatalog {

    private final Map<String, Ability> abilities;
    private final Map<String, AdversaryProfile> profiles;
    private final ExecutorRegistry executors;

    public AbilityCatalog(Collection<Ability> abilities, Collection<AdversaryProfile> profiles,
                          ExecutorRegistry executors) {
        this.executors = executors;
        var abilityMap = new LinkedHashMap<String, Ability>();
        for (Ability ability : abilities) {
            if (abilityMap.containsKey(ability.id())) {
                throw new CatalogException("Duplicate ability id: " + ability.id());
            }
            abilityMap.put(ability.id(), withTemplateRequirements(ability));
        }
        var profileMap = new LinkedHashMap<String, AdversaryProfile>();
        for (AdversaryProfile profile : profiles) {
            if (profileMap.containsKey(profile.id())) {
                throw new CatalogException("Duplicate adversary id: " + profile.id());
            }
            for (String abilityId : profile.abilityIds()) {
                if (!abilityMap.containsKey(abilityId)) {
                    throw new CatalogException("Adversary " + profile.id() + " references unknown ability " + abilityId);
                }
            }
            profileMap.put(profile.id(), profile);
        }
        this.abilities = Map.copyOf(abilityMap);
        this.profiles = Map.copyOf(profileMap);
    }

    public static AbilityCatalog empty(ExecutorRegistry executors) {
        return new AbilityCatalog(List.of(), List.of(), executors);
    }

    /** Abilities of a profile, in profile order. */
    public List<Ability> abilitiesFor(AdversaryProfile profile) {
        var result = new ArrayList<Ability>(profile.abilityIds().size());
        for (String id : profile.abilityIds()) {
            result.add(ability(id));
        }
        return result;
    }

    public Set<String> requiredFacts(String abilityId) {
        return ability(abilityId).requiredFacts();
    }

    /**
     * Renders the ability's command with resolved fact values.
     *
     * @throws MissingFactException if the caller did not resolve every required key
     */
    public String render(String abilityId, Map<String, String> facts) {
        Ability ability = ability(abilityId);
        for (String key : ability.requiredFacts()) {
            if (!facts.containsKey(key)) {
                throw new MissingFactException(key);
            }
        }
        return executors.forKind(ability.executor()).render(ability.command(), facts);
    }

    public Ability ability(String abilityId) {
        Ability ability = abilities.get(abilityId);
        if (ability == null) {
            throw new CatalogException("Unknown ability: " + abilityId);
        }
        return ability;
    }

    public boolean contains(String abilityId) {
        return abilities.containsKey(abilityId);
    }

    public Optional<AdversaryProfile> profile(String profileId) {
        return Optional.ofNullable(profiles.get(profileId));
    }

    public Collection<AdversaryProfile> profiles() {
        return profiles.values();
    }

    public Collection<Ability> abilities() {
        return abilities.values();
    }

    private static Ability withTemplateRequirements(Ability ability) {
        Set<String> placeholders = Placeholders.keysIn(ability.command());
        if (ability.requiredFacts().containsAll(placeholders)) {
            return ability;
        }
        var required = new LinkedHashSet<>(ability.requiredFacts());
        required.addAll(placeholders);
        return new Ability(ability.id(), ability.name(), ability.tactic(), ability.description(),
                ability.platforms(), ability.executor(), ability.command(), required,
                ability.outputRules(), ability.retry(), ability.timeout());
    }
}
