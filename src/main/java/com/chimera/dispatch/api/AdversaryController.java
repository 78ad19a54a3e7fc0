package com.chimera.dispatch.api;

import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.engine.AdversaryNotFoundException;
import com.chimera.core.model.Ability;
import com.chimera.core.model.AdversaryProfile;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;

/**
 * Read-only view of the loaded catalog.
 */
@RestController
@RequestMapping("/api/v1")
public class AdversaryController {

    private final AbilityCatalog catalog;

    public AdversaryController(AbilityCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/adversaries")
    public List<AdversaryProfile> adversaries() {
        return catalog.profiles().stream().sorted(Comparator.comparing(AdversaryProfile::id)).toList();
    }

    @GetMapping("/adversaries/{id}")
    public AdversaryProfile adversary(@PathVariable String id) {
        return catalog.profile(id).orElseThrow(() -> new AdversaryNotFoundException(id));
    }

    @GetMapping("/abilities")
    public List<Ability> abilities() {
        return catalog.abilities().stream().sorted(Comparator.comparing(Ability::id)).toList();
    }
}
