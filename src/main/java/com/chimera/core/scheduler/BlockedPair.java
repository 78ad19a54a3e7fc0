package com.chimera.core.scheduler;

import java.util.Set;

/**
 * A frontier pair that could not be scheduled in the last evaluation.
 *
 * @param abilityId    ability of the pair
 * @param paw          agent of the pair
 * @param missingFacts required keys that have no value yet
 * @param waitingPhase earlier phase that has not succeeded yet, null if phase gating is not the cause
 */
public record BlockedPair(String abilityId, String paw, Set<String> missingFacts, String waitingPhase) {}
