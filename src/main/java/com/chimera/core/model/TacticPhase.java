package com.chimera.core.model;

import java.io.Serializable;

/**
 * A named ordering bucket of an adversary profile.
 *
 * @param name     tactic name abilities refer to (e.g. "discovery")
 * @param optional when true, later phases do not wait for this one
 */
public record TacticPhase(String name, boolean optional) implements Serializable {}
