package com.chimera.core.engine;

public class AdversaryNotFoundException extends RuntimeException {

    public AdversaryNotFoundException(String adversaryId) {
        super("Adversary profile not found: " + adversaryId);
    }
}
