package com.chimera.core.executor;

/**
 * Thrown when a template is rendered without a value for one of its placeholders.
 * The scheduler always resolves before rendering, so this signals a caller bug.
 */
public class MissingFactException extends RuntimeException {

    private final String key;

    public MissingFactException(String key) {
        super("No value supplied for fact placeholder #{" + key + "}");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
