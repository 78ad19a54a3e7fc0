package com.chimera.core.model;

import java.io.Serializable;

/**
 * How many times an ability may be attempted against one agent before its
 * failure becomes final.
 *
 * @param maxAttempts total attempts including the first; 1 disables retry
 */
public record RetryPolicy(int maxAttempts) implements Serializable {

    public static final RetryPolicy NONE = new RetryPolicy(1);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
    }

    /** Whether another attempt may follow a failed attempt with the given 1-based number. */
    public boolean allowsAnotherAttempt(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }
}
