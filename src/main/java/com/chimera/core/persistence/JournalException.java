package com.chimera.core.persistence;

/**
 * A write to the durable operation journal failed. Fatal to the affected operation.
 */
public class JournalException extends RuntimeException {

    public JournalException(String message, Throwable cause) {
        super(message, cause);
    }
}
