package com.kuyan.domain.exception;

/**
 * Raised when a rate map breaks the self-pair invariant or holds a non-positive rate.
 * Indicates a pinning bug, never a data condition to recover from.
 */
public class MalformedRateMapException extends IllegalStateException {

    public MalformedRateMapException(String message) {
        super(message);
    }
}
