package com.health.anomaly.engine;

/**
 * Raised when the engine is called in a way that indicates a logic bug in the
 * caller, e.g. running threshold detection without a valid baseline.
 */
public class PreconditionViolationException extends RuntimeException {

    public PreconditionViolationException(String message) {
        super(message);
    }
}
