package com.raditha.inductive.model;

/**
 * Thrown when a log abstraction violates its data invariants.
 * Raised while building or validating an abstraction, never during mining.
 */
public class MalformedAbstractionException extends IllegalArgumentException {

    public MalformedAbstractionException(String message) {
        super(message);
    }
}
