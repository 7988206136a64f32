package com.raditha.inductive.engine;

/**
 * Raised when an abstraction is routed to a miner variant that cannot work on it.
 */
public class UnsupportedAbstractionException extends UnsupportedOperationException {

    public UnsupportedAbstractionException(String message) {
        super(message);
    }
}
