package com.ai.handoff.store;

/**
 * The coordination store could not be reached or failed mid-operation.
 * Distinct from "no data": callers must not treat it as an empty read.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
