package com.herzen.skillgap.domain;

/**
 * Operation not allowed in the entity's current state, e.g. answering a completed assignment.
 */
public class InvalidStateException extends RuntimeException {
    public InvalidStateException(String message) {
        super(message);
    }
}
