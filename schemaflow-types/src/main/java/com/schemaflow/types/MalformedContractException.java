package com.schemaflow.types;

/**
 * Thrown when a type descriptor, schema, contract or chain is invalid at construction time
 * (e.g. a negative fixed dimension, a duplicate key, a duplicate stage name).
 * A malformed contract cannot be checked against anything, so it is never reported as a violation.
 */
public final class MalformedContractException extends RuntimeException {

    public MalformedContractException(String message) {
        super(message);
    }

    public MalformedContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
