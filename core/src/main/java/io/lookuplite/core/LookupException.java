package io.lookuplite.core;

/**
 * Base type for every failure raised while resolving or reading a lookup.
 * <p>
 * All subclasses are unchecked: callers decide how to surface them
 * (HTTP status, CLI message, etc.).
 */
public class LookupException extends RuntimeException {

    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
