package io.lookuplite.core;

/**
 * The logical lookup identity has no resolvable backing entity.
 */
public class LookupNotFoundException extends LookupException {

    public LookupNotFoundException(String message) {
        super(message);
    }
}
