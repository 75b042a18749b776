package io.lookuplite.core;

/**
 * The backing service refused a read for lack of authorization.
 * <p>
 * Always propagated to the caller; never downgraded to an empty result.
 */
public class PermissionDeniedException extends LookupException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
