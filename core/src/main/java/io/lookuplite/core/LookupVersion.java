package io.lookuplite.core;

/**
 * Opaque token naming one historical snapshot of a lookup.
 * <p>
 * The token is used as a file name inside the backup directory, so it goes
 * through the same base-name sanitizing as the identity. A null
 * {@code LookupVersion} everywhere in the API means "current".
 */
public record LookupVersion(String token) {

    public LookupVersion {
        token = LookupNames.baseName(token, "version");
    }

    public static LookupVersion of(String token) {
        return new LookupVersion(token);
    }

    @Override
    public String toString() {
        return token;
    }
}
