package io.lookuplite.core;

import java.util.Objects;

/**
 * Name sanitizing shared by every component that turns user input into paths.
 * <p>
 * Only the base-name component of a name survives: anything up to and including
 * the last '/' or '\' is discarded. Names that collapse to nothing usable
 * ("", ".", "..") are rejected, so a sanitized name can always be resolved
 * against a directory without leaving it.
 */
public final class LookupNames {

    private LookupNames() {
        // utility
    }

    /**
     * Reduce {@code value} to its base name.
     *
     * @param value raw name as supplied by the caller
     * @param what  label used in error messages (e.g. "filename")
     * @throws IllegalArgumentException if no usable base name remains
     */
    public static String baseName(String value, String what) {
        Objects.requireNonNull(value, what);
        int cut = Math.max(value.lastIndexOf('/'), value.lastIndexOf('\\'));
        String base = value.substring(cut + 1);

        if (base.isEmpty() || ".".equals(base) || "..".equals(base)) {
            throw new IllegalArgumentException(what + " has no usable base name: '" + value + "'");
        }
        if (base.indexOf('\0') >= 0) {
            throw new IllegalArgumentException(what + " must not contain NUL characters");
        }
        return base;
    }
}
