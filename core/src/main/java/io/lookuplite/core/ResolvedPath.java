package io.lookuplite.core;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of path resolution.
 *
 * @param path            absolute path of the file to read (may not exist yet)
 * @param defaultTemplate true when the shipped ".default" template was chosen
 *                        instead of the authored file
 */
public record ResolvedPath(Path path, boolean defaultTemplate) {

    public ResolvedPath {
        Objects.requireNonNull(path, "path");
    }

    public static ResolvedPath authored(Path path) {
        return new ResolvedPath(path, false);
    }

    public static ResolvedPath template(Path path) {
        return new ResolvedPath(path, true);
    }
}
