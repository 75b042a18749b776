package io.lookuplite.storage;

import io.lookuplite.core.FallbackCase;
import io.lookuplite.core.LookupIdentity;

import java.nio.file.Path;
import java.util.Objects;

/**
 * On-disk layout of lookup files below an app root:
 * <pre>
 *   &lt;root&gt;/etc/apps/&lt;namespace&gt;/lookups/&lt;file&gt;[.default]
 *   &lt;root&gt;/etc/users/&lt;owner&gt;/&lt;namespace&gt;/lookups/&lt;file&gt;[.default]
 * </pre>
 * Callers pass sanitized names only (see {@link LookupIdentity}).
 */
public final class LookupLayout {

    public static final String DEFAULT_SUFFIX = ".default";

    private final Path appRoot;

    public LookupLayout(Path appRoot) {
        this.appRoot = Objects.requireNonNull(appRoot, "appRoot").toAbsolutePath().normalize();
    }

    public Path appRoot() {
        return appRoot;
    }

    public Path appLookup(String namespace, String filename) {
        return appRoot.resolve("etc").resolve("apps").resolve(namespace)
                .resolve("lookups").resolve(filename);
    }

    public Path userLookup(String owner, String namespace, String filename) {
        return appRoot.resolve("etc").resolve("users").resolve(owner).resolve(namespace)
                .resolve("lookups").resolve(filename);
    }

    /** Sibling of {@code path} carrying the ".default" suffix. */
    public static Path templateOf(Path path) {
        return path.resolveSibling(path.getFileName().toString() + DEFAULT_SUFFIX);
    }

    /** Default template location for a resolution case. */
    public Path defaultTemplate(FallbackCase fallbackCase, LookupIdentity identity) {
        Path base = fallbackCase.ownerScoped()
                ? userLookup(identity.owner(), identity.namespace(), identity.filename())
                : appLookup(identity.namespace(), identity.filename());
        return templateOf(base);
    }
}
