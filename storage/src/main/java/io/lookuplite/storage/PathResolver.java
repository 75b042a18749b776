package io.lookuplite.storage;

import io.lookuplite.core.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps a lookup identity plus optional version to the file to read.
 * <p>
 * Steps:
 *  1) Ask the {@link LookupFileMetadata} collaborator for the live path.
 *  2) Pick the {@link FallbackCase} from (version present, owner present).
 *     Versioned cases read {@code <backupDir>/<version>}; live cases read the
 *     live path. Owner-scoped cases look for the default template in the
 *     user's tree, shared ones in the app's tree.
 *  3) If the chosen file is missing and its default template exists, return
 *     the template (when the caller asked for it).
 * <p>
 * Precedence: requested version > live edited file > shipped default template.
 * <p>
 * Nothing is cached; every call probes the filesystem again, so concurrent
 * resolutions of the same identity can race harmlessly.
 */
public final class PathResolver {
    private static final Logger log = Logger.getLogger(PathResolver.class.getName());

    private final LookupFileMetadata metadata;
    private final BackupLocator backups;
    private final LookupLayout layout;
    private final boolean fallbackToDefaultForVersions;

    public PathResolver(LookupFileMetadata metadata, BackupLocator backups, LookupLayout layout) {
        this(metadata, backups, layout, true);
    }

    /**
     * @param fallbackToDefaultForVersions whether a missing backup snapshot may
     *                                     fall back to the default template
     */
    public PathResolver(LookupFileMetadata metadata,
                        BackupLocator backups,
                        LookupLayout layout,
                        boolean fallbackToDefaultForVersions) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.backups = Objects.requireNonNull(backups, "backups");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.fallbackToDefaultForVersions = fallbackToDefaultForVersions;
    }

    /** Resolve, failing with {@link LookupNotFoundException} for unknown lookups. */
    public ResolvedPath resolve(LookupIdentity identity,
                                LookupVersion version,
                                boolean wantDefaultFallback,
                                String credential) {
        return resolve(identity, version, wantDefaultFallback, credential, true);
    }

    /**
     * @param version             snapshot to read, or null for the current file
     * @param wantDefaultFallback return the ".default" template when the file is missing
     * @param credential          passed through to the metadata collaborator
     * @param throwNotFound       if false, an unknown lookup yields null instead of an exception
     * @return the path to read, or null (only when {@code throwNotFound} is false)
     */
    public ResolvedPath resolve(LookupIdentity identity,
                                LookupVersion version,
                                boolean wantDefaultFallback,
                                String credential,
                                boolean throwNotFound) {
        Objects.requireNonNull(identity, "identity");
        log.log(Level.FINE, "Resolving lookup {0}, version={1}", new Object[]{identity.builtId(), version});

        Path livePath;
        try {
            livePath = metadata.resolve(identity.builtId(), credential);
        } catch (LookupNotFoundException e) {
            if (throwNotFound) {
                throw e;
            }
            return null;
        }

        FallbackCase fallbackCase = FallbackCase.of(identity, version);

        Path lookupPath = fallbackCase.versioned()
                ? backupDirectory(identity, livePath).resolve(version.token())
                : livePath;
        Path templatePath = layout.defaultTemplate(fallbackCase, identity);

        log.log(Level.INFO, String.format("Resolved lookup file, case=%s, path=%s", fallbackCase, lookupPath));

        boolean fallbackAllowed = wantDefaultFallback
                && (!fallbackCase.versioned() || fallbackToDefaultForVersions);

        if (fallbackAllowed && !Files.exists(lookupPath) && Files.exists(templatePath)) {
            return ResolvedPath.template(templatePath);
        }
        return ResolvedPath.authored(lookupPath);
    }

    /** Backup directory of a lookup whose live path is already known. */
    public Path backupDirectory(LookupIdentity identity, Path livePath) {
        return backups.backupDirectory(identity.filename(), identity.namespace(), identity.owner(), livePath);
    }

    /** Backup directory of a lookup, asking the metadata collaborator for its live path. */
    public Path backupDirectory(LookupIdentity identity, String credential) {
        return backupDirectory(identity, metadata.resolve(identity.builtId(), credential));
    }
}
