package io.lookuplite.storage;

import java.nio.file.Path;
import java.util.List;

/**
 * Locates the directory that holds historical snapshots of a lookup.
 * <p>
 * Contract:
 *  - deterministic: the same inputs always give the same directory;
 *  - collision-free: two lookups that differ in filename, namespace or owner
 *    never share a directory.
 */
public interface BackupLocator {

    /**
     * @param filename         sanitized lookup file name
     * @param namespace        sanitized namespace
     * @param owner            sanitized owner, or null for shared lookups
     * @param resolvedLivePath live path of the lookup, as resolved by the metadata service
     */
    Path backupDirectory(String filename, String namespace, String owner, Path resolvedLivePath);

    /** Snapshots in {@code directory}, newest first. Empty if the directory is missing. */
    List<BackupVersion> listVersions(Path directory);
}
