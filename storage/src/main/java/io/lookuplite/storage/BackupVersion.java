package io.lookuplite.storage;

import io.lookuplite.core.LookupVersion;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One historical snapshot found in a backup directory.
 *
 * @param version   token to pass back to the resolver
 * @param path      snapshot file
 * @param createdAt time encoded in the token (epoch seconds), or null if the
 *                  token is not a timestamp
 */
public record BackupVersion(LookupVersion version, Path path, Instant createdAt) {
}
