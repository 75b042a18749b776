package io.lookuplite.storage;

import io.lookuplite.core.LookupNotFoundException;

import java.nio.file.Path;

/**
 * File metadata collaborator: maps a lookup's composite id to the physical
 * path of its live file.
 * <p>
 * Implementations can be:
 *  - a filesystem scan of the app root ({@link FileSystemLookupMetadata}),
 *  - a REST client against a metadata service that also enforces authorization,
 *  - an in-memory fake for tests.
 */
public interface LookupFileMetadata {

    /**
     * Resolve the current physical path of a lookup.
     *
     * @param builtId    composite id from {@link io.lookuplite.core.LookupIdentity#builtId()}
     * @param credential caller's session credential; may be null for local implementations
     * @return absolute path of the live file (the file itself may be missing when
     *         only its ".default" template is shipped)
     * @throws LookupNotFoundException if no such lookup exists
     */
    Path resolve(String builtId, String credential);
}
