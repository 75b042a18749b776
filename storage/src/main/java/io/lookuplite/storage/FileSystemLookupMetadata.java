package io.lookuplite.storage;

import io.lookuplite.core.LookupIdentity;
import io.lookuplite.core.LookupNotFoundException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link LookupFileMetadata} backed by a plain directory tree.
 * <p>
 * Semantics:
 *  - A user's copy (etc/users/&lt;owner&gt;/...) shadows the app copy.
 *  - A lookup exists when its file or its ".default" template exists; in both
 *    cases the live path is returned.
 *  - The credential is ignored: this implementation does no authorization.
 */
public final class FileSystemLookupMetadata implements LookupFileMetadata {

    private final LookupLayout layout;

    public FileSystemLookupMetadata(LookupLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    @Override
    public Path resolve(String builtId, String credential) {
        LookupIdentity id = LookupIdentity.fromBuiltId(builtId);

        if (id.hasOwner()) {
            Path user = layout.userLookup(id.owner(), id.namespace(), id.filename());
            if (present(user)) {
                return user;
            }
        }

        Path app = layout.appLookup(id.namespace(), id.filename());
        if (present(app)) {
            return app;
        }

        throw new LookupNotFoundException("Lookup file not found: " + builtId);
    }

    private static boolean present(Path live) {
        return Files.isRegularFile(live) || Files.isRegularFile(LookupLayout.templateOf(live));
    }
}
