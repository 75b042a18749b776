package io.lookuplite.core;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Logical identity of a lookup: (filename, namespace, owner).
 * <p>
 * Invariants:
 *  - Every component is reduced to its base name on construction
 *    (see {@link LookupNames#baseName(String, String)}), so "../../etc/passwd"
 *    becomes "passwd" before any path is built from it.
 *  - A null or blank owner, and the owner "nobody", both mean "shared" and
 *    are stored as a null owner.
 * <p>
 * {@link #builtId()} gives the composite key the file metadata service is
 * queried with; {@link #fromBuiltId(String)} reverses it.
 */
public record LookupIdentity(String filename, String namespace, String owner) {

    /** Owner sentinel for lookups that belong to no specific user. */
    public static final String SHARED_OWNER = "nobody";

    private static final String ID_PREFIX = "/servicesNS/";
    private static final String ID_ENTITY_PATH = "/data/lookup-table-files/";

    public LookupIdentity {
        filename = LookupNames.baseName(filename, "filename");
        namespace = LookupNames.baseName(namespace, "namespace");
        owner = (owner == null || owner.isBlank()) ? null : LookupNames.baseName(owner, "owner");
        if (SHARED_OWNER.equals(owner)) {
            owner = null;
        }
    }

    /** Shared (owner-less) lookup. */
    public static LookupIdentity of(String filename, String namespace) {
        return new LookupIdentity(filename, namespace, null);
    }

    public static LookupIdentity of(String filename, String namespace, String owner) {
        return new LookupIdentity(filename, namespace, owner);
    }

    /** True when the lookup is scoped to a concrete user rather than shared. */
    public boolean hasOwner() {
        return owner != null;
    }

    /** Owner to use in URLs and directory names; "nobody" for shared lookups. */
    public String effectiveOwner() {
        return owner == null ? SHARED_OWNER : owner;
    }

    /**
     * Deterministic composite key, e.g.
     * {@code /servicesNS/alice/search/data/lookup-table-files/hosts.csv}.
     */
    public String builtId() {
        return ID_PREFIX + encode(effectiveOwner())
                + "/" + encode(namespace)
                + ID_ENTITY_PATH + encode(filename);
    }

    /**
     * Parse a key produced by {@link #builtId()}.
     *
     * @throws IllegalArgumentException if the key is not in the expected shape
     */
    public static LookupIdentity fromBuiltId(String builtId) {
        if (builtId == null || !builtId.startsWith(ID_PREFIX)) {
            throw new IllegalArgumentException("not a lookup id: " + builtId);
        }
        String rest = builtId.substring(ID_PREFIX.length());

        int ownerEnd = rest.indexOf('/');
        int entityStart = rest.indexOf(ID_ENTITY_PATH);
        if (ownerEnd <= 0 || entityStart <= ownerEnd) {
            throw new IllegalArgumentException("not a lookup id: " + builtId);
        }

        String owner = decode(rest.substring(0, ownerEnd));
        String namespace = decode(rest.substring(ownerEnd + 1, entityStart));
        String filename = decode(rest.substring(entityStart + ID_ENTITY_PATH.length()));

        return new LookupIdentity(filename, namespace, owner);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
