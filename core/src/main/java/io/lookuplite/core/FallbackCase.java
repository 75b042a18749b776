package io.lookuplite.core;

/**
 * Decision table for path resolution, keyed by (version present, owner present).
 * <p>
 * <pre>
 *   case              version  owner   lookup path         default template
 *   OWNER_VERSIONED   yes      yes     backup/&lt;version&gt;   users/&lt;owner&gt;/&lt;ns&gt;/lookups
 *   SHARED_VERSIONED  yes      no      backup/&lt;version&gt;   apps/&lt;ns&gt;/lookups
 *   OWNER_LIVE        no       yes     live path           users/&lt;owner&gt;/&lt;ns&gt;/lookups
 *   SHARED_LIVE       no       no      live path           apps/&lt;ns&gt;/lookups
 * </pre>
 */
public enum FallbackCase {
    OWNER_VERSIONED(true, true),
    SHARED_VERSIONED(true, false),
    OWNER_LIVE(false, true),
    SHARED_LIVE(false, false);

    private final boolean versioned;
    private final boolean ownerScoped;

    FallbackCase(boolean versioned, boolean ownerScoped) {
        this.versioned = versioned;
        this.ownerScoped = ownerScoped;
    }

    public static FallbackCase of(boolean versionPresent, boolean ownerPresent) {
        for (FallbackCase c : values()) {
            if (c.versioned == versionPresent && c.ownerScoped == ownerPresent) {
                return c;
            }
        }
        throw new IllegalStateException("unreachable");
    }

    public static FallbackCase of(LookupIdentity identity, LookupVersion version) {
        return of(version != null, identity.hasOwner());
    }

    /** Versioned cases read from the backup directory instead of the live path. */
    public boolean versioned() {
        return versioned;
    }

    /** Owner-scoped cases look for the default template under the user's tree. */
    public boolean ownerScoped() {
        return ownerScoped;
    }
}
