package io.lookuplite.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Every cell of the (version, owner) decision table.
 */
class FallbackCaseTest {

    @Test
    void each_combination_maps_to_its_own_case() {
        assertEquals(FallbackCase.OWNER_VERSIONED, FallbackCase.of(true, true));
        assertEquals(FallbackCase.SHARED_VERSIONED, FallbackCase.of(true, false));
        assertEquals(FallbackCase.OWNER_LIVE, FallbackCase.of(false, true));
        assertEquals(FallbackCase.SHARED_LIVE, FallbackCase.of(false, false));
    }

    @Test
    void case_flags_match_the_table() {
        for (FallbackCase c : FallbackCase.values()) {
            assertEquals(c, FallbackCase.of(c.versioned(), c.ownerScoped()));
        }
    }

    @Test
    void nobody_owner_selects_shared_cases() {
        var id = LookupIdentity.of("hosts.csv", "search", "nobody");

        assertEquals(FallbackCase.SHARED_LIVE, FallbackCase.of(id, null));
        assertEquals(FallbackCase.SHARED_VERSIONED, FallbackCase.of(id, LookupVersion.of("v3")));
    }

    @Test
    void owner_with_version_selects_owner_versioned() {
        var id = LookupIdentity.of("hosts.csv", "search", "alice");

        assertEquals(FallbackCase.OWNER_VERSIONED, FallbackCase.of(id, LookupVersion.of("v3")));
    }
}
