package io.lookuplite.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FileBackupLocatorTest {

    @TempDir
    Path root;

    private final FileBackupLocator locator = new FileBackupLocator();

    @Test
    void directory_is_deterministic_and_below_live_dir() {
        Path live = root.resolve("etc/apps/search/lookups/hosts.csv");

        Path a = locator.backupDirectory("hosts.csv", "search", "alice", live);
        Path b = locator.backupDirectory("hosts.csv", "search", "alice", live);

        assertEquals(a, b);
        assertTrue(a.startsWith(live.getParent().resolve(FileBackupLocator.BACKUP_DIR_NAME)));
    }

    @Test
    void different_identities_never_collide() {
        Path live = root.resolve("etc/apps/search/lookups/hosts.csv");
        Set<Path> dirs = new HashSet<>();

        dirs.add(locator.backupDirectory("hosts.csv", "search", null, live));
        dirs.add(locator.backupDirectory("hosts.csv", "search", "alice", live));
        dirs.add(locator.backupDirectory("hosts.csv", "other", "alice", live));
        dirs.add(locator.backupDirectory("hosts2.csv", "search", "alice", live));
        dirs.add(locator.backupDirectory("a b.csv", "search", "alice", live));
        dirs.add(locator.backupDirectory("a_20b.csv", "search", "alice", live));

        assertEquals(6, dirs.size());
    }

    @Test
    void shared_owner_uses_nobody_directory() {
        Path live = root.resolve("etc/apps/search/lookups/hosts.csv");

        assertEquals(
                locator.backupDirectory("hosts.csv", "search", "nobody", live),
                locator.backupDirectory("hosts.csv", "search", null, live)
        );
    }

    @Test
    void escape_keeps_safe_characters_only() {
        assertEquals("hosts.csv", FileBackupLocator.escape("hosts.csv"));
        assertEquals("a_20b_5Fc", FileBackupLocator.escape("a b_c"));
    }

    @Test
    void versions_are_listed_newest_first() throws Exception {
        Path dir = root.resolve("backups");
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("1700000000"), "old");
        Files.writeString(dir.resolve("1700000100.5"), "new");
        Files.writeString(dir.resolve("manual"), "x");

        List<BackupVersion> versions = locator.listVersions(dir);

        assertEquals(3, versions.size());
        assertEquals("1700000100.5", versions.get(0).version().token());
        assertEquals(Instant.ofEpochSecond(1700000100L, 500_000_000L), versions.get(0).createdAt());
        assertEquals("1700000000", versions.get(1).version().token());
        assertNull(versions.get(2).createdAt());
    }

    @Test
    void missing_directory_has_no_versions() {
        assertTrue(locator.listVersions(root.resolve("nope")).isEmpty());
    }
}
