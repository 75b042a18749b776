package io.lookuplite.storage;

import io.lookuplite.core.LookupIdentity;
import io.lookuplite.core.LookupVersion;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Backup directories next to the live file:
 * <pre>
 *   dirname(livePath)/lookup_file_backups/&lt;namespace&gt;/&lt;owner|nobody&gt;/&lt;escaped filename&gt;
 * </pre>
 * Snapshot files inside are named by their version token, by convention the
 * epoch seconds at which they were taken (e.g. "1700000000.25").
 * <p>
 * Escaping keeps [A-Za-z0-9.-] and writes every other UTF-8 byte as "_XX"
 * (hex). '_' itself is escaped too, so the mapping is injective.
 */
public final class FileBackupLocator implements BackupLocator {

    public static final String BACKUP_DIR_NAME = "lookup_file_backups";

    private static final Comparator<BackupVersion> NEWEST_FIRST =
            Comparator.comparing(BackupVersion::createdAt, Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(v -> v.version().token(), Comparator.reverseOrder());

    @Override
    public Path backupDirectory(String filename, String namespace, String owner, Path resolvedLivePath) {
        Objects.requireNonNull(resolvedLivePath, "resolvedLivePath");
        String ownerDir = (owner == null || owner.isBlank()) ? LookupIdentity.SHARED_OWNER : owner;

        Path parent = resolvedLivePath.toAbsolutePath().normalize().getParent();
        return parent.resolve(BACKUP_DIR_NAME)
                .resolve(escape(namespace))
                .resolve(escape(ownerDir))
                .resolve(escape(filename));
    }

    @Override
    public List<BackupVersion> listVersions(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }

        List<BackupVersion> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(Files::isRegularFile).forEach(p -> {
                String token = p.getFileName().toString();
                out.add(new BackupVersion(LookupVersion.of(token), p, parseTimestamp(token)));
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list backups in " + directory, e);
        }

        out.sort(NEWEST_FIRST);
        return out;
    }

    static String escape(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (byte b : name.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xff);
            boolean safe = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                    || (c >= '0' && c <= '9') || c == '.' || c == '-';
            if (safe) {
                sb.append(c);
            } else {
                sb.append('_').append(String.format("%02X", b & 0xff));
            }
        }
        // "." and ".." must not survive as directory names
        String escaped = sb.toString();
        if (".".equals(escaped) || "..".equals(escaped)) {
            return escaped.replace(".", "_2E");
        }
        return escaped;
    }

    private static Instant parseTimestamp(String token) {
        try {
            BigDecimal seconds = new BigDecimal(token);
            if (seconds.signum() < 0) {
                return null;
            }
            long whole = seconds.longValue();
            long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
            return Instant.ofEpochSecond(whole, nanos);
        } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
            return null;
        }
    }
}
