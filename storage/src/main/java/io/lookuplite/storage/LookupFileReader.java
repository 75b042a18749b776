package io.lookuplite.storage;

import io.lookuplite.core.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens lookup files for reading.
 * <p>
 * Files are decoded as UTF-8; malformed or unmappable input is replaced
 * rather than failing the read.
 * <p>
 * Size guard: when a maximum is given, the file's size is checked before
 * opening and {@link LookupFileTooBigException} is thrown if it is larger.
 * A failure to probe the size is logged and treated as "unknown size".
 */
public final class LookupFileReader {
    private static final Logger log = Logger.getLogger(LookupFileReader.class.getName());

    private final PathResolver resolver;

    public LookupFileReader(PathResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /** Open without a size guard. */
    public Reader open(LookupIdentity identity,
                       LookupVersion version,
                       boolean wantDefaultFallback,
                       String credential) {
        ResolvedPath resolved = resolver.resolve(identity, version, wantDefaultFallback, credential);
        return openPath(resolved.path());
    }

    /**
     * Open, refusing files larger than {@code maxEditableBytes}.
     *
     * @throws LookupFileTooBigException if the file exceeds the limit
     */
    public Reader open(LookupIdentity identity,
                       LookupVersion version,
                       boolean wantDefaultFallback,
                       String credential,
                       long maxEditableBytes) {
        ResolvedPath resolved = resolver.resolve(identity, version, wantDefaultFallback, credential);
        checkSize(resolved.path(), maxEditableBytes);
        return openPath(resolved.path());
    }

    /**
     * Fail fast if {@code path} is larger than {@code maxBytes}.
     *
     * @return the measured size, or -1 when it could not be determined
     */
    public static long checkSize(Path path, long maxBytes) {
        if (maxBytes < 0) {
            throw new IllegalArgumentException("maxBytes must be >= 0");
        }

        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            log.log(Level.WARNING, "Exception generated when attempting to determine size of lookup file " + path, e);
            return -1L;
        }

        log.log(Level.INFO, String.format("Size of lookup file determined, file_size=%d, path=%s", size, path));
        if (size > maxBytes) {
            throw new LookupFileTooBigException(size, maxBytes);
        }
        return size;
    }

    static Reader openPath(Path path) {
        log.log(Level.INFO, "Loading lookup file from path=" + path);

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder));
        } catch (NoSuchFileException e) {
            throw new LookupNotFoundException("Lookup file does not exist: " + path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open lookup file " + path, e);
        }
    }
}
