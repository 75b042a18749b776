package io.lookuplite.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lookuplite.service.dto.JsonEditorConfig;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Lookup editor configuration.
 * <p>
 * Fields:
 *  - appRoot:                      root of the etc/apps and etc/users trees
 *  - remoteBaseUri:                base URI of the REST service (KV collections, replication)
 *  - maxEditableSizeBytes:         size guard limit for files opened for editing
 *  - defaultNamespace:             namespace used when the caller passes none
 *  - fallbackToDefaultForVersions: whether a missing backup snapshot may fall
 *                                  back to the ".default" template
 *  - requestTimeout:               per-request timeout for REST calls
 */
public record EditorConfig(
        Path appRoot,
        URI remoteBaseUri,
        long maxEditableSizeBytes,
        String defaultNamespace,
        boolean fallbackToDefaultForVersions,
        Duration requestTimeout
) {
    public static final long DEFAULT_MAX_EDITABLE_SIZE = 10L * 1024 * 1024; // 10 MiB
    public static final String DEFAULT_NAMESPACE = "lookup_editor";
    public static final URI DEFAULT_REMOTE_BASE_URI = URI.create("https://localhost:8089");
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public EditorConfig {
        Objects.requireNonNull(appRoot, "appRoot");
        Objects.requireNonNull(remoteBaseUri, "remoteBaseUri");
        Objects.requireNonNull(defaultNamespace, "defaultNamespace");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (maxEditableSizeBytes <= 0) throw new IllegalArgumentException("maxEditableSizeBytes must be > 0");
        if (defaultNamespace.isBlank()) throw new IllegalArgumentException("defaultNamespace must not be blank");
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be > 0");
        }
    }

    public static EditorConfig defaults(Path appRoot) {
        return new EditorConfig(
                appRoot,
                DEFAULT_REMOTE_BASE_URI,
                DEFAULT_MAX_EDITABLE_SIZE,
                DEFAULT_NAMESPACE,
                true,
                DEFAULT_REQUEST_TIMEOUT
        );
    }

    /**
     * Load from a JSON file, e.g.
     * <pre>
     *   { "appRoot": "/opt/app", "remoteBaseUri": "https://localhost:8089",
     *     "maxEditableSizeBytes": 1048576 }
     * </pre>
     * Unknown properties are ignored; absent ones take their defaults.
     */
    public static EditorConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonEditorConfig cfg = mapper.readValue(path.toFile(), JsonEditorConfig.class);
            if (cfg.appRoot == null || cfg.appRoot.isBlank()) {
                throw new IllegalArgumentException("appRoot is required in " + path);
            }

            return new EditorConfig(
                    Path.of(cfg.appRoot),
                    cfg.remoteBaseUri != null ? URI.create(cfg.remoteBaseUri) : DEFAULT_REMOTE_BASE_URI,
                    cfg.maxEditableSizeBytes != null ? cfg.maxEditableSizeBytes : DEFAULT_MAX_EDITABLE_SIZE,
                    cfg.defaultNamespace != null ? cfg.defaultNamespace : DEFAULT_NAMESPACE,
                    cfg.fallbackToDefaultForVersions == null || cfg.fallbackToDefaultForVersions,
                    cfg.requestTimeoutSeconds != null
                            ? Duration.ofSeconds(cfg.requestTimeoutSeconds)
                            : DEFAULT_REQUEST_TIMEOUT
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load EditorConfig from " + path, e);
        }
    }
}
