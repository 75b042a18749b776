package io.lookuplite.service;

import io.lookuplite.core.*;
import io.lookuplite.service.remote.HttpRemoteCollectionClient;
import io.lookuplite.service.replication.HttpReplicationNotifier;
import io.lookuplite.service.replication.ReplicationNotifier;
import io.lookuplite.service.replication.ReplicationResult;
import io.lookuplite.storage.*;

import java.io.Reader;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for reading lookups, whatever their backend.
 * <p>
 * Responsibilities:
 *  - File lookups: resolve the path (version, default template), guard the
 *    size, open or parse the file.
 *  - KV lookups: fetch schema and rows and project them into a table.
 *  - List backup snapshots of a file lookup.
 *  - Notify the cluster that a lookup changed.
 * <p>
 * Each capability lives in its own service; this class only composes them.
 * A null namespace means the configured default namespace; a null owner
 * means the lookup is shared.
 */
public final class LookupEditor {

    private final PathResolver resolver;
    private final LookupFileReader fileReader;
    private final CsvLookupReader csvReader;
    private final KvLookupService kvLookups;
    private final ReplicationNotifier replication;
    private final BackupLocator backups;
    private final long maxEditableSizeBytes;
    private final String defaultNamespace;

    public LookupEditor(PathResolver resolver,
                        BackupLocator backups,
                        KvLookupService kvLookups,
                        ReplicationNotifier replication,
                        long maxEditableSizeBytes,
                        String defaultNamespace) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.backups = Objects.requireNonNull(backups, "backups");
        this.kvLookups = Objects.requireNonNull(kvLookups, "kvLookups");
        this.replication = Objects.requireNonNull(replication, "replication");
        this.fileReader = new LookupFileReader(resolver);
        this.csvReader = new CsvLookupReader();
        this.maxEditableSizeBytes = maxEditableSizeBytes;
        this.defaultNamespace = Objects.requireNonNull(defaultNamespace, "defaultNamespace");
    }

    /**
     * Wire a filesystem-backed editor that talks to {@code cfg.remoteBaseUri()}
     * for KV lookups and replication.
     */
    public static LookupEditor fromConfig(EditorConfig cfg) {
        var layout = new LookupLayout(cfg.appRoot());
        var backups = new FileBackupLocator();
        var resolver = new PathResolver(
                new FileSystemLookupMetadata(layout),
                backups,
                layout,
                cfg.fallbackToDefaultForVersions()
        );

        HttpClient http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(cfg.requestTimeout())
                .build();
        var kv = new KvLookupService(new HttpRemoteCollectionClient(cfg.remoteBaseUri(), http, cfg.requestTimeout()));
        var notifier = new HttpReplicationNotifier(cfg.remoteBaseUri(), http, cfg.requestTimeout());

        return new LookupEditor(resolver, backups, kv, notifier, cfg.maxEditableSizeBytes(), cfg.defaultNamespace());
    }

    // ---------- file lookups ----------

    /**
     * Resolve a lookup file name to its path.
     *
     * @return the resolved path, or null if the lookup is unknown and
     *         {@code throwNotFound} is false
     */
    public ResolvedPath resolveLookupFilename(String lookupFile,
                                              String namespace,
                                              String owner,
                                              boolean getDefaultCsv,
                                              String version,
                                              boolean throwNotFound,
                                              String credential) {
        return resolver.resolve(identity(lookupFile, namespace, owner), version(version),
                getDefaultCsv, credential, throwNotFound);
    }

    /**
     * Open a lookup file for reading.
     *
     * @param throwIfTooBig apply the configured editable-size limit
     */
    public Reader getLookup(String lookupFile,
                            String namespace,
                            String owner,
                            boolean getDefaultCsv,
                            String version,
                            boolean throwIfTooBig,
                            String credential) {
        LookupIdentity id = identity(lookupFile, namespace, owner);
        if (throwIfTooBig) {
            return fileReader.open(id, version(version), getDefaultCsv, credential, maxEditableSizeBytes);
        }
        return fileReader.open(id, version(version), getDefaultCsv, credential);
    }

    /** Read a CSV lookup file into a table, with the size guard applied. */
    public Table getFileLookup(String lookupFile,
                               String namespace,
                               String owner,
                               String version,
                               String credential) {
        return csvReader.read(getLookup(lookupFile, namespace, owner, true, version, true, credential));
    }

    /** Backup snapshots of a file lookup, newest first. */
    public List<BackupVersion> listBackups(String lookupFile, String namespace, String owner, String credential) {
        Path dir = resolver.backupDirectory(identity(lookupFile, namespace, owner), credential);
        return backups.listVersions(dir);
    }

    // ---------- KV lookups ----------

    public Table getKvLookup(String collection, String namespace, String owner, String credential) {
        return kvLookups.getKvLookup(collection, namespaceOrDefault(namespace), owner, credential);
    }

    // ---------- misc ----------

    /** True iff every cell of {@code row} is blank. */
    public boolean isEmpty(List<String> row) {
        return TabularProjector.isEmptyRow(row);
    }

    public ReplicationResult forceLookupReplication(String app, String filename, String credential, URI baseUri) {
        return replication.notifyLookupUpdate(app, filename, credential, baseUri);
    }

    private LookupIdentity identity(String lookupFile, String namespace, String owner) {
        return LookupIdentity.of(lookupFile, namespaceOrDefault(namespace), owner);
    }

    private String namespaceOrDefault(String namespace) {
        return namespace == null ? defaultNamespace : namespace;
    }

    private static LookupVersion version(String version) {
        return (version == null || version.isBlank()) ? null : LookupVersion.of(version);
    }
}
