package io.lookuplite.service;

import io.lookuplite.core.FieldList;
import io.lookuplite.core.LookupNames;
import io.lookuplite.core.Table;
import io.lookuplite.core.TabularProjector;
import io.lookuplite.service.remote.RemoteCollectionClient;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads a KV-collection lookup and projects it into a {@link Table}.
 * <p>
 * Steps:
 *  1) Fetch the schema (as the system owner) and derive the field list.
 *  2) Fetch the rows as the caller's owner.
 *  3) Project rows onto the field list.
 * <p>
 * Any failure (including {@link io.lookuplite.core.PermissionDeniedException}
 * from either fetch) propagates; no partial table is ever returned.
 * <p>
 * Record keys that the schema does not declare are dropped during projection.
 */
public final class KvLookupService {
    private static final Logger log = Logger.getLogger(KvLookupService.class.getName());

    private final RemoteCollectionClient client;
    private final TabularProjector projector;

    public KvLookupService(RemoteCollectionClient client) {
        this(client, new TabularProjector(new JsonCellRenderer()));
    }

    public KvLookupService(RemoteCollectionClient client, TabularProjector projector) {
        this.client = Objects.requireNonNull(client, "client");
        this.projector = Objects.requireNonNull(projector, "projector");
    }

    public Table getKvLookup(String collection, String namespace, String owner, String credential) {
        String name = LookupNames.baseName(collection, "collection");
        String ns = LookupNames.baseName(namespace, "namespace");
        String user = (owner == null || owner.isBlank()) ? null : LookupNames.baseName(owner, "owner");

        FieldList fields = client.fetchSchema(ns, name, credential);
        List<Map<String, Object>> records = client.fetchRows(ns, user, name, credential);

        Table table = projector.project(fields, records);
        log.log(Level.INFO, String.format(
                "Loaded KV lookup, collection=%s, namespace=%s, owner=%s, fields=%d, rows=%d",
                name, ns, user, fields.size(), table.size()));
        return table;
    }
}
