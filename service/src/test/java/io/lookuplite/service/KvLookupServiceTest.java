package io.lookuplite.service;

import io.lookuplite.core.FieldList;
import io.lookuplite.core.PermissionDeniedException;
import io.lookuplite.core.Table;
import io.lookuplite.service.remote.RemoteCollectionClient;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KvLookupServiceTest {

    /** Client stub returning canned schema/rows and recording owners it was asked for. */
    private static final class StubClient implements RemoteCollectionClient {
        final List<String> rowOwners = new ArrayList<>();
        FieldList schema = FieldList.of("host", "ip");
        List<Map<String, Object>> rows = List.of();
        boolean denySchema;
        boolean denyRows;

        @Override
        public FieldList fetchSchema(String namespace, String collection, String credential) {
            if (denySchema) throw new PermissionDeniedException("no schema for you");
            return schema;
        }

        @Override
        public List<Map<String, Object>> fetchRows(String namespace, String owner, String collection, String credential) {
            rowOwners.add(owner);
            if (denyRows) throw new PermissionDeniedException("no rows for you");
            return rows;
        }
    }

    @Test
    void rows_are_projected_onto_the_schema() {
        var stub = new StubClient();
        stub.rows = List.of(
                Map.of("_key", "k1", "host", "web-1", "ip", "10.0.0.1", "_user", "nobody"),
                Map.of("_key", "k2", "host", "web-2")
        );

        Table table = new KvLookupService(stub).getKvLookup("hosts", "search", "alice", "sess");

        assertEquals(List.of("_key", "host", "ip"), table.header());
        assertEquals(List.of("k1", "web-1", "10.0.0.1"), table.rows().get(0));
        assertEquals(List.of("k2", "web-2", ""), table.rows().get(1));
        assertEquals(List.of("alice"), stub.rowOwners);
    }

    @Test
    void nested_lists_are_rendered_as_json() {
        var stub = new StubClient();
        stub.schema = FieldList.of("tags", "geo.city");
        stub.rows = List.of(Map.of("tags", List.of("a", "b"), "geo", Map.of("city", "Oslo")));

        Table table = new KvLookupService(stub).getKvLookup("hosts", "search", null, null);

        assertEquals(List.of("", "[\"a\",\"b\"]", "Oslo"), table.rows().get(0));
    }

    @Test
    void schema_permission_failure_aborts_before_rows() {
        var stub = new StubClient();
        stub.denySchema = true;

        assertThrows(PermissionDeniedException.class,
                () -> new KvLookupService(stub).getKvLookup("hosts", "search", null, null));
        assertTrue(stub.rowOwners.isEmpty());
    }

    @Test
    void rows_permission_failure_aborts_projection() {
        var stub = new StubClient();
        stub.denyRows = true;

        assertThrows(PermissionDeniedException.class,
                () -> new KvLookupService(stub).getKvLookup("hosts", "search", "alice", null));
    }

    @Test
    void collection_and_owner_are_sanitized() {
        var stub = new StubClient();

        new KvLookupService(stub).getKvLookup("../../hosts", "search", "../alice", null);

        assertEquals(List.of("alice"), stub.rowOwners);
    }
}
