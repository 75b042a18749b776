package io.lookuplite.service.remote;

import io.lookuplite.core.FieldList;
import io.lookuplite.core.LookupNotFoundException;
import io.lookuplite.core.PermissionDeniedException;
import io.lookuplite.service.FakeRestServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the HTTP collection client against a fake REST service.
 */
class HttpRemoteCollectionClientTest {

    private static final int PORT = 18181; // test-only port
    private static final String CONFIG = "/servicesNS/nobody/search/storage/collections/config/hosts";

    private FakeRestServer server;
    private HttpRemoteCollectionClient client;

    @BeforeEach
    void startServer() {
        server = new FakeRestServer(PORT);
        client = new HttpRemoteCollectionClient(server.baseUri(), Duration.ofSeconds(5));
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.close();
        }
    }

    @Test
    void schema_is_read_as_system_owner_with_prefixed_fields_only() {
        server.respond(CONFIG, 200, """
                {"entry":[{"name":"hosts","content":{"field.host":"string","field.ip":"string","other":"x"}}]}
                """);

        FieldList fields = client.fetchSchema("search", "hosts", "sess-1");

        assertEquals(List.of("_key", "host", "ip"), fields.names());
        var req = server.requests().get(0);
        assertEquals("GET", req.method());
        assertEquals(CONFIG, req.path());
        assertEquals("output_mode=json", req.query());
        assertEquals("Splunk sess-1", req.authorization());
    }

    @Test
    void rows_are_read_under_the_callers_owner() {
        server.respond("/servicesNS/alice/search/storage/collections/data/hosts", 200, """
                [{"_key":"k1","host":"web-1","geo":{"city":"Oslo"}},{"_key":"k2"}]
                """);

        List<Map<String, Object>> rows = client.fetchRows("search", "alice", "hosts", null);

        assertEquals(2, rows.size());
        assertEquals("web-1", rows.get(0).get("host"));
        assertEquals(Map.of("city", "Oslo"), rows.get(0).get("geo"));
        assertNull(server.requests().get(0).authorization());
    }

    @Test
    void shared_rows_are_read_as_nobody() {
        server.respond("/servicesNS/nobody/search/storage/collections/data/hosts", 200, "[]");

        assertTrue(client.fetchRows("search", null, "hosts", null).isEmpty());
    }

    @Test
    void forbidden_maps_to_permission_denied() {
        server.respond(CONFIG, 403, "{\"messages\":[]}");

        assertThrows(PermissionDeniedException.class, () -> client.fetchSchema("search", "hosts", null));
    }

    @Test
    void missing_collection_maps_to_not_found() {
        assertThrows(LookupNotFoundException.class, () -> client.fetchSchema("search", "nope", null));
    }

    @Test
    void empty_config_entry_list_is_not_found() {
        server.respond(CONFIG, 200, "{\"entry\":[]}");

        assertThrows(LookupNotFoundException.class, () -> client.fetchSchema("search", "hosts", null));
    }

    @Test
    void server_error_keeps_status_and_body() {
        server.respond(CONFIG, 500, "boom");

        var ex = assertThrows(RemoteServiceException.class, () -> client.fetchSchema("search", "hosts", null));
        assertEquals(500, ex.statusCode());
        assertEquals("boom", ex.body());
    }

    @Test
    void malformed_json_is_a_remote_failure() {
        server.respond(CONFIG, 200, "{ not json");

        var ex = assertThrows(RemoteServiceException.class, () -> client.fetchSchema("search", "hosts", null));
        assertEquals(-1, ex.statusCode());
    }
}
