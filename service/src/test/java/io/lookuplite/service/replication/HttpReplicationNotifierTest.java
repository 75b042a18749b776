package io.lookuplite.service.replication;

import io.lookuplite.service.FakeRestServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpReplicationNotifierTest {

    private static final int PORT = 18182; // test-only port
    private static final String ENDPOINT = "/services/replication/configuration/lookup-update-notify";

    private FakeRestServer server;
    private HttpReplicationNotifier notifier;

    @BeforeEach
    void startServer() {
        server = new FakeRestServer(PORT);
        notifier = new HttpReplicationNotifier(server.baseUri(), Duration.ofSeconds(5));
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.close();
        }
    }

    @Test
    void ok_response_is_success() {
        server.respond(ENDPOINT, 200, "{}");

        ReplicationResult r = notifier.notifyLookupUpdate("search", "hosts.csv", "sess-1");

        assertEquals(new ReplicationResult(true, 200, "{}"), r);
    }

    @Test
    void clustering_not_enabled_is_success() {
        String body = "{\"messages\":[{\"text\":\"No local ConfRepo registered\"}]}";
        server.respond(ENDPOINT, 400, body);

        assertEquals(new ReplicationResult(true, 400, body), notifier.notifyLookupUpdate("search", "hosts.csv", null));
    }

    @Test
    void unknown_lookup_is_failure() {
        String body = "{\"messages\":[{\"text\":\"Could not find lookup_table_file\"}]}";
        server.respond(ENDPOINT, 400, body);

        assertEquals(new ReplicationResult(false, 400, body), notifier.notifyLookupUpdate("search", "hosts.csv", null));
    }

    @Test
    void other_bad_request_and_errors_are_failures() {
        server.respond(ENDPOINT, 400, "something else");
        assertFalse(notifier.notifyLookupUpdate("search", "hosts.csv", null).ok());

        server.respond(ENDPOINT, 503, "down");
        ReplicationResult r = notifier.notifyLookupUpdate("search", "hosts.csv", null);
        assertFalse(r.ok());
        assertEquals(503, r.statusCode());
    }

    @Test
    void form_carries_app_base_filename_and_nobody() {
        server.respond(ENDPOINT, 200, "{}");

        notifier.notifyLookupUpdate("search", "../lookups/hosts.csv", "sess-1");

        var req = server.requests().get(0);
        assertEquals("POST", req.method());
        assertEquals("app=search&filename=hosts.csv&user=nobody", req.body());
        assertEquals("Splunk sess-1", req.authorization());
    }

    @Test
    void unreachable_target_is_failure_without_exception() {
        ReplicationResult r = notifier.notifyLookupUpdate(
                "search", "hosts.csv", null, URI.create("http://localhost:1"));

        assertFalse(r.ok());
        assertEquals(-1, r.statusCode());
    }

    @Test
    void analyze_covers_the_status_table() {
        assertTrue(HttpReplicationNotifier.analyze("f", 200, "{}").ok());
        assertTrue(HttpReplicationNotifier.analyze("f", 400, "No local ConfRepo registered").ok());
        assertFalse(HttpReplicationNotifier.analyze("f", 400, "Could not find lookup_table_file").ok());
        assertFalse(HttpReplicationNotifier.analyze("f", 400, null).ok());
        assertFalse(HttpReplicationNotifier.analyze("f", 401, "").ok());
    }
}
