package io.lookuplite.service.replication;

import io.lookuplite.core.LookupIdentity;
import io.lookuplite.core.LookupNames;
import io.lookuplite.service.RemoteCallLogger;
import io.lookuplite.service.RestPaths;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Posts {@code app, filename, user} to
 * {@code /services/replication/configuration/lookup-update-notify}.
 * <p>
 * Response analysis:
 *  - 200                                        -> ok
 *  - 400 "No local ConfRepo registered"         -> ok (clustering not enabled)
 *  - 400 "Could not find lookup_table_file"     -> failed
 *  - any other 400 or non-200                   -> failed
 *  - no response (I/O error, interrupt)         -> failed, status -1
 */
public final class HttpReplicationNotifier implements ReplicationNotifier {
    private static final Logger log = Logger.getLogger(HttpReplicationNotifier.class.getName());

    static final String ENDPOINT = "/services/replication/configuration/lookup-update-notify";
    static final String CLUSTERING_DISABLED = "No local ConfRepo registered";
    static final String LOOKUP_NOT_FOUND = "Could not find lookup_table_file";

    private final URI defaultBaseUri;
    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpReplicationNotifier(URI defaultBaseUri, Duration requestTimeout) {
        this(defaultBaseUri, HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(), requestTimeout);
    }

    public HttpReplicationNotifier(URI defaultBaseUri, HttpClient client, Duration requestTimeout) {
        this.defaultBaseUri = Objects.requireNonNull(defaultBaseUri, "defaultBaseUri");
        this.client = Objects.requireNonNull(client, "client");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public ReplicationResult notifyLookupUpdate(String app, String filename, String credential, URI targetUri) {
        Objects.requireNonNull(app, "app");
        String file = LookupNames.baseName(filename, "filename");

        String form = "app=" + RestPaths.form(app)
                + "&filename=" + RestPaths.form(file)
                + "&user=" + RestPaths.form(LookupIdentity.SHARED_OWNER);

        URI uri = RestPaths.join(targetUri != null ? targetUri : defaultBaseUri, ENDPOINT);
        HttpRequest.Builder req = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form));
        if (credential != null && !credential.isBlank()) {
            req.header("Authorization", "Splunk " + credential);
        }

        long start = System.nanoTime();
        int status = -1;
        Throwable error = null;
        try {
            HttpResponse<String> resp = client.send(req.build(), HttpResponse.BodyHandlers.ofString());
            status = resp.statusCode();
            return analyze(file, status, resp.body());
        } catch (IOException e) {
            error = e;
            return new ReplicationResult(false, -1, String.valueOf(e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = e;
            return new ReplicationResult(false, -1, "interrupted");
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RemoteCallLogger.logCall("POST", ENDPOINT, status, totalMs, error);
        }
    }

    static ReplicationResult analyze(String filename, int status, String body) {
        String content = body == null ? "" : body;

        if (status == 400 && content.contains(CLUSTERING_DISABLED)) {
            log.log(Level.INFO, "Lookup table replication not applicable for " + filename
                    + ": clustering not enabled");
            return new ReplicationResult(true, status, content);
        }

        if (status == 400 && content.contains(LOOKUP_NOT_FOUND)) {
            log.log(Level.SEVERE, String.format(
                    "Lookup table replication failed for %s: lookup file unknown to the cluster, content=\"%s\"",
                    filename, content));
            return new ReplicationResult(false, status, content);
        }

        if (status != 200) {
            log.log(Level.SEVERE, String.format(
                    "Lookup table replication failed for %s: status_code=\"%d\", content=\"%s\"",
                    filename, status, content));
            return new ReplicationResult(false, status, content);
        }

        log.log(Level.INFO, "Lookup table replication forced for " + filename);
        return new ReplicationResult(true, status, content);
    }
}
