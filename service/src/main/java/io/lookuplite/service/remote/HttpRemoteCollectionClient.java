package io.lookuplite.service.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lookuplite.core.FieldList;
import io.lookuplite.core.LookupIdentity;
import io.lookuplite.core.LookupNotFoundException;
import io.lookuplite.core.PermissionDeniedException;
import io.lookuplite.service.RemoteCallLogger;
import io.lookuplite.service.RestPaths;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP/JSON {@link RemoteCollectionClient}.
 * <p>
 * Endpoints:
 * <pre>
 *   GET /servicesNS/nobody/&lt;ns&gt;/storage/collections/config/&lt;name&gt;?output_mode=json
 *   GET /servicesNS/&lt;owner&gt;/&lt;ns&gt;/storage/collections/data/&lt;name&gt;?output_mode=json
 * </pre>
 * Status mapping:
 *  - 200 -> parsed body
 *  - 403 -> {@link PermissionDeniedException}
 *  - 404 -> {@link LookupNotFoundException}
 *  - anything else, unparsable bodies and transport failures -> {@link RemoteServiceException}
 * <p>
 * The credential, when present, is sent as {@code Authorization: Splunk <credential>}.
 */
public final class HttpRemoteCollectionClient implements RemoteCollectionClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Map<String, Object>>> ROWS_TYPE = new TypeReference<>() {};

    private final URI baseUri;
    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpRemoteCollectionClient(URI baseUri, Duration requestTimeout) {
        this(baseUri, HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(), requestTimeout);
    }

    public HttpRemoteCollectionClient(URI baseUri, HttpClient client, Duration requestTimeout) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.client = Objects.requireNonNull(client, "client");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public FieldList fetchSchema(String namespace, String collection, String credential) {
        String path = collectionPath(LookupIdentity.SHARED_OWNER, namespace, "config", collection);
        String body = get(path, credential);

        CollectionConfigResponse dto = parse(body, path, b -> MAPPER.readValue(b, CollectionConfigResponse.class));
        if (dto.entry().isEmpty()) {
            throw new LookupNotFoundException("Collection " + collection + " has no config entry in " + namespace);
        }
        return FieldList.fromSchema(dto.entry().get(0).content());
    }

    @Override
    public List<Map<String, Object>> fetchRows(String namespace, String owner, String collection, String credential) {
        String effectiveOwner = (owner == null || owner.isBlank()) ? LookupIdentity.SHARED_OWNER : owner;
        String path = collectionPath(effectiveOwner, namespace, "data", collection);
        String body = get(path, credential);

        List<Map<String, Object>> rows = parse(body, path, b -> MAPPER.readValue(b, ROWS_TYPE));
        return rows != null ? rows : List.of();
    }

    private static String collectionPath(String owner, String namespace, String kind, String collection) {
        return "/servicesNS/" + RestPaths.segment(owner)
                + "/" + RestPaths.segment(namespace)
                + "/storage/collections/" + kind + "/" + RestPaths.segment(collection);
    }

    /** GET {@code path?output_mode=json} and return the body of a 200 response. */
    private String get(String path, String credential) {
        URI uri = RestPaths.join(baseUri, path + "?output_mode=json");

        HttpRequest.Builder req = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET();
        if (credential != null && !credential.isBlank()) {
            req.header("Authorization", "Splunk " + credential);
        }

        long start = System.nanoTime();
        int status = -1;
        Throwable error = null;
        try {
            HttpResponse<String> resp = client.send(req.build(), HttpResponse.BodyHandlers.ofString());
            status = resp.statusCode();

            if (status == 200) {
                return resp.body();
            } else if (status == 403) {
                throw new PermissionDeniedException("You do not have permission to view this lookup");
            } else if (status == 404) {
                throw new LookupNotFoundException("Collection not found: " + path);
            }
            throw new RemoteServiceException("Unexpected response for " + path, status, resp.body());
        } catch (IOException e) {
            error = e;
            throw new RemoteServiceException("Failed to call " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = e;
            throw new RemoteServiceException("Interrupted while calling " + path, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RemoteCallLogger.logCall("GET", path, status, totalMs, error);
        }
    }

    private static <T> T parse(String body, String path, JsonReader<T> reader) {
        try {
            return reader.read(body);
        } catch (JsonProcessingException e) {
            throw new RemoteServiceException("Malformed JSON from " + path, e);
        }
    }

    @FunctionalInterface
    private interface JsonReader<T> {
        T read(String body) throws JsonProcessingException;
    }
}
