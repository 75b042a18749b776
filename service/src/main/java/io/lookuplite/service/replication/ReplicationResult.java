package io.lookuplite.service.replication;

/**
 * Outcome of a replication notification.
 *
 * @param ok         whether the notification counts as delivered
 * @param statusCode HTTP status, or -1 if the call never got a response
 * @param body       response body, or the transport error message
 */
public record ReplicationResult(boolean ok, int statusCode, String body) {
}
