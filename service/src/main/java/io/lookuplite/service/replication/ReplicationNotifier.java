package io.lookuplite.service.replication;

import java.net.URI;

/**
 * Best-effort notification that a lookup file changed, so that a cluster
 * can replicate it. Failures are reported in the result, never thrown.
 */
public interface ReplicationNotifier {

    /**
     * @param app        namespace of the lookup
     * @param filename   lookup file name (reduced to its base name)
     * @param credential caller's session credential
     * @param targetUri  base URI of another server to notify, or null for the default
     */
    ReplicationResult notifyLookupUpdate(String app, String filename, String credential, URI targetUri);

    default ReplicationResult notifyLookupUpdate(String app, String filename, String credential) {
        return notifyLookupUpdate(app, filename, credential, null);
    }
}
