package io.lookuplite.service.remote;

import io.lookuplite.core.FieldList;

import java.util.List;
import java.util.Map;

/**
 * Read access to a remote key-value collection.
 * <p>
 * Both reads are idempotent and carry no retry policy; retries belong to the
 * transport. Authorization failures surface as
 * {@link io.lookuplite.core.PermissionDeniedException}, unknown collections as
 * {@link io.lookuplite.core.LookupNotFoundException}.
 */
public interface RemoteCollectionClient {

    /**
     * Declared fields of a collection. Always read under the system owner,
     * so schema visibility does not depend on the caller's permissions.
     */
    FieldList fetchSchema(String namespace, String collection, String credential);

    /**
     * Raw records of a collection, read under {@code owner} (null means shared).
     * Records may be nested; each may carry the reserved "_key" field.
     */
    List<Map<String, Object>> fetchRows(String namespace, String owner, String collection, String credential);
}
