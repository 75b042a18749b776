package io.lookuplite.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * JSON shape of the editor config file. Missing fields stay null and are
 * replaced by defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonEditorConfig {
    public String appRoot;
    public String remoteBaseUri;
    public Long maxEditableSizeBytes;
    public String defaultNamespace;
    public Boolean fallbackToDefaultForVersions;
    public Long requestTimeoutSeconds;
}
