package io.lookuplite.service.remote;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response of {@code GET .../storage/collections/config/<name>?output_mode=json}:
 * <pre>
 *   { "entry": [ { "name": "hosts", "content": { "field.host": "string", ... } } ] }
 * </pre>
 * Only {@code entry[].content} is consumed. Content keys keep their order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CollectionConfigResponse {
    private final List<Entry> entry;

    @JsonCreator
    public CollectionConfigResponse(@JsonProperty("entry") List<Entry> entry) {
        this.entry = entry != null ? entry : List.of();
    }

    public List<Entry> entry() {
        return entry;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Entry {
        private final LinkedHashMap<String, Object> content;

        @JsonCreator
        public Entry(@JsonProperty("content") LinkedHashMap<String, Object> content) {
            this.content = content != null ? content : new LinkedHashMap<>();
        }

        public Map<String, Object> content() {
            return content;
        }
    }
}
