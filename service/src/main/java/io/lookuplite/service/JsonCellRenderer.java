package io.lookuplite.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lookuplite.core.CellRenderer;

import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.Map;

/**
 * Cell renderer for KV records: scalars as text, arrays and objects as
 * compact JSON (e.g. {@code ["a","b"]}), null as "".
 */
public final class JsonCellRenderer implements CellRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> || value instanceof Map<?, ?> || value.getClass().isArray()) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Failed to render cell value", e);
            }
        }
        return String.valueOf(value);
    }
}
