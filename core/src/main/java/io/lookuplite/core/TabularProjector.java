package io.lookuplite.core;

import java.util.*;

/**
 * Projects heterogeneous, possibly nested key-value records onto a fixed
 * {@link FieldList}.
 * <p>
 * Per record:
 *  1) Flatten nested maps into dotted keys ("a" -> {"b": 1} gives "a.b"),
 *     restricted to keys the field list declares. A nested map is only
 *     descended when some declared field lives below it; everything else is
 *     dropped without being visited.
 *  2) Emit one cell per declared field, "" when the record lacks it.
 * <p>
 * Stateless; one instance can be shared across threads as long as the
 * renderer is.
 */
public final class TabularProjector {

    private final CellRenderer renderer;

    public TabularProjector() {
        this(CellRenderer.DEFAULT);
    }

    public TabularProjector(CellRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public Table project(FieldList fields, List<? extends Map<String, ?>> records) {
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(records, "records");

        List<List<String>> rows = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            Map<String, String> flat = flatten(record, fields);

            List<String> row = new ArrayList<>(fields.size());
            for (String field : fields) {
                row.add(flat.getOrDefault(field, ""));
            }
            rows.add(row);
        }
        return new Table(fields.names(), rows);
    }

    /**
     * Flatten one record into dotted keys, keeping only keys in {@code fields}.
     *
     * @return insertion-ordered map of declared key -> rendered cell text
     */
    public Map<String, String> flatten(Map<String, ?> record, FieldList fields) {
        Map<String, String> out = new LinkedHashMap<>();
        if (record != null) {
            flattenInto(record, "", fields, out);
        }
        return out;
    }

    private void flattenInto(Map<?, ?> source, String prefix, FieldList fields, Map<String, String> out) {
        for (Map.Entry<?, ?> e : source.entrySet()) {
            String key = prefix + e.getKey();
            Object value = e.getValue();

            if (fields.contains(key)) {
                out.put(key, renderer.render(value));
            }
            if (value instanceof Map<?, ?> nested && fields.hasNestedUnder(key)) {
                flattenInto(nested, key + ".", fields, out);
            }
        }
    }

    /**
     * True iff every cell is null or whitespace-only. Does not modify the row.
     */
    public static boolean isEmptyRow(List<String> row) {
        Objects.requireNonNull(row, "row");
        for (String cell : row) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
