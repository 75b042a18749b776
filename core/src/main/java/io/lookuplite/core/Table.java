package io.lookuplite.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rectangular view of a lookup: a header plus rows of string cells.
 * <p>
 * Invariant: every row has exactly {@code header.size()} cells, so header and
 * row can be zipped positionally without bounds checks. Enforced here.
 * <p>
 * KV lookups use their {@link FieldList} as header; file lookups use the
 * first line of the file.
 */
public record Table(List<String> header, List<List<String>> rows) {

    public Table {
        header = List.copyOf(Objects.requireNonNull(header, "header"));
        Objects.requireNonNull(rows, "rows");

        List<List<String>> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (row.size() != header.size()) {
                throw new IllegalArgumentException(
                        "row %d has %d cells, expected %d".formatted(i, row.size(), header.size())
                );
            }
            copy.add(List.copyOf(row));
        }
        rows = List.copyOf(copy);
    }

    /** Number of data rows (header excluded). */
    public int size() {
        return rows.size();
    }

    /** Header first, then the data rows, the shape flat-file lookups use. */
    public List<List<String>> toRows() {
        List<List<String>> out = new ArrayList<>(rows.size() + 1);
        out.add(header);
        out.addAll(rows);
        return out;
    }
}
