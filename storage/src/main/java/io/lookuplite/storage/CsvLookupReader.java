package io.lookuplite.storage;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import io.lookuplite.core.TabularProjector;
import io.lookuplite.core.Table;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a CSV lookup file into a {@link Table}.
 * <p>
 * Semantics:
 *  - The first record is the header; an empty file gives an empty table.
 *  - Short rows are padded with "", long rows are cut to the header width.
 *  - Rows whose cells are all blank are pruned.
 */
public final class CsvLookupReader {

    private static final CsvMapper CSV = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    /** Parse {@code reader} fully; the reader is closed afterwards. */
    public Table read(Reader reader) {
        try (reader; MappingIterator<String[]> it = CSV.readerFor(String[].class).readValues(reader)) {
            if (!it.hasNext()) {
                return new Table(List.of(), List.of());
            }

            List<String> header = Arrays.asList(it.next());
            int width = header.size();

            List<List<String>> rows = new ArrayList<>();
            while (it.hasNext()) {
                List<String> row = align(it.next(), width);
                if (!TabularProjector.isEmptyRow(row)) {
                    rows.add(row);
                }
            }
            return new Table(header, rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse lookup CSV", e);
        }
    }

    private static List<String> align(String[] cells, int width) {
        List<String> row = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            String cell = i < cells.length ? cells[i] : null;
            row.add(cell == null ? "" : cell);
        }
        return row;
    }
}
