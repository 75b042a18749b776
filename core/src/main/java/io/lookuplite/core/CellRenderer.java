package io.lookuplite.core;

/**
 * Turns a record value into the text of one table cell.
 */
@FunctionalInterface
public interface CellRenderer {

    /** null becomes "", anything else its {@code String.valueOf}. */
    CellRenderer DEFAULT = value -> value == null ? "" : String.valueOf(value);

    String render(Object value);
}
