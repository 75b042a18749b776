package io.lookuplite.core;

import java.util.*;

/**
 * Ordered column names of a lookup table.
 * <p>
 * Invariants:
 *  - The first name is always {@link #KEY_FIELD}.
 *  - Names are unique; later duplicates are dropped, first position wins.
 * <p>
 * For KV lookups the list is derived from the collection config, whose
 * user-visible fields are the keys carrying the {@link #FIELD_PREFIX} prefix.
 */
public final class FieldList implements Iterable<String> {

    /** Reserved identity column of every KV record. */
    public static final String KEY_FIELD = "_key";

    /** Prefix marking a declared field in a collection config. */
    public static final String FIELD_PREFIX = "field.";

    private final List<String> names;
    private final Set<String> lookup;
    /** Every dotted prefix of a declared name, e.g. "a." and "a.b." for "a.b.c". */
    private final Set<String> parents;

    private FieldList(List<String> names) {
        this.names = List.copyOf(names);
        this.lookup = Set.copyOf(names);

        Set<String> p = new HashSet<>();
        for (String name : names) {
            int dot = name.indexOf('.');
            while (dot > 0) {
                p.add(name.substring(0, dot + 1));
                dot = name.indexOf('.', dot + 1);
            }
        }
        this.parents = Set.copyOf(p);
    }

    /**
     * Build a field list from declared column names; {@link #KEY_FIELD} is
     * prepended unconditionally.
     */
    public static FieldList of(Collection<String> declared) {
        Objects.requireNonNull(declared, "declared");
        LinkedHashSet<String> ordered = new LinkedHashSet<>();
        ordered.add(KEY_FIELD);
        for (String name : declared) {
            if (name != null && !name.isEmpty()) {
                ordered.add(name);
            }
        }
        return new FieldList(new ArrayList<>(ordered));
    }

    public static FieldList of(String... declared) {
        return of(Arrays.asList(declared));
    }

    /**
     * Derive the field list from a collection config content map, e.g.
     * {@code {"field.host": "string", "field.ip": "string", "other": "x"}}
     * yields {@code [_key, host, ip]}. Encounter order is preserved.
     */
    public static FieldList fromSchema(Map<String, ?> content) {
        List<String> declared = new ArrayList<>();
        if (content != null) {
            for (String key : content.keySet()) {
                if (key.startsWith(FIELD_PREFIX) && key.length() > FIELD_PREFIX.length()) {
                    declared.add(key.substring(FIELD_PREFIX.length()));
                }
            }
        }
        return of(declared);
    }

    public List<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public boolean contains(String name) {
        return lookup.contains(name);
    }

    /**
     * True if some declared name lives below {@code path}, i.e. starts with
     * {@code path + "."}. Used to decide whether a nested map is worth flattening.
     */
    public boolean hasNestedUnder(String path) {
        return parents.contains(path + ".");
    }

    @Override
    public Iterator<String> iterator() {
        return names.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldList other && names.equals(other.names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
