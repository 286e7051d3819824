package org.pharmaguard.utils.tsv;

import org.pharmaguard.utils.Utils;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, named columns of a tab-separated table.
 */
public final class TableColumnCollection {

    private final List<String> names;

    private final Map<String, Integer> indexByName;

    public TableColumnCollection(final String... names) {
        Utils.nonNull(names, "the column names cannot be null");
        this.names = Collections.unmodifiableList(Arrays.asList(names.clone()));
        this.indexByName = new HashMap<>(names.length);
        for (int i = 0; i < names.length; i++) {
            Utils.nonNull(names[i], "column names cannot be null");
            if (indexByName.putIfAbsent(names[i], i) != null) {
                throw new IllegalArgumentException("duplicate column name: " + names[i]);
            }
        }
    }

    public List<String> names() {
        return names;
    }

    public int columnCount() {
        return names.size();
    }

    public boolean contains(final String name) {
        return indexByName.containsKey(name);
    }

    public boolean containsAll(final String... names) {
        return Arrays.stream(names).allMatch(this::contains);
    }

    /**
     * @return the index of the column, or -1 if there is no such column.
     */
    public int indexOf(final String name) {
        return indexByName.getOrDefault(name, -1);
    }

    /**
     * Checks whether a line of values is identical to the column names (a repeated header).
     */
    public boolean matchesExactly(final String... values) {
        return values.length == names.size() && Arrays.asList(values).equals(names);
    }
}
