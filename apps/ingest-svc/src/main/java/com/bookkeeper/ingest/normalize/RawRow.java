package com.bookkeeper.ingest.normalize;

import java.util.List;

/**
 * One data line of a statement export, values in file order.
 */
public record RawRow(long lineNumber, List<String> values) {

    public RawRow {
        values = List.copyOf(values);
    }

    public String valueAt(int index) {
        if (index < 0 || index >= values.size()) {
            return null;
        }
        return values.get(index);
    }

    public int width() {
        return values.size();
    }
}
