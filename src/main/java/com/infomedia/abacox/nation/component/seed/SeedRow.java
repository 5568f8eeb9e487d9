package com.infomedia.abacox.nation.component.seed;

import java.util.Map;

/**
 * One CSV record of a seed dataset, addressed by header name.
 */
public class SeedRow {

    private final Map<String, String> values;
    private final long line;

    SeedRow(Map<String, String> values, long line) {
        this.values = values;
        this.line = line;
    }

    public long getLine() {
        return line;
    }

    public String text(String column) {
        String value = values.get(column);
        if (value == null) {
            throw new SeedDatasetException("Missing column '" + column + "' at line " + line);
        }
        return value.trim();
    }

    public Integer integer(String column) {
        String value = text(column);
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new SeedDatasetException("Column '" + column + "' at line " + line + " is not an integer: " + value, e);
        }
    }
}
