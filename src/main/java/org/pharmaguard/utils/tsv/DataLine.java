package org.pharmaguard.utils.tsv;

import org.pharmaguard.utils.Utils;

import java.util.function.Function;

/**
 * One data line of a table, with access to its values by column name.
 */
public final class DataLine {

    private final long lineNumber;

    private final String[] values;

    private final TableColumnCollection columns;

    private final Function<String, RuntimeException> formatErrorFactory;

    DataLine(final long lineNumber, final String[] values, final TableColumnCollection columns,
             final Function<String, RuntimeException> formatErrorFactory) {
        this.lineNumber = lineNumber;
        this.values = Utils.nonNull(values, "the values cannot be null");
        this.columns = Utils.nonNull(columns, "the columns cannot be null");
        this.formatErrorFactory = Utils.nonNull(formatErrorFactory, "the format error factory cannot be null");
        Utils.validateArg(values.length == columns.columnCount(), "values and columns have different lengths");
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public TableColumnCollection columns() {
        return columns;
    }

    /**
     * Returns the value of a column, trimmed.
     * @throws RuntimeException built by the reader's format error factory when the column does not exist.
     */
    public String get(final String columnName) {
        final int index = columns.indexOf(columnName);
        if (index < 0) {
            throw formatErrorFactory.apply("there is no column named '" + columnName + "'");
        }
        return values[index].trim();
    }

    /**
     * Returns the trimmed value of a column, or {@code defaultValue} if the table has no such column.
     */
    public String get(final String columnName, final String defaultValue) {
        final int index = columns.indexOf(columnName);
        return index < 0 ? defaultValue : values[index].trim();
    }

    /**
     * Parses an integer column; blank or non-numeric values give {@code defaultValue}.
     */
    public int getInt(final String columnName, final int defaultValue) {
        final String value = get(columnName, "");
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException ex) {
            return defaultValue;
        }
    }
}
