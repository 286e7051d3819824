package org.pharmaguard.utils.tsv;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.utils.Utils;

import java.io.Closeable;
import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Reads the records of a tab-separated table with a header line.
 * <p>
 * Lines starting with {@link #COMMENT_PREFIX} are skipped. The first non-comment line is the header; a repeat of the
 * header later in the file is ignored. Subclasses turn each {@link DataLine} into a record in
 * {@link #createRecord(DataLine)}, returning {@code null} to skip a line.
 * </p>
 *
 * @param <R> record type.
 */
public abstract class TableReader<R> implements Closeable, Iterable<R> {

    public static final String COMMENT_PREFIX = "#";

    public static final char COLUMN_SEPARATOR = '\t';

    public static final char QUOTE_CHARACTER = '"';

    private final String source;

    private final LineNumberReader reader;

    private final CSVReader csvReader;

    private final TableColumnCollection columns;

    private boolean nextRecordFetched = false;

    private R nextRecord;

    public TableReader(final Path path) throws IOException {
        this(Utils.nonNull(path, "the input file cannot be null").toString(),
                Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    protected TableReader(final String sourceName, final Reader sourceReader) throws IOException {
        Utils.nonNull(sourceReader, "the reader cannot be null");
        this.source = sourceName;
        this.reader = sourceReader instanceof LineNumberReader ? (LineNumberReader) sourceReader : new LineNumberReader(sourceReader);
        this.csvReader = new CSVReaderBuilder(this.reader)
                .withCSVParser(new CSVParserBuilder()
                        .withSeparator(COLUMN_SEPARATOR)
                        .withQuoteChar(QUOTE_CHARACTER)
                        .build())
                .build();
        final String[] header = readHeaderLine();
        this.columns = new TableColumnCollection(trimAll(header));
        processColumns(columns);
    }

    /**
     * Lets subclasses validate the header, typically by checking required columns are present.
     */
    protected void processColumns(final TableColumnCollection tableColumns) {
        // nothing by default.
    }

    protected abstract R createRecord(final DataLine dataLine);

    public TableColumnCollection columns() {
        return columns;
    }

    protected final UserException.BadInput formatException(final String message) {
        final String explanation = message == null ? "" : ": " + message;
        if (source == null) {
            return new UserException.BadInput(String.format("format error at line %d" + explanation, reader.getLineNumber()));
        } else {
            return new UserException.BadInput(String.format("format error in '%s' at line %d" + explanation, source, reader.getLineNumber()));
        }
    }

    /**
     * @return the next record, or {@code null} at the end of the table.
     */
    public final R readRecord() throws IOException {
        if (!nextRecordFetched) {
            nextRecord = fetchNextRecord();
        }
        nextRecordFetched = false;
        return nextRecord;
    }

    /**
     * Reads every remaining record.
     */
    public final List<R> toList() throws IOException {
        final List<R> result = new ArrayList<>();
        R record;
        while ((record = readRecord()) != null) {
            result.add(record);
        }
        return result;
    }

    private R fetchNextRecord() throws IOException {
        nextRecordFetched = true;
        String[] line;
        while ((line = readNextLine()) != null) {
            if (isCommentLine(line) || isBlankLine(line) || columns.matchesExactly(trimAll(line))) {
                continue;
            }
            if (line.length != columns.columnCount()) {
                throw formatException(String.format("mismatch between number of values in line (%d) and number of columns (%d)",
                        line.length, columns.columnCount()));
            }
            final R result = createRecord(new DataLine(reader.getLineNumber(), line, columns, this::formatException));
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    private String[] readHeaderLine() throws IOException {
        String[] line;
        while ((line = readNextLine()) != null) {
            if (!isCommentLine(line) && !isBlankLine(line)) {
                return line;
            }
        }
        throw formatException("premature end of table: header line not found");
    }

    private String[] readNextLine() throws IOException {
        try {
            return csvReader.readNext();
        } catch (final CsvValidationException ex) {
            throw formatException(ex.getMessage());
        }
    }

    private static boolean isCommentLine(final String[] line) {
        return line.length > 0 && line[0].startsWith(COMMENT_PREFIX);
    }

    private static boolean isBlankLine(final String[] line) {
        return line.length == 0 || (line.length == 1 && line[0].trim().isEmpty());
    }

    private static String[] trimAll(final String[] values) {
        final String[] trimmed = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            trimmed[i] = values[i].trim();
        }
        return trimmed;
    }

    @Override
    public void close() throws IOException {
        csvReader.close();
    }

    @Override
    public Iterator<R> iterator() {
        return new Iterator<R>() {

            @Override
            public boolean hasNext() {
                if (!nextRecordFetched) {
                    try {
                        nextRecord = fetchNextRecord();
                    } catch (final IOException ex) {
                        throw new UserException.CouldNotReadInputFile(String.valueOf(source), "could not read the next record", ex);
                    }
                }
                return nextRecord != null;
            }

            @Override
            public R next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("no more records");
                }
                nextRecordFetched = false;
                return nextRecord;
            }
        };
    }
}
