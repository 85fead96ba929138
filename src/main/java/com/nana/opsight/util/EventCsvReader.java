package com.nana.opsight.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * EventCsvReader - streams an event export in fixed-size chunks.
 *
 * <p>Exports run to millions of rows, so records are read lazily and handed
 * out {@code chunkSize} at a time; only the current chunk is held in memory.
 *
 * <p>PARSING: a minimal RFC 4180 reader.
 * <ul>
 *   <li>Quoted fields may contain commas, line breaks and doubled quotes.</li>
 *   <li>A quote inside an unquoted field is an ordinary character.</li>
 *   <li>CRLF and LF line endings are both accepted.</li>
 *   <li>A UTF-8 BOM before the header is dropped.</li>
 *   <li>Blank lines between records are skipped and do not count as rows.</li>
 * </ul>
 *
 * <p>Header names are trimmed. When a header repeats, the first occurrence
 * wins. Columns nobody asks for are simply never read.
 */
public final class EventCsvReader implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(EventCsvReader.class);

    private static final char BOM = '\uFEFF';

    private final BufferedReader reader;
    private final int chunkSize;
    private final List<String> headers;
    private final Map<String, Integer> headerIndex;

    /** Physical lines consumed so far. */
    private int lineNumber;

    /** Data records handed out so far. */
    private int recordCount;

    private EventCsvReader(BufferedReader reader, int chunkSize) throws IOException {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("Chunk size must be at least 1, got " + chunkSize);
        }
        this.reader    = reader;
        this.chunkSize = chunkSize;
        this.headers   = readHeader();
        this.headerIndex = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            headerIndex.putIfAbsent(headers.get(i), i);
        }
        log.debug("Header columns: {}", headers);
    }

    // -----------------------------------------------------------------------
    // FACTORY
    // -----------------------------------------------------------------------

    /**
     * Opens {@code path} and reads its header row.
     *
     * @param path      the export to read, UTF-8
     * @param chunkSize the maximum number of records per chunk, at least 1
     * @return a reader positioned at the first data record
     * @throws IOException if the file cannot be opened or its header is malformed
     */
    public static EventCsvReader open(Path path, int chunkSize) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a readable file: " + path.toAbsolutePath());
        }
        BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        try {
            return new EventCsvReader(reader, chunkSize);
        } catch (IOException | RuntimeException ex) {
            reader.close();
            throw ex;
        }
    }

    /**
     * Wraps an already open character stream. The reader takes ownership and
     * closes it.
     */
    public static EventCsvReader of(Reader source, int chunkSize) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
                ? (BufferedReader) source
                : new BufferedReader(source);
        return new EventCsvReader(reader, chunkSize);
    }

    // -----------------------------------------------------------------------
    // HEADER
    // -----------------------------------------------------------------------

    /** @return the trimmed header names in file order; empty for an empty file */
    public List<String> getHeaders() {
        return Collections.unmodifiableList(headers);
    }

    public boolean hasColumn(String header) {
        return headerIndex.containsKey(header);
    }

    /** @return the 0-based position of {@code header}, or -1 if absent */
    public int indexOf(String header) {
        return headerIndex.getOrDefault(header, -1);
    }

    // -----------------------------------------------------------------------
    // RECORDS
    // -----------------------------------------------------------------------

    /**
     * Reads up to {@code chunkSize} records.
     *
     * @return the next records in file order; empty once the file is exhausted
     * @throws CsvFormatException if a quoted field is never closed
     * @throws IOException        if reading fails
     */
    public List<CsvRecord> nextChunk() throws IOException {
        List<CsvRecord> chunk = new ArrayList<>(Math.min(chunkSize, 1024));
        while (chunk.size() < chunkSize) {
            int startLine = lineNumber + 1;
            String text = readRecordText();
            if (text == null) {
                break;
            }
            if (text.isBlank()) {
                continue;
            }
            recordCount++;
            chunk.add(new CsvRecord(recordCount, startLine, parseCsvRow(text)));
        }
        return chunk;
    }

    /** @return the number of data records read so far */
    public int getRecordCount() {
        return recordCount;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    // -----------------------------------------------------------------------
    // PRIVATE
    // -----------------------------------------------------------------------

    private List<String> readHeader() throws IOException {
        String text;
        do {
            text = readRecordText();
        } while (text != null && text.isBlank());

        if (text == null) {
            return new ArrayList<>();
        }
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
            log.debug("UTF-8 BOM detected and stripped.");
        }
        List<String> names = new ArrayList<>();
        for (String raw : parseCsvRow(text)) {
            names.add(raw.replace(String.valueOf(BOM), "").trim());
        }
        return names;
    }

    /**
     * Reads one logical record, joining physical lines while a quoted field
     * is open.
     *
     * @return the record text without its final line break, or null at EOF
     */
    private String readRecordText() throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        lineNumber++;
        int startLine = lineNumber;
        FieldState state = scan(line, FieldState.FIELD_START);
        if (state != FieldState.QUOTED) {
            return line;
        }
        StringBuilder record = new StringBuilder(line);
        while (state == FieldState.QUOTED) {
            String next = reader.readLine();
            if (next == null) {
                throw new CsvFormatException(
                        "Unclosed quoted field in record starting on line " + startLine);
            }
            lineNumber++;
            record.append('\n').append(next);
            state = scan(next, state);
        }
        return record.toString();
    }

    /** @return the field state after reading {@code line} from {@code state} */
    private static FieldState scan(String line, FieldState state) {
        for (int i = 0; i < line.length(); i++) {
            state = state.next(line.charAt(i));
        }
        return state;
    }

    /**
     * Splits one record into fields using RFC 4180 rules: a field that
     * starts with a quote runs to its closing quote and {@code ""} inside it
     * becomes {@code "}. A quote anywhere else is kept as a literal
     * character, so {@code 5" pipe} stays one field.
     *
     * @param record a complete record, possibly spanning lines
     * @return the field values
     */
    static List<String> parseCsvRow(String record) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        FieldState state = FieldState.FIELD_START;

        for (int i = 0; i < record.length(); i++) {
            char c = record.charAt(i);
            FieldState next = state.next(c);
            if (next == FieldState.FIELD_START) {
                fields.add(current.toString());
                current.setLength(0);
            } else if (c != '"' || (state != FieldState.FIELD_START && state != FieldState.QUOTED)) {
                current.append(c);
            }
            state = next;
        }
        fields.add(current.toString());
        return fields;
    }

    /**
     * Position inside the current field. A record continues onto the next
     * line only while a field is {@link #QUOTED}.
     */
    private enum FieldState {
        /** Nothing read yet for this field. */
        FIELD_START,
        /** Inside a field that did not start with a quote; quotes are literal. */
        UNQUOTED,
        /** Inside a quoted field. */
        QUOTED,
        /** Just read a quote inside a quoted field: either its end or the first half of {@code ""}. */
        AFTER_QUOTE;

        FieldState next(char c) {
            return switch (this) {
                case QUOTED      -> c == '"' ? AFTER_QUOTE : QUOTED;
                case AFTER_QUOTE -> c == '"' ? QUOTED : outside(c);
                case FIELD_START -> c == '"' ? QUOTED : outside(c);
                case UNQUOTED    -> outside(c);
            };
        }

        private static FieldState outside(char c) {
            return c == ',' ? FIELD_START : UNQUOTED;
        }
    }

    // -----------------------------------------------------------------------
    // INNER TYPES
    // -----------------------------------------------------------------------

    /**
     * One data record. {@code rowNumber} counts data records from 1 and
     * skips blank lines; {@code lineNumber} is where the record starts in
     * the file, header included.
     */
    public static final class CsvRecord {

        private final int rowNumber;
        private final int lineNumber;
        private final List<String> fields;

        public CsvRecord(int rowNumber, int lineNumber, List<String> fields) {
            this.rowNumber  = rowNumber;
            this.lineNumber = lineNumber;
            this.fields     = List.copyOf(fields);
        }

        public int getRowNumber()       { return rowNumber; }

        public int getLineNumber()      { return lineNumber; }

        public List<String> getFields() { return fields; }

        /** @return the field at {@code index}, or null when the record is shorter or index is -1 */
        public String get(int index) {
            return index >= 0 && index < fields.size() ? fields.get(index) : null;
        }

        @Override
        public String toString() {
            return "CsvRecord{row=" + rowNumber + ", line=" + lineNumber
                   + ", fields=" + fields.size() + "}";
        }
    }

    /** A record that cannot be split, such as one with an unclosed quote. */
    public static final class CsvFormatException extends IOException {

        public CsvFormatException(String message) {
            super(message);
        }
    }
}
