package com.nana.opsight.util;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * IngestReport - immutable outcome of one event load.
 *
 * <p>Built chunk by chunk through {@link Builder}; each recorded chunk hands
 * back a {@link ChunkResult} whose {@link ChunkResult#toProgressLine()} is
 * what the CLI prints after every commit. Dropped rows are counted in full,
 * but only the first {@value #MAX_DROPPED_EXAMPLES} are kept with their
 * reason.
 *
 * <p>A report only ever describes committed chunks. A load that aborts
 * throws instead of returning a report; the chunks committed before the
 * failure are in the log.
 */
public final class IngestReport {

    /** Upper bound on dropped rows kept for {@link #toReportText()}. */
    public static final int MAX_DROPPED_EXAMPLES = 100;

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    private final Path sourceFile;
    private final LocalDateTime startedAt;
    private final LocalDateTime finishedAt;
    private final long rowsRead;
    private final long rowsDropped;
    private final long operatorsCreated;
    private final long sessionsCreated;
    private final long eventsInserted;
    private final List<ChunkResult> chunks;
    private final List<DroppedRow> droppedExamples;

    private IngestReport(Builder builder) {
        this.sourceFile       = builder.sourceFile;
        this.startedAt        = builder.startedAt;
        this.finishedAt       = LocalDateTime.now();
        this.rowsRead         = builder.rowsRead;
        this.rowsDropped      = builder.rowsDropped;
        this.operatorsCreated = builder.operatorsCreated;
        this.sessionsCreated  = builder.sessionsCreated;
        this.eventsInserted   = builder.eventsInserted;
        this.chunks           = Collections.unmodifiableList(new ArrayList<>(builder.chunks));
        this.droppedExamples  = Collections.unmodifiableList(new ArrayList<>(builder.droppedExamples));
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public Path getSourceFile()                 { return sourceFile; }

    public LocalDateTime getStartedAt()         { return startedAt; }

    public LocalDateTime getFinishedAt()        { return finishedAt; }

    public long getRowsRead()                   { return rowsRead; }

    public long getRowsDropped()                { return rowsDropped; }

    public long getOperatorsCreated()           { return operatorsCreated; }

    public long getSessionsCreated()            { return sessionsCreated; }

    public long getEventsInserted()             { return eventsInserted; }

    public int getChunkCount()                  { return chunks.size(); }

    public List<ChunkResult> getChunks()        { return chunks; }

    public List<DroppedRow> getDroppedExamples() { return droppedExamples; }

    /**
     * @return the closing line printed by the CLI, e.g.
     *         {@code Done. Total inserted into Events: 120,000}
     */
    public String getSummary() {
        return String.format(Locale.US, "Done. Total inserted into Events: %,d", eventsInserted);
    }

    /**
     * Multi-line report suitable for the log file.
     */
    public String toReportText() {
        StringBuilder sb = new StringBuilder();
        String line60  = "=".repeat(60);
        String line60d = "-".repeat(60);
        long seconds = Duration.between(startedAt, finishedAt).getSeconds();

        sb.append(line60).append('\n');
        sb.append(" Opsight - Event Load Report\n");
        sb.append(line60).append('\n');
        sb.append(String.format(Locale.US, " %-18s: %s%n", "Source File",
                sourceFile != null ? sourceFile.getFileName() : "Unknown"));
        sb.append(String.format(Locale.US, " %-18s: %s%n", "Started At", startedAt.format(DISPLAY_FORMAT)));
        sb.append(String.format(Locale.US, " %-18s: %ds%n", "Duration", seconds));
        sb.append(String.format(Locale.US, " %-18s: %,d%n", "Chunks", chunks.size()));
        sb.append(String.format(Locale.US, " %-18s: %,d%n", "Rows Read", rowsRead));
        sb.append(String.format(Locale.US, " %-18s: %,d%n", "Rows Dropped", rowsDropped));
        sb.append(String.format(Locale.US, " %-18s: %,d%n", "Operators Created", operatorsCreated));
        sb.append(String.format(Locale.US, " %-18s: %,d%n", "Sessions Created", sessionsCreated));
        sb.append(String.format(Locale.US, " %-18s: %,d%n", "Events Inserted", eventsInserted));
        sb.append(line60d).append('\n');

        if (droppedExamples.isEmpty()) {
            sb.append(" No rows dropped.\n");
        } else {
            sb.append(" DROPPED ROWS");
            if (rowsDropped > droppedExamples.size()) {
                sb.append(" (first ").append(droppedExamples.size()).append(')');
            }
            sb.append(":\n");
            for (DroppedRow row : droppedExamples) {
                sb.append(String.format(Locale.US, " Row %-7d (line %d) | %s%n",
                        row.getRowNumber(), row.getLineNumber(), row.getReason()));
            }
        }
        sb.append(line60).append('\n');
        return sb.toString();
    }

    @Override
    public String toString() {
        return "IngestReport{chunks=" + chunks.size()
               + ", read=" + rowsRead
               + ", dropped=" + rowsDropped
               + ", operators=" + operatorsCreated
               + ", sessions=" + sessionsCreated
               + ", events=" + eventsInserted + "}";
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: ChunkResult
    // -----------------------------------------------------------------------

    /** Counters of one committed chunk plus the running event total. */
    public static final class ChunkResult {

        private final int  chunkNumber;
        private final int  rowsRead;
        private final int  rowsDropped;
        private final int  operatorsCreated;
        private final int  sessionsCreated;
        private final int  eventsInserted;
        private final long totalInserted;

        ChunkResult(int chunkNumber, int rowsRead, int rowsDropped, int operatorsCreated,
                    int sessionsCreated, int eventsInserted, long totalInserted) {
            this.chunkNumber      = chunkNumber;
            this.rowsRead         = rowsRead;
            this.rowsDropped      = rowsDropped;
            this.operatorsCreated = operatorsCreated;
            this.sessionsCreated  = sessionsCreated;
            this.eventsInserted   = eventsInserted;
            this.totalInserted    = totalInserted;
        }

        public int getChunkNumber()      { return chunkNumber; }

        public int getRowsRead()         { return rowsRead; }

        public int getRowsDropped()      { return rowsDropped; }

        public int getOperatorsCreated() { return operatorsCreated; }

        public int getSessionsCreated()  { return sessionsCreated; }

        public int getEventsInserted()   { return eventsInserted; }

        public long getTotalInserted()   { return totalInserted; }

        /** @return e.g. {@code Inserted 50,000 events (total: 100,000)} */
        public String toProgressLine() {
            return String.format(Locale.US, "Inserted %,d events (total: %,d)", eventsInserted, totalInserted);
        }

        @Override
        public String toString() {
            return "ChunkResult{chunk=" + chunkNumber
                   + ", read=" + rowsRead
                   + ", dropped=" + rowsDropped
                   + ", inserted=" + eventsInserted
                   + ", total=" + totalInserted + "}";
        }
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: DroppedRow
    // -----------------------------------------------------------------------

    /** A row left out of the load because an identifying field was unusable. */
    public static final class DroppedRow {

        private final int    rowNumber;
        private final int    lineNumber;
        private final String reason;

        public DroppedRow(int rowNumber, int lineNumber, String reason) {
            this.rowNumber  = rowNumber;
            this.lineNumber = lineNumber;
            this.reason     = reason == null ? "" : reason;
        }

        public int getRowNumber()  { return rowNumber; }

        public int getLineNumber() { return lineNumber; }

        public String getReason()  { return reason; }

        @Override
        public String toString() {
            return "DroppedRow{row=" + rowNumber + ", reason='" + reason + "'}";
        }
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: Builder
    // -----------------------------------------------------------------------

    public static final class Builder {

        private final Path          sourceFile;
        private final LocalDateTime startedAt;
        private long rowsRead;
        private long rowsDropped;
        private long operatorsCreated;
        private long sessionsCreated;
        private long eventsInserted;
        private final List<ChunkResult> chunks = new ArrayList<>();
        private final List<DroppedRow> droppedExamples = new ArrayList<>();

        public Builder(Path sourceFile) {
            this.sourceFile = sourceFile;
            this.startedAt  = LocalDateTime.now();
        }

        /**
         * Notes a dropped row. Only the first {@value IngestReport#MAX_DROPPED_EXAMPLES}
         * are kept; the count in {@link #recordChunk} is what totals use.
         */
        public Builder addDropped(int rowNumber, int lineNumber, String reason) {
            if (droppedExamples.size() < MAX_DROPPED_EXAMPLES) {
                droppedExamples.add(new DroppedRow(rowNumber, lineNumber, reason));
            }
            return this;
        }

        /**
         * Adds a committed chunk to the totals.
         *
         * @return the chunk's counters, numbered from 1
         */
        public ChunkResult recordChunk(int rowsRead, int rowsDropped, int operatorsCreated,
                                       int sessionsCreated, int eventsInserted) {
            this.rowsRead         += rowsRead;
            this.rowsDropped      += rowsDropped;
            this.operatorsCreated += operatorsCreated;
            this.sessionsCreated  += sessionsCreated;
            this.eventsInserted   += eventsInserted;
            ChunkResult result = new ChunkResult(chunks.size() + 1, rowsRead, rowsDropped,
                    operatorsCreated, sessionsCreated, eventsInserted, this.eventsInserted);
            chunks.add(result);
            return result;
        }

        public long getEventsInserted() {
            return eventsInserted;
        }

        public IngestReport build() {
            return new IngestReport(this);
        }
    }
}
