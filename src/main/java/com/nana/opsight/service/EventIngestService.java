package com.nana.opsight.service;

import com.nana.opsight.domain.Event;
import com.nana.opsight.domain.Session;
import com.nana.opsight.repository.EventRepository;
import com.nana.opsight.repository.IntegrityViolationException;
import com.nana.opsight.repository.RepositoryException;
import com.nana.opsight.util.AppLogger;
import com.nana.opsight.util.DatabaseManager;
import com.nana.opsight.util.EventColumn;
import com.nana.opsight.util.EventCsvReader;
import com.nana.opsight.util.EventCsvReader.CsvRecord;
import com.nana.opsight.util.IngestReport;
import com.nana.opsight.util.TimestampParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * EventIngestService - loads an event export into the store chunk by chunk.
 *
 * <p>PER CHUNK:
 * <ol>
 *   <li>Read up to {@code chunkSize} records.</li>
 *   <li>Normalise: parse session id, operator id and timestamp; drop rows
 *       where any of them is unusable; convert and truncate the payload.</li>
 *   <li>Derive the chunk's sessions and check every shift label.</li>
 *   <li>In one transaction: add missing operators, add missing sessions,
 *       insert the events as one batch, commit.</li>
 * </ol>
 *
 * <p>Any failure rolls back the current chunk and ends the load; chunks
 * committed before it stay. Loading the same file twice fails on the event
 * insert of its first chunk, because each event keeps its row number in
 * the file and (session, operator, timestamp, row) is unique.
 */
public class EventIngestService {

    private static final Logger log = LoggerFactory.getLogger(EventIngestService.class);

    private final DatabaseManager databaseManager;
    private final OperatorSessionReconciler reconciler;
    private final EventRepository eventRepository;
    private final int chunkSize;

    public EventIngestService(DatabaseManager databaseManager,
                              OperatorSessionReconciler reconciler,
                              EventRepository eventRepository,
                              int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("Chunk size must be at least 1, got " + chunkSize);
        }
        this.databaseManager = databaseManager;
        this.reconciler      = reconciler;
        this.eventRepository = eventRepository;
        this.chunkSize       = chunkSize;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Loads {@code csvPath}.
     *
     * @param csvPath  the export to load
     * @param progress called after every committed chunk; may be null
     * @return totals over every committed chunk
     * @throws ValidationException          if a required column is missing, a
     *                                      shift label is unrecognised or a
     *                                      numeric field cannot be parsed
     * @throws IntegrityViolationException  if a row breaks a key or NOT NULL
     *                                      constraint
     * @throws IOException                  if the file cannot be read
     */
    public IngestReport ingest(Path csvPath, Consumer<IngestReport.ChunkResult> progress)
            throws ValidationException, IOException {
        log.info("Starting event load: file='{}', chunkSize={}.", csvPath, chunkSize);
        AppLogger.setOperationContext("LOAD_EVENTS");
        IngestReport.Builder report = new IngestReport.Builder(csvPath);

        try (EventCsvReader reader = EventCsvReader.open(csvPath, chunkSize)) {
            ColumnLayout layout = ColumnLayout.of(reader);

            List<CsvRecord> records;
            int chunkNumber = 0;
            while (!(records = reader.nextChunk()).isEmpty()) {
                chunkNumber++;
                AppLogger.setChunkContext(chunkNumber);
                try {
                    IngestReport.ChunkResult result = loadChunk(chunkNumber, records, layout, report);
                    log.info(result.toProgressLine());
                    if (progress != null) {
                        progress.accept(result);
                    }
                } finally {
                    AppLogger.clearChunkContext();
                }
            }
        } finally {
            AppLogger.clearOperationContext();
        }

        IngestReport built = report.build();
        log.info(built.getSummary());
        log.debug("\n{}", built.toReportText());
        AppLogger.logEvent("LOAD_COMPLETE", "file=" + csvPath.getFileName()
                + ", chunks=" + built.getChunkCount()
                + ", events=" + built.getEventsInserted()
                + ", dropped=" + built.getRowsDropped());
        return built;
    }

    // -----------------------------------------------------------------------
    // PER-CHUNK PIPELINE
    // -----------------------------------------------------------------------

    private IngestReport.ChunkResult loadChunk(int chunkNumber, List<CsvRecord> records,
                                               ColumnLayout layout, IngestReport.Builder report)
            throws ValidationException {
        transition(chunkNumber, ChunkState.READ);
        List<IngestRow> rows = normalize(records, layout, report);
        int dropped = records.size() - rows.size();
        if (dropped > 0) {
            AppLogger.logWarningEvent("ROWS_DROPPED", "chunk=" + chunkNumber + ", dropped=" + dropped);
        }
        transition(chunkNumber, ChunkState.NORMALIZED);

        List<Session> sessions = reconciler.deriveSessions(rows);
        transition(chunkNumber, ChunkState.VALIDATED);

        Connection conn = databaseManager.getConnection();
        try {
            conn.setAutoCommit(false);

            int operatorsCreated = reconciler.ensureOperators(OperatorSessionReconciler.operatorIds(rows));
            int sessionsCreated = reconciler.ensureSessions(sessions);
            transition(chunkNumber, ChunkState.REFERENCES_RESOLVED);

            List<Event> events = new ArrayList<>(rows.size());
            for (IngestRow row : rows) {
                events.add(row.getEvent());
            }
            int inserted = eventRepository.insertBatch(events);
            transition(chunkNumber, ChunkState.INSERTED);

            conn.commit();
            transition(chunkNumber, ChunkState.COMMITTED);
            AppLogger.logEvent("CHUNK_COMMITTED", "chunk=" + chunkNumber + ", events=" + inserted);
            return report.recordChunk(records.size(), dropped, operatorsCreated, sessionsCreated, inserted);

        } catch (IntegrityViolationException ex) {
            rollback(conn, chunkNumber);
            log.error("Integrity violation in chunk {}; chunk rolled back.", chunkNumber);
            AppLogger.logErrorEvent("CHUNK_INTEGRITY_VIOLATION", "chunk=" + chunkNumber, ex);
            throw ex;
        } catch (RuntimeException ex) {
            rollback(conn, chunkNumber);
            log.error("Chunk {} failed; chunk rolled back.", chunkNumber, ex);
            throw ex;
        } catch (SQLException ex) {
            rollback(conn, chunkNumber);
            throw new RepositoryException("Transaction of chunk " + chunkNumber + " failed.", ex);
        } finally {
            try {
                conn.setAutoCommit(true);
            } catch (SQLException acEx) {
                log.error("Failed to re-enable auto-commit after chunk {}.", chunkNumber, acEx);
            }
        }
    }

    /**
     * Turns records into rows. A record whose session id, operator id or
     * timestamp is unusable is dropped and noted on the report; a numeric
     * payload field that cannot be parsed fails the whole chunk.
     */
    List<IngestRow> normalize(List<CsvRecord> records, ColumnLayout layout, IngestReport.Builder report)
            throws ValidationException {
        List<IngestRow> rows = new ArrayList<>(records.size());
        for (CsvRecord record : records) {
            String raw = record.get(layout.sessionId);
            Long sessionId = parseSessionId(raw);
            if (sessionId == null) {
                drop(report, record, "Session_ID unusable: '" + raw + "'");
                continue;
            }
            raw = record.get(layout.operatorId);
            String operatorId = EventColumn.isMissing(raw) ? null : raw.trim();
            if (operatorId == null) {
                drop(report, record, "Operator_ID missing");
                continue;
            }
            raw = record.get(layout.timestamp);
            Optional<LocalDateTime> timestamp = EventColumn.isMissing(raw)
                    ? Optional.empty() : TimestampParser.parse(raw);
            if (timestamp.isEmpty()) {
                drop(report, record, "Timestamp unusable: '" + raw + "'");
                continue;
            }

            Event event = new Event();
            event.setSessionId(sessionId);
            event.setOperatorId(operatorId);
            event.setTimestamp(timestamp.get());
            event.setSourceRow(record.getRowNumber());
            for (Map.Entry<EventColumn, Integer> column : layout.payload.entrySet()) {
                String value = record.get(column.getValue());
                try {
                    column.getKey().apply(event, value);
                } catch (NumberFormatException ex) {
                    String header = column.getKey().getHeader();
                    throw new ValidationException(header, "row " + record.getRowNumber()
                            + " (line " + record.getLineNumber() + "): cannot read '" + value
                            + "' as " + column.getKey().getType().name().toLowerCase(Locale.ROOT));
                }
            }
            rows.add(new IngestRow(event, record.get(layout.shift)));
        }
        return rows;
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    private static Long parseSessionId(String raw) {
        if (EventColumn.isMissing(raw)) {
            return null;
        }
        try {
            return EventColumn.parseWholeNumber(raw);
        } catch (NumberFormatException ex) {
            log.debug("Session_ID '{}' is not a whole number: {}", raw, ex.getMessage());
            return null;
        }
    }

    private static void drop(IngestReport.Builder report, CsvRecord record, String reason) {
        log.debug("Row {} dropped: {}", record.getRowNumber(), reason);
        report.addDropped(record.getRowNumber(), record.getLineNumber(), reason);
    }

    private static void transition(int chunkNumber, ChunkState state) {
        log.debug("Chunk {} -> {}", chunkNumber, state);
    }

    private static void rollback(Connection conn, int chunkNumber) {
        try {
            conn.rollback();
            log.warn("Chunk {} rolled back.", chunkNumber);
        } catch (SQLException rollbackEx) {
            log.error("Rollback of chunk {} also failed.", chunkNumber, rollbackEx);
        }
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: ColumnLayout
    // -----------------------------------------------------------------------

    /**
     * Where each known column sits in the file. Built once from the header;
     * fails when a required column is absent.
     */
    static final class ColumnLayout {

        final int sessionId;
        final int operatorId;
        final int timestamp;
        final int shift;
        final Map<EventColumn, Integer> payload;

        private ColumnLayout(EventCsvReader reader) {
            this.sessionId  = reader.indexOf(EventColumn.SESSION_ID);
            this.operatorId = reader.indexOf(EventColumn.OPERATOR_ID);
            this.timestamp  = reader.indexOf(EventColumn.TIMESTAMP);
            this.shift      = reader.indexOf(EventColumn.SHIFT);
            this.payload    = new EnumMap<>(EventColumn.class);
            for (EventColumn column : EventColumn.values()) {
                if (reader.hasColumn(column.getHeader())) {
                    payload.put(column, reader.indexOf(column.getHeader()));
                }
            }
        }

        /**
         * @throws ValidationException listing every missing required column
         */
        static ColumnLayout of(EventCsvReader reader) throws ValidationException {
            Map<String, String> missing = new LinkedHashMap<>();
            for (String required : EventColumn.REQUIRED_HEADERS) {
                if (!reader.hasColumn(required)) {
                    missing.put(required, "CSV missing required column");
                }
            }
            if (!missing.isEmpty()) {
                log.error("CSV missing required columns: {}", missing.keySet());
                throw new ValidationException(missing);
            }
            ColumnLayout layout = new ColumnLayout(reader);
            if (layout.payload.size() < EventColumn.values().length) {
                List<String> absent = new ArrayList<>();
                for (EventColumn column : EventColumn.values()) {
                    if (!layout.payload.containsKey(column)) {
                        absent.add(column.getHeader());
                    }
                }
                log.warn("Event columns absent from the file and left empty: {}", absent);
            }
            return layout;
        }
    }
}
