package com.nana.opsight.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IngestReport")
class IngestReportTest {

    @Test
    void recordChunk_accumulatesTotalsAndNumbersChunks() {
        IngestReport.Builder builder = new IngestReport.Builder(Paths.get("events.csv"));

        IngestReport.ChunkResult first  = builder.recordChunk(50_000, 2, 3, 10, 49_998);
        IngestReport.ChunkResult second = builder.recordChunk(20_000, 0, 0, 4, 20_000);

        assertEquals(1, first.getChunkNumber());
        assertEquals(2, second.getChunkNumber());
        assertEquals(69_998L, second.getTotalInserted());

        IngestReport report = builder.build();
        assertEquals(70_000L, report.getRowsRead());
        assertEquals(2L, report.getRowsDropped());
        assertEquals(3L, report.getOperatorsCreated());
        assertEquals(14L, report.getSessionsCreated());
        assertEquals(69_998L, report.getEventsInserted());
        assertEquals(2, report.getChunkCount());
    }

    @Test
    void progressLine_usesThousandsSeparators() {
        IngestReport.Builder builder = new IngestReport.Builder(Paths.get("events.csv"));
        builder.recordChunk(50_000, 0, 0, 0, 50_000);
        IngestReport.ChunkResult second = builder.recordChunk(50_000, 0, 0, 0, 50_000);

        assertEquals("Inserted 50,000 events (total: 100,000)", second.toProgressLine());
    }

    @Test
    void summary_reportsTotalInserted() {
        IngestReport.Builder builder = new IngestReport.Builder(Paths.get("events.csv"));
        builder.recordChunk(1_234_567, 0, 0, 0, 1_234_567);

        assertEquals("Done. Total inserted into Events: 1,234,567", builder.build().getSummary());
    }

    @Test
    void emptyLoad_summaryIsZero() {
        IngestReport report = new IngestReport.Builder(Paths.get("empty.csv")).build();
        assertEquals("Done. Total inserted into Events: 0", report.getSummary());
        assertEquals(0, report.getChunkCount());
        assertTrue(report.toReportText().contains("No rows dropped."));
    }

    @Test
    void droppedExamples_areCappedButReportTextSaysSo() {
        IngestReport.Builder builder = new IngestReport.Builder(Paths.get("events.csv"));
        int total = IngestReport.MAX_DROPPED_EXAMPLES + 5;
        for (int i = 1; i <= total; i++) {
            builder.addDropped(i, i + 1, "Timestamp unusable: 'x'");
        }
        builder.recordChunk(total, total, 0, 0, 0);

        IngestReport report = builder.build();
        assertEquals(IngestReport.MAX_DROPPED_EXAMPLES, report.getDroppedExamples().size());
        assertEquals(total, report.getRowsDropped());
        assertTrue(report.toReportText().contains("first " + IngestReport.MAX_DROPPED_EXAMPLES));
    }

    @Test
    void chunks_areUnmodifiable() {
        IngestReport.Builder builder = new IngestReport.Builder(Paths.get("events.csv"));
        builder.recordChunk(1, 0, 0, 0, 1);
        IngestReport report = builder.build();

        assertThrows(UnsupportedOperationException.class, () -> report.getChunks().clear());
    }
}
