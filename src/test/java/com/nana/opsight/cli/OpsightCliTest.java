package com.nana.opsight.cli;

import com.nana.opsight.util.AppConfig;
import com.nana.opsight.util.EventColumn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OpsightCli")
class OpsightCliTest {

    @TempDir
    Path tempDir;

    private OpsightCli cli;
    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private String dbUrl;

    @BeforeEach
    void setUp() {
        cli = new OpsightCli(AppConfig.of(null));
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        dbUrl = "jdbc:sqlite:" + tempDir.resolve("cli.db");
    }

    private int run(String... args) {
        return cli.run(args,
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    private Path csv(String name, String... shifts) throws IOException {
        List<String> header = new ArrayList<>(EventColumn.REQUIRED_HEADERS);
        for (EventColumn column : EventColumn.values()) {
            header.add(column.getHeader());
        }
        StringBuilder sb = new StringBuilder(String.join(",", header)).append('\n');
        for (int i = 0; i < shifts.length; i++) {
            List<String> values = new ArrayList<>(List.of(
                    String.valueOf(i + 1), "OP" + (i + 1), "2024-03-01 07:0" + i + ":00", shifts[i]));
            for (EventColumn column : EventColumn.values()) {
                values.add(column.getType() == EventColumn.ValueType.TEXT ? "t" : "1");
            }
            sb.append(String.join(",", values)).append('\n');
        }
        Path file = tempDir.resolve(name);
        Files.writeString(file, sb.toString(), StandardCharsets.UTF_8);
        return file;
    }

    // =========================================================================
    // Usage errors
    // =========================================================================

    @Nested
    @DisplayName("Usage errors exit with 2")
    class UsageTests {

        @Test
        void noArguments_printsUsage() {
            assertEquals(OpsightCli.EXIT_USAGE, run());
            assertTrue(err().contains("Usage:"));
        }

        @Test
        void unknownCommand_isNamed() {
            assertEquals(OpsightCli.EXIT_USAGE, run("export"));
            assertTrue(err().contains("Unknown command: export"));
        }

        @Test
        void load_withoutCsv_isRejected() {
            assertEquals(OpsightCli.EXIT_USAGE, run("load", "--db", dbUrl));
            assertTrue(err().contains("--csv"));
        }

        @Test
        void load_nonNumericChunkSize_isRejected() throws IOException {
            Path file = csv("a.csv", "DAY");
            assertEquals(OpsightCli.EXIT_USAGE,
                    run("load", "--csv", file.toString(), "--chunksize", "lots", "--db", dbUrl));
        }

        @Test
        void load_zeroChunkSize_isRejected() throws IOException {
            Path file = csv("a.csv", "DAY");
            assertEquals(OpsightCli.EXIT_USAGE,
                    run("load", "--csv", file.toString(), "--chunksize", "0", "--db", dbUrl));
        }

        @Test
        void initDb_unknownOption_isRejected() {
            assertEquals(OpsightCli.EXIT_USAGE, run("init-db", "--csv", "x.csv"));
        }

        @Test
        void parseOptions_flagWithoutValue_throws() {
            assertThrows(OpsightCli.UsageException.class,
                    () -> OpsightCli.parseOptions(new String[]{"load", "--csv"}, Set.of("--csv")));
        }

        @Test
        void parseOptions_readsPairs() throws OpsightCli.UsageException {
            Map<String, String> options = OpsightCli.parseOptions(
                    new String[]{"load", "--csv", "in.csv", "--chunksize", "10"},
                    Set.of("--csv", "--chunksize"));
            assertEquals("in.csv", options.get("--csv"));
            assertEquals("10", options.get("--chunksize"));
        }
    }

    // =========================================================================
    // Commands
    // =========================================================================

    @Nested
    @DisplayName("Commands")
    class CommandTests {

        @Test
        void initDb_printsConfirmation() {
            assertEquals(OpsightCli.EXIT_OK, run("init-db", "--db", dbUrl));
            assertTrue(out().contains("DB initialized"));
            assertTrue(Files.exists(tempDir.resolve("cli.db")));
        }

        @Test
        void initDb_twice_succeeds() {
            assertEquals(OpsightCli.EXIT_OK, run("init-db", "--db", dbUrl));
            assertEquals(OpsightCli.EXIT_OK, run("init-db", "--db", dbUrl));
        }

        @Test
        void load_printsProgressThenSummary() throws IOException {
            Path file = csv("events.csv", "DAY", "NIGHT", "DAY");

            int code = run("load", "--csv", file.toString(), "--chunksize", "2", "--db", dbUrl);

            assertEquals(OpsightCli.EXIT_OK, code, err());
            String output = out();
            assertTrue(output.contains("Inserted 2 events (total: 2)"));
            assertTrue(output.contains("Inserted 1 events (total: 3)"));
            assertTrue(output.contains("Done. Total inserted into Events: 3"));
            assertTrue(output.indexOf("total: 3") < output.indexOf("Done."));
        }

        @Test
        void load_unknownShift_exitsOneNamingValue() throws IOException {
            Path file = csv("swing.csv", "DAY", "SWING");

            assertEquals(OpsightCli.EXIT_FAILURE, run("load", "--csv", file.toString(), "--db", dbUrl));
            assertTrue(err().contains("SWING"));
        }

        @Test
        void load_sameFileTwice_reportsIntegrityError() throws IOException {
            Path file = csv("events.csv", "DAY");
            assertEquals(OpsightCli.EXIT_OK, run("load", "--csv", file.toString(), "--db", dbUrl));

            assertEquals(OpsightCli.EXIT_FAILURE, run("load", "--csv", file.toString(), "--db", dbUrl));
            assertTrue(err().contains("Integrity error"));
        }

        @Test
        void load_missingFile_reportsIoError() {
            String missing = tempDir.resolve("absent.csv").toString();
            assertEquals(OpsightCli.EXIT_FAILURE, run("load", "--csv", missing, "--db", dbUrl));
            assertTrue(err().contains("I/O error"));
        }

        @Test
        void version_printsAppName() {
            assertEquals(OpsightCli.EXIT_OK, run("--version"));
            assertFalse(out().isBlank());
        }

        @Test
        void help_printsUsageToOut() {
            assertEquals(OpsightCli.EXIT_OK, run("--help"));
            assertTrue(out().contains("opsight load"));
        }
    }
}
