package com.cropalert.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CropAlertApplicationTest {

    private static final List<String> TABLES = List.of(
            "02_rs_debug.csv",
            "03_alerts_raw.csv",
            "04_alerts_gated.csv",
            "05_events.csv"
    );

    @TempDir
    Path tempDir;

    @Test
    void run_shouldWriteAllTablesAndSummaries() throws Exception {
        writeSeason(tempDir.resolve("in.csv"));

        int exit = app().run(new String[]{"-i", "in.csv", "-o", "out"});

        assertEquals(CropAlertApplication.EXIT_OK, exit);
        Path out = tempDir.resolve("out");
        for (String table : TABLES) {
            assertTrue(Files.exists(out.resolve(table)), table);
        }
        assertEquals(11, Files.readAllLines(out.resolve("03_alerts_raw.csv")).size());
        assertEquals(10, Files.readAllLines(out.resolve("04_alerts_gated.csv")).size());
        List<String> events = Files.readAllLines(out.resolve("05_events.csv"));
        assertEquals(2, events.size());
        assertTrue(events.get(1).startsWith("drought,2024-06-02,2024-06-10,9,2024-06-02,0.1,ndmi_fill,"), events.get(1));
        assertTrue(Files.exists(out.resolve("stage_summary.json")));
        assertTrue(Files.exists(out.resolve("in.summary.json")));
    }

    @Test
    void run_shouldProduceByteIdenticalOutputs() throws Exception {
        writeSeason(tempDir.resolve("in.csv"));

        assertEquals(0, app().run(new String[]{"--input", "in.csv", "--output-dir", "first", "--no-summary"}));
        assertEquals(0, app().run(new String[]{"--input", "in.csv", "--output-dir", "second", "--no-summary"}));

        for (String table : TABLES) {
            assertArrayEquals(
                    Files.readAllBytes(tempDir.resolve("first").resolve(table)),
                    Files.readAllBytes(tempDir.resolve("second").resolve(table)),
                    table
            );
        }
        assertFalse(Files.exists(tempDir.resolve("first/stage_summary.json")));
    }

    @Test
    void run_schemaErrorShouldExitWithoutOutputs() throws Exception {
        Files.writeString(tempDir.resolve("bad.csv"), "day,ndvi_obs\n2024-06-01,0.5\n", StandardCharsets.UTF_8);

        int exit = app().run(new String[]{"-i", "bad.csv", "-o", "out"});

        assertEquals(CropAlertApplication.EXIT_SCHEMA, exit);
        assertFalse(Files.exists(tempDir.resolve("out")));
    }

    @Test
    void run_invalidConfigShouldExitWithUsageCode() throws Exception {
        writeSeason(tempDir.resolve("in.csv"));
        Files.writeString(tempDir.resolve("bad.properties"), "gating.mode=sometimes\n", StandardCharsets.UTF_8);

        int exit = app().run(new String[]{"-i", "in.csv", "-o", "out", "-c", "bad.properties"});

        assertEquals(CropAlertApplication.EXIT_USAGE, exit);
        assertFalse(Files.exists(tempDir.resolve("out")));
    }

    @Test
    void run_shouldHandleHelpAndUnknownOptions() {
        assertEquals(CropAlertApplication.EXIT_OK, app().run(new String[]{"--help"}));
        assertEquals(CropAlertApplication.EXIT_USAGE, app().run(new String[]{"--bogus"}));
    }

    @Test
    void run_missingInputShouldFail() {
        int exit = app().run(new String[]{"-i", "absent.csv", "-o", "out"});

        assertEquals(CropAlertApplication.EXIT_FAILURE, exit);
    }

    private CropAlertApplication app() {
        return new CropAlertApplication(tempDir, false);
    }

    private static void writeSeason(Path file) throws Exception {
        StringBuilder sb = new StringBuilder("date,ndvi_obs,evi_fill,ndmi_fill,msi_fill,precip_7d,tmean_7d,rh_7d,tmin_7d\n");
        for (int day = 1; day <= 10; day++) {
            sb.append(String.format("2024-06-%02d,0.6,0.5,0.1,0.5,5.0,20.0,70.0,10.0%n", day));
        }
        Files.writeString(file, sb.toString(), StandardCharsets.UTF_8);
    }
}
