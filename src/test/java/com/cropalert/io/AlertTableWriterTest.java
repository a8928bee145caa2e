package com.cropalert.io;

import com.cropalert.model.AlertRecord;
import com.cropalert.model.DebugRecord;
import com.cropalert.model.EventType;
import com.cropalert.model.MergedEvent;
import com.cropalert.model.SkipReason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertTableWriterTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 1);

    @TempDir
    Path tempDir;

    private final AlertTableWriter writer = new AlertTableWriter();

    @Test
    void writeDebug_shouldRenderFixedColumnsAndBooleans() throws Exception {
        DebugRecord row = DebugRecord.builder()
                .date(DAY)
                .realObsDay(true)
                .rsSupportDate(null)
                .rsSupportAge(DebugRecord.NO_SUPPORT_AGE)
                .missingRemote(true)
                .skipReason(SkipReason.MISSING_REMOTE)
                .monthOk(true)
                .build();
        Path file = tempDir.resolve("out/02_rs_debug.csv");

        writer.writeDebug(file, List.of(row));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(String.join(",", AlertTableWriter.DEBUG_COLUMNS), lines.get(0));
        assertEquals("2024-05-01,true,,9999,false,true,false,false,missing_remote,0,false,true,false,false", lines.get(1));
    }

    @Test
    void writeAlerts_shouldKeepHeaderForEmptyTable() throws Exception {
        Path file = tempDir.resolve("04_alerts_gated.csv");

        writer.writeAlerts(file, List.of());

        assertEquals("date,event_type,reason\n", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void writeAlerts_shouldQuoteReasonsWithSeparators() throws Exception {
        Path file = tempDir.resolve("03_alerts_raw.csv");
        AlertRecord alert = new AlertRecord(DAY, EventType.DROUGHT, "ndmi_fill=0.100, precip_7d=5.0", List.of("drought"));

        writer.writeAlerts(file, List.of(alert));

        String content = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(content.contains("2024-05-01,drought,\"ndmi_fill=0.100, precip_7d=5.0\""));
        assertTrue(content.endsWith("\n"));
        assertTrue(!content.contains("\r"));
    }

    @Test
    void writeEvents_shouldLeaveMissingPeakEmpty() throws Exception {
        MergedEvent event = MergedEvent.builder()
                .eventType(EventType.COLD_STRESS)
                .startDate(DAY)
                .endDate(DAY.plusDays(2))
                .durationDays(3)
                .peakDate(DAY)
                .peakValue(Double.NaN)
                .peakMetric("")
                .reasonSummary("cold")
                .build();
        Path file = tempDir.resolve("05_events.csv");

        writer.writeEvents(file, List.of(event));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(String.join(",", AlertTableWriter.EVENT_COLUMNS), lines.get(0));
        assertEquals("cold_stress,2024-05-01,2024-05-03,3,2024-05-01,,,cold", lines.get(1));
    }

    @Test
    void number_shouldRenderPlainRoundedValues() {
        assertEquals("0.15", AlertTableWriter.number(0.15000000001));
        assertEquals("3", AlertTableWriter.number(3.0));
        assertEquals("0", AlertTableWriter.number(-0.0000001));
        assertEquals("-0.25", AlertTableWriter.number(-0.25));
        assertEquals("", AlertTableWriter.number(Double.NaN));
    }
}
