package com.cropalert.engine;

import com.cropalert.config.EngineSettings;
import com.cropalert.config.GatingMode;
import com.cropalert.config.GatingSettings;
import com.cropalert.core.RunTelemetry;
import com.cropalert.model.AlertRecord;
import com.cropalert.model.DailyRecord;
import com.cropalert.model.DailyTable;
import com.cropalert.model.DebugRecord;
import com.cropalert.model.EventType;
import com.cropalert.model.MergedEvent;
import com.cropalert.model.SkipReason;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompositeAlertEngineTest {

    private static final LocalDate D1 = LocalDate.of(2024, 6, 1);

    private final CompositeAlertEngine engine = new CompositeAlertEngine(EngineSettings.defaults());

    @Test
    void run_shouldGateFirstObservationAndMergeDroughtRun() {
        EngineResult result = engine.run(droughtSeason(10), null);

        assertEquals(10, result.rawAlerts.size());
        assertEquals(9, result.gatedAlerts.size());
        assertFalse(result.debug.get(0).allowAlert);
        assertEquals(1, result.debug.get(0).canopyObsStreak);
        assertEquals(1, result.events.size());

        MergedEvent event = result.events.get(0);
        assertEquals(EventType.DROUGHT, event.eventType);
        assertEquals(D1.plusDays(1), event.startDate);
        assertEquals(D1.plusDays(9), event.endDate);
        assertEquals(9, event.durationDays);
        assertEquals("ndmi_fill", event.peakMetric);
    }

    @Test
    void run_shouldBeIdempotent() {
        List<DailyRecord> records = droughtSeason(12);

        EngineResult first = engine.run(records, null);
        EngineResult second = engine.run(records, null);

        assertEquals(first.debug, second.debug);
        assertEquals(first.rawAlerts, second.rawAlerts);
        assertEquals(first.gatedAlerts, second.gatedAlerts);
        assertEquals(first.events, second.events);
    }

    @Test
    void run_allowAlertShouldImplyQcAndGatedShouldBeSubsetOfRaw() {
        List<DailyRecord> records = new ArrayList<>(droughtSeason(15));
        records.set(4, records.get(4).toBuilder().precip7d(Double.NaN).build());
        records.set(7, records.get(7).toBuilder().ndmiFill(Double.POSITIVE_INFINITY).build());

        EngineResult result = engine.run(records, null);

        for (DebugRecord day : result.debug) {
            assertTrue(!day.allowAlert || day.qcOk, "allow without qc on " + day.date);
        }
        assertTrue(result.rawAlerts.containsAll(result.gatedAlerts));
        assertEquals(SkipReason.MISSING_WEATHER, result.debug.get(4).skipReason);
        assertEquals(SkipReason.NONFINITE, result.debug.get(7).skipReason);
        assertEquals(13, result.rawAlerts.size());
        assertEquals(12, result.gatedAlerts.size());
        assertEquals(1, result.events.size());
    }

    @Test
    void run_daysWithoutSupportShouldBeMissingRemote() {
        List<DailyRecord> records = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            DailyRecord.DailyRecordBuilder day = droughtDay(D1.plusDays(i));
            if (i > 0) {
                day.ndviObs(Double.NaN);
            }
            records.add(day.build());
        }

        EngineResult result = engine.run(records, null);

        DebugRecord supported = result.debug.get(5);
        DebugRecord unsupported = result.debug.get(6);
        assertEquals(D1, supported.rsSupportDate);
        assertEquals(5, supported.rsSupportAge);
        assertTrue(supported.qcOk);
        assertNull(unsupported.rsSupportDate);
        assertEquals(DebugRecord.NO_SUPPORT_AGE, unsupported.rsSupportAge);
        assertEquals(SkipReason.MISSING_REMOTE, unsupported.skipReason);
        assertTrue(unsupported.missingRemote);
        assertEquals(6, result.rawAlerts.size());
    }

    @Test
    void run_gatingOffShouldMatchRawAlerts() {
        EngineSettings settings = EngineSettings.builder()
                .gating(GatingSettings.builder().mode(GatingMode.OFF).build())
                .build();

        EngineResult result = new CompositeAlertEngine(settings).run(droughtSeason(6), null);

        assertEquals(result.rawAlerts, result.gatedAlerts);
    }

    @Test
    void run_fromTableShouldResolveColumnsAndRecordTelemetry() {
        List<LocalDate> dates = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            dates.add(D1.plusDays(i));
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("ndvi_obs", new double[]{0.6, 0.6, 0.6});
        columns.put("evi_mean", new double[]{0.5, 0.5, 0.5});
        columns.put("ndmi_mean_daily", new double[]{0.1, 0.1, 0.1});
        columns.put("msi_fill", new double[]{0.5, 0.5, 0.5});
        columns.put("precip_7d", new double[]{5.0, 5.0, 5.0});
        columns.put("tmean_7d", new double[]{20.0, 20.0, 20.0});
        columns.put("rh_7d", new double[]{70.0, 70.0, 70.0});
        columns.put("tmin_7d", new double[]{10.0, 10.0, 10.0});
        RunTelemetry telemetry = new RunTelemetry("t", "table", Instant.now());

        EngineResult result = engine.run(new DailyTable(dates, columns), telemetry);

        List<AlertRecord> raw = result.rawAlerts;
        assertEquals(3, raw.size());
        assertEquals(EventType.DROUGHT, raw.get(0).eventType);
        assertEquals(2, result.gatedAlerts.size());
        assertTrue(telemetry.getSummary().contains("raw_alerts=3 gated_alerts=2 events=1"));
        assertTrue(telemetry.getSummary().contains(RunTelemetry.STEP_RESOLVE_METRICS));
    }

    private static List<DailyRecord> droughtSeason(int days) {
        List<DailyRecord> records = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            records.add(droughtDay(D1.plusDays(i)).build());
        }
        return records;
    }

    private static DailyRecord.DailyRecordBuilder droughtDay(LocalDate date) {
        return DailyRecord.builder()
                .date(date)
                .ndviObs(0.6).ndviFill(0.6)
                .eviFill(0.5)
                .ndmiFill(0.1)
                .msiFill(0.5)
                .precip7d(5.0)
                .tmean7d(20.0)
                .rh7d(70.0)
                .tmin7d(10.0);
    }
}
