package com.cropalert.io;

import com.cropalert.config.EngineSettings;
import com.cropalert.engine.CompositeAlertEngine;
import com.cropalert.engine.EngineResult;
import com.cropalert.model.DailyRecord;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageSummaryBuilderTest {

    private static final LocalDate D1 = LocalDate.of(2024, 6, 1);
    private static final Instant GENERATED = Instant.parse("2024-10-01T08:00:00.123Z");

    @TempDir
    Path tempDir;

    @Test
    void stageSummary_shouldCountEachStage() {
        EngineSettings settings = EngineSettings.defaults();
        EngineResult result = new CompositeAlertEngine(settings).run(season(), null);

        JSONObject summary = builder(settings).stageSummary(result);

        JSONObject totals = summary.getJSONObject("totals");
        assertEquals(6, totals.getInt("total_days"));
        assertEquals(5, totals.getInt("qc_ok_days"));
        assertEquals(4, totals.getInt("allow_alert_days"));
        assertEquals(5, totals.getInt("raw_alerts"));
        assertEquals(4, totals.getInt("gated_alerts"));
        assertEquals(1, totals.getInt("events"));
        assertEquals("2024-10-01T08:00:00Z", summary.getString("generated_at"));

        JSONArray stages = summary.getJSONArray("stages");
        assertEquals(5, stages.length());
        assertEquals("02", stages.getJSONObject(1).getString("stage"));
        assertEquals(1, stages.getJSONObject(1).getInt("removed_count"));
        assertEquals(1, stages.getJSONObject(3).getInt("removed_count"));
        assertTrue(stages.getJSONObject(0).isNull("alerts_count"));
    }

    @Test
    void tableSummary_shouldReportPassRatesAndSkipReasons() {
        EngineSettings settings = EngineSettings.defaults();
        EngineResult result = new CompositeAlertEngine(settings).run(season(), null);

        JSONObject debug = builder(settings).tableSummary(result, 2);

        assertEquals("rs_debug", debug.getJSONObject("stage").getString("name"));
        JSONObject rates = debug.getJSONObject("pass_rates");
        assertEquals(0.8333, rates.getDouble("qc_pass_rate"), 1e-9);
        assertEquals(0.8, rates.getDouble("gating_pass_rate"), 1e-9);
        assertEquals(0.6667, rates.getDouble("allow_alert_rate"), 1e-9);
        JSONArray skip = debug.getJSONArray("skip_reason");
        assertEquals(0, skip.getJSONObject(0).getInt("count"));
        assertEquals(1, skip.getJSONObject(1).getInt("count"));
        assertEquals(0.1667, skip.getJSONObject(1).getDouble("ratio"), 1e-9);
        assertEquals(5, skip.getJSONObject(3).getInt("count"));
        assertEquals(6, debug.getJSONObject("qc_counts").getInt("real_obs_days"));
        JSONObject gatingMode = thresholdNamed(debug.getJSONArray("thresholds"), "gating.mode");
        assertEquals("canopy_obs", gatingMode.getString("value"));
        assertEquals(7, thresholdNamed(debug.getJSONArray("thresholds"), "gating.months").getJSONArray("value").length());
    }

    @Test
    void writeAll_shouldKeepSkipReasonAndThresholdOrderInFile() throws Exception {
        EngineSettings settings = EngineSettings.defaults();
        EngineResult result = new CompositeAlertEngine(settings).run(season(), null);

        builder(settings).writeAll(result);

        String text = Files.readString(tempDir.resolve("out/02_rs_debug.summary.json"), StandardCharsets.UTF_8);
        JSONObject debug = new JSONObject(text);
        JSONArray skip = debug.getJSONArray("skip_reason");
        List<String> reasons = new ArrayList<>();
        for (int i = 0; i < skip.length(); i++) {
            reasons.add(skip.getJSONObject(i).getString("reason"));
        }
        assertEquals(List.of("missing_remote", "missing_weather", "nonfinite", "ok"), reasons);

        JSONArray thresholds = debug.getJSONArray("thresholds");
        List<String> names = new ArrayList<>();
        for (int i = 0; i < thresholds.length(); i++) {
            names.add(thresholds.getJSONObject(i).getString("name"));
        }
        assertEquals(new ArrayList<>(settings.describe().keySet()), names);
        assertEquals("ndvi_crop", names.get(0));
    }

    @Test
    void tableSummary_shouldRestrictToReportRange() {
        EngineSettings settings = EngineSettings.builder()
                .reportStart(D1.plusDays(3))
                .reportEnd(D1.plusDays(5))
                .build();
        EngineResult result = new CompositeAlertEngine(settings).run(season(), null);

        JSONObject gated = builder(settings).tableSummary(result, 4);
        JSONObject events = builder(settings).tableSummary(result, 5);

        assertEquals(2, gated.getJSONObject("rows").getInt("output"));
        assertTrue(gated.getJSONObject("stage").getBoolean("gating_applied"));
        assertEquals(0, events.getJSONObject("rows").getInt("output"));
        assertEquals("2024-06-04", gated.getJSONObject("report_range").getString("start"));
    }

    @Test
    void writeAll_shouldWriteSixSummaryFiles() throws Exception {
        EngineSettings settings = EngineSettings.defaults();
        EngineResult result = new CompositeAlertEngine(settings).run(season(), null);

        List<Path> written = builder(settings).writeAll(result);

        assertEquals(6, written.size());
        assertTrue(Files.exists(tempDir.resolve("out/01_merged.summary.json")));
        assertTrue(Files.exists(tempDir.resolve("out/02_rs_debug.summary.json")));
        assertTrue(Files.exists(tempDir.resolve("out/05_events.summary.json")));
        String stage = Files.readString(tempDir.resolve("out/stage_summary.json"), StandardCharsets.UTF_8);
        assertFalse(new JSONObject(stage).getJSONObject("totals").isEmpty());
    }

    private static JSONObject thresholdNamed(JSONArray thresholds, String name) {
        for (int i = 0; i < thresholds.length(); i++) {
            JSONObject item = thresholds.getJSONObject(i);
            if (name.equals(item.getString("name"))) {
                return item;
            }
        }
        throw new AssertionError("threshold not found: " + name);
    }

    private StageSummaryBuilder builder(EngineSettings settings) {
        Path out = tempDir.resolve("out");
        OutputLayout layout = new OutputLayout(
                tempDir.resolve("in/01_merged.csv"),
                out,
                out.resolve("02_rs_debug.csv"),
                out.resolve("03_alerts_raw.csv"),
                out.resolve("04_alerts_gated.csv"),
                out.resolve("05_events.csv")
        );
        return new StageSummaryBuilder(settings, layout, GENERATED);
    }

    /**
     * Six drought days; the fourth lacks precipitation, so one day fails QC and the first is not yet gated.
     */
    private static List<DailyRecord> season() {
        List<DailyRecord> records = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            records.add(DailyRecord.builder()
                    .date(D1.plusDays(i))
                    .ndviObs(0.6).ndviFill(0.6)
                    .eviFill(0.5)
                    .ndmiFill(0.1)
                    .msiFill(0.5)
                    .precip7d(i == 3 ? Double.NaN : 5.0)
                    .tmean7d(20.0)
                    .rh7d(70.0)
                    .tmin7d(10.0)
                    .build());
        }
        return records;
    }
}
