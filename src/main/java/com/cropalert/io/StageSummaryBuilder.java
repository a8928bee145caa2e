package com.cropalert.io;

import com.cropalert.config.EngineSettings;
import com.cropalert.engine.EngineResult;
import com.cropalert.model.AlertRecord;
import com.cropalert.model.DailyRecord;
import com.cropalert.model.DebugRecord;
import com.cropalert.model.MergedEvent;
import com.cropalert.model.SkipReason;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：StageSummaryBuilder（class）。
 * 主要职责：为 01~05 各阶段输出生成 JSON 摘要（行数、通过率、跳过原因分布、阈值），并汇总为 stage_summary.json。
 * 实现要点：统计口径限定在报告区间内（事件按 start_date 判断）；区间未配置时统计全部日期。
 */
public final class StageSummaryBuilder {
    private static final Logger LOG = LogManager.getLogger(StageSummaryBuilder.class);
    private static final int RATIO_SCALE = 4;

    private final EngineSettings settings;
    private final OutputLayout layout;
    private final Instant generatedAt;

    public StageSummaryBuilder(EngineSettings settings, OutputLayout layout, Instant generatedAt) {
        this.settings = settings;
        this.layout = layout;
        this.generatedAt = (generatedAt == null ? Instant.now() : generatedAt).truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Writes the five per-table summaries and the overall stage summary; returns the files written.
     */
    public List<Path> writeAll(EngineResult result) {
        Scope scope = new Scope(result);
        List<Path> written = new ArrayList<>();
        written.add(write(layout.inputSummary(), tableSummary(scope, 1, result)));
        written.add(write(OutputLayout.summaryOf(layout.debug), tableSummary(scope, 2, result)));
        written.add(write(OutputLayout.summaryOf(layout.alertsRaw), tableSummary(scope, 3, result)));
        written.add(write(OutputLayout.summaryOf(layout.alertsGated), tableSummary(scope, 4, result)));
        written.add(write(OutputLayout.summaryOf(layout.events), tableSummary(scope, 5, result)));
        written.add(write(layout.stageSummary(), stageSummary(result)));
        LOG.info("stage summaries written to {}", layout.outputDir);
        return written;
    }

    public JSONObject stageSummary(EngineResult result) {
        Scope scope = new Scope(result);
        int totalDays = scope.records.size();
        int qcOkDays = scope.qcOkDays();
        int allowDays = scope.allowAlertDays();
        int rawAlerts = scope.rawAlerts.size();
        int gatedAlerts = scope.gatedAlerts.size();
        int events = scope.events.size();

        JSONObject totals = new JSONObject();
        totals.put("total_days", totalDays);
        totals.put("qc_ok_days", qcOkDays);
        totals.put("allow_alert_days", allowDays);
        totals.put("raw_alerts", rawAlerts);
        totals.put("gated_alerts", gatedAlerts);
        totals.put("events", events);

        JSONArray stages = new JSONArray();
        stages.put(stageRow("01", layout.input, "days", totalDays, null, null, null));
        stages.put(stageRow("02", layout.debug, "days", qcOkDays, null, null, Math.max(totalDays - qcOkDays, 0)));
        stages.put(stageRow("03", layout.alertsRaw, "alerts", qcOkDays, rawAlerts, null, null));
        stages.put(stageRow("04", layout.alertsGated, "alerts", allowDays, gatedAlerts, null,
                Math.max(qcOkDays - allowDays, 0)));
        stages.put(stageRow("05", layout.events, "events", allowDays, gatedAlerts, events, null));

        JSONObject root = new JSONObject();
        root.put("generated_at", generatedAt.toString());
        root.put("totals", totals);
        root.put("stages", stages);
        root.put("report_range", reportRange());
        return root;
    }

    /**
     * Summary for stage 1 (input) to 5 (events).
     */
    public JSONObject tableSummary(EngineResult result, int stage) {
        return tableSummary(new Scope(result), stage, result);
    }

    private JSONObject tableSummary(Scope scope, int stage, EngineResult result) {
        JSONObject stageInfo = new JSONObject();
        stageInfo.put("id", "stage_" + stage);
        JSONObject paths = new JSONObject();
        JSONObject rows = new JSONObject();
        switch (stage) {
            case 1:
                stageInfo.put("name", "merged");
                paths.put("inputs", new JSONArray());
                paths.put("output", layout.input.toString());
                rows.put("inputs", result.records.size());
                rows.put("output", scope.records.size());
                break;
            case 2:
                stageInfo.put("name", "rs_debug");
                paths.put("inputs", new JSONArray().put(layout.input.toString()));
                paths.put("output", layout.debug.toString());
                rows.put("inputs", scope.records.size());
                rows.put("output", scope.debug.size());
                break;
            case 3:
                stageInfo.put("name", "alerts_raw");
                stageInfo.put("gating_applied", false);
                paths.put("inputs", new JSONArray().put(layout.input.toString()));
                paths.put("output", layout.alertsRaw.toString());
                rows.put("inputs", scope.records.size());
                rows.put("output", scope.rawAlerts.size());
                break;
            case 4:
                stageInfo.put("name", "alerts_gated");
                stageInfo.put("gating_applied", true);
                paths.put("inputs", new JSONArray().put(layout.input.toString()));
                paths.put("output", layout.alertsGated.toString());
                rows.put("inputs", scope.records.size());
                rows.put("output", scope.gatedAlerts.size());
                break;
            case 5:
                stageInfo.put("name", "events_merged");
                paths.put("inputs", new JSONArray().put(layout.alertsGated.toString()));
                paths.put("output", layout.events.toString());
                rows.put("inputs", scope.gatedAlerts.size());
                rows.put("output", scope.events.size());
                break;
            default:
                throw new IllegalArgumentException("unknown stage: " + stage);
        }

        JSONObject root = new JSONObject();
        root.put("stage", stageInfo);
        root.put("paths", paths);
        root.put("rows", rows);
        if (stage == 2) {
            root.put("qc_counts", qcCounts(scope));
        }
        root.put("report_range", reportRange());
        root.put("pass_rates", passRates(scope));
        root.put("skip_reason", skipReasons(scope));
        root.put("thresholds", thresholds());
        root.put("generated_at", generatedAt.toString());
        return root;
    }

    private JSONObject passRates(Scope scope) {
        JSONObject out = new JSONObject();
        int total = scope.debug.size();
        if (total == 0) {
            out.put("qc_pass_rate", JSONObject.NULL);
            out.put("gating_pass_rate", JSONObject.NULL);
            out.put("allow_alert_rate", JSONObject.NULL);
            return out;
        }
        int qcOk = scope.qcOkDays();
        int allow = scope.allowAlertDays();
        out.put("qc_pass_rate", ratio(qcOk, total));
        out.put("gating_pass_rate", qcOk == 0 ? 0.0 : ratio(allow, qcOk));
        out.put("allow_alert_rate", ratio(allow, total));
        return out;
    }

    // JSONObject key order is unspecified; arrays keep SkipReason priority order.
    private JSONArray skipReasons(Scope scope) {
        JSONArray out = new JSONArray();
        int total = scope.debug.size();
        if (total == 0) {
            return out;
        }
        for (SkipReason reason : SkipReason.values()) {
            int count = 0;
            for (DebugRecord day : scope.debug) {
                if (day.skipReason == reason) {
                    count++;
                }
            }
            JSONObject entry = new JSONObject();
            entry.put("reason", reason.code());
            entry.put("count", count);
            entry.put("ratio", ratio(count, total));
            out.put(entry);
        }
        return out;
    }

    private JSONObject qcCounts(Scope scope) {
        JSONObject out = new JSONObject();
        int realObs = 0;
        int windowOk = 0;
        for (DebugRecord day : scope.debug) {
            if (day.realObsDay) {
                realObs++;
            }
            if (day.rsWindowOk) {
                windowOk++;
            }
        }
        out.put("total_days", scope.debug.size());
        out.put("real_obs_days", realObs);
        out.put("rs_window_ok_days", windowOk);
        out.put("qc_ok_days", scope.qcOkDays());
        out.put("allow_alert_days", scope.allowAlertDays());
        return out;
    }

    private JSONArray thresholds() {
        JSONArray out = new JSONArray();
        for (Map.Entry<String, Object> entry : settings.describe().entrySet()) {
            Object value = entry.getValue();
            JSONObject item = new JSONObject();
            item.put("name", entry.getKey());
            item.put("value", value instanceof List ? new JSONArray((List<?>) value) : value);
            out.put(item);
        }
        return out;
    }

    private JSONObject reportRange() {
        JSONObject out = new JSONObject();
        out.put("start", settings.reportStart == null ? JSONObject.NULL : settings.reportStart.toString());
        out.put("end", settings.reportEnd == null ? JSONObject.NULL : settings.reportEnd.toString());
        return out;
    }

    private static JSONObject stageRow(
            String stage,
            Path file,
            String granularity,
            Integer days,
            Integer alerts,
            Integer events,
            Integer removed
    ) {
        JSONObject row = new JSONObject();
        row.put("stage", stage);
        row.put("file", file.toString());
        row.put("granularity", granularity);
        row.put("days_count", days == null ? JSONObject.NULL : days);
        row.put("alerts_count", alerts == null ? JSONObject.NULL : alerts);
        row.put("events_count", events == null ? JSONObject.NULL : events);
        row.put("removed_count", removed == null ? JSONObject.NULL : removed);
        return row;
    }

    private static double ratio(int count, int total) {
        return BigDecimal.valueOf(count)
                .divide(BigDecimal.valueOf(total), RATIO_SCALE, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private static Path write(Path path, JSONObject payload) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, payload.toString(2) + "\n", StandardCharsets.UTF_8);
            return path;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write summary " + path, e);
        }
    }

    /**
     * Engine output restricted to the report range.
     */
    private final class Scope {
        final List<DailyRecord> records = new ArrayList<>();
        final List<DebugRecord> debug = new ArrayList<>();
        final List<AlertRecord> rawAlerts = new ArrayList<>();
        final List<AlertRecord> gatedAlerts = new ArrayList<>();
        final List<MergedEvent> events = new ArrayList<>();

        Scope(EngineResult result) {
            for (DailyRecord record : result.records) {
                if (settings.inReportRange(record.date)) {
                    records.add(record);
                }
            }
            for (DebugRecord day : result.debug) {
                if (settings.inReportRange(day.date)) {
                    debug.add(day);
                }
            }
            for (AlertRecord alert : result.rawAlerts) {
                if (settings.inReportRange(alert.date)) {
                    rawAlerts.add(alert);
                }
            }
            for (AlertRecord alert : result.gatedAlerts) {
                if (settings.inReportRange(alert.date)) {
                    gatedAlerts.add(alert);
                }
            }
            for (MergedEvent event : result.events) {
                if (settings.inReportRange(event.startDate)) {
                    events.add(event);
                }
            }
        }

        int qcOkDays() {
            int n = 0;
            for (DebugRecord day : debug) {
                if (day.qcOk) {
                    n++;
                }
            }
            return n;
        }

        int allowAlertDays() {
            int n = 0;
            for (DebugRecord day : debug) {
                if (day.allowAlert) {
                    n++;
                }
            }
            return n;
        }
    }
}
