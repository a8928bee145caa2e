package com.cropalert.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single engine run's step timings, row counts and summary.
 */
public final class RunTelemetry {
    public static final String STEP_LOAD_INPUT = "LOAD_INPUT";
    public static final String STEP_RESOLVE_METRICS = "RESOLVE_METRICS";
    public static final String STEP_SUPPORT_WINDOW = "SUPPORT_WINDOW";
    public static final String STEP_QC_GATING = "QC_GATING";
    public static final String STEP_CLASSIFY = "CLASSIFY";
    public static final String STEP_MERGE_EVENTS = "MERGE_EVENTS";
    public static final String STEP_WRITE_OUTPUTS = "WRITE_OUTPUTS";
    public static final String STEP_STAGE_SUMMARY = "STAGE_SUMMARY";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runId;
    private final String inputPath;
    private final Instant startedAt;
    private Instant finishedAt;

    private int inputDays;
    private int qcOkDays;
    private int allowAlertDays;
    private int rawAlerts;
    private int gatedAlerts;
    private int events;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String runId, String inputPath, Instant startedAt) {
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
        this.runId = blankTo(runId, String.valueOf(this.startedAt.toEpochMilli()));
        this.inputPath = blankTo(inputPath, "unknown");
        this.finishedAt = null;
    }

    public synchronized String runId() {
        return runId;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public synchronized void endStep(
            String name,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        appendNote(stat, optionalNote);
        errorsTotal += (int) Math.max(0L, errorCount);
    }

    public synchronized void setStepNote(String name, String optionalNote) {
        String key = sanitizeStepName(name);
        appendNote(steps.computeIfAbsent(key, StepStat::new), optionalNote);
    }

    public synchronized void setDayStats(int inputDays, int qcOkDays, int allowAlertDays) {
        this.inputDays = Math.max(0, inputDays);
        this.qcOkDays = Math.max(0, qcOkDays);
        this.allowAlertDays = Math.max(0, allowAlertDays);
    }

    public synchronized void setAlertStats(int rawAlerts, int gatedAlerts, int events) {
        this.rawAlerts = Math.max(0, rawAlerts);
        this.gatedAlerts = Math.max(0, gatedAlerts);
        this.events = Math.max(0, events);
    }

    public synchronized void incrementErrors(int count) {
        if (count <= 0) {
            return;
        }
        this.errorsTotal += count;
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount,
                    stat.optionalNote
            ));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_id=").append(runId).append('\n');
        sb.append("input=").append(inputPath).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("days=").append(inputDays)
                .append(" qc_ok=").append(qcOkDays)
                .append(" allow_alert=").append(allowAlertDays).append('\n');
        sb.append("raw_alerts=").append(rawAlerts)
                .append(" gated_alerts=").append(gatedAlerts)
                .append(" events=").append(events).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (stat.optionalNote != null && !stat.optionalNote.isBlank()) {
                sb.append(" note=").append(stat.optionalNote.trim());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private void appendNote(StepStat stat, String optionalNote) {
        if (optionalNote == null || optionalNote.trim().isEmpty()) {
            return;
        }
        String note = optionalNote.trim();
        if (stat.optionalNote.isEmpty()) {
            stat.optionalNote = note;
        } else if (!stat.optionalNote.contains(note)) {
            stat.optionalNote = stat.optionalNote + "; " + note;
        }
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String optionalNote;

        private StepStat(String name) {
            this.name = name;
            this.optionalNote = "";
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
    }
}
