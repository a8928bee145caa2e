package com.cropalert.io;

import com.cropalert.config.Config;

import java.nio.file.Path;

/**
 * Where one run reads its daily table and writes its four tables and summaries.
 */
public final class OutputLayout {
    public static final String STAGE_SUMMARY_FILE = "stage_summary.json";

    public final Path input;
    public final Path outputDir;
    public final Path debug;
    public final Path alertsRaw;
    public final Path alertsGated;
    public final Path events;

    public OutputLayout(Path input, Path outputDir, Path debug, Path alertsRaw, Path alertsGated, Path events) {
        this.input = input;
        this.outputDir = outputDir;
        this.debug = debug;
        this.alertsRaw = alertsRaw;
        this.alertsGated = alertsGated;
        this.events = events;
    }

    /**
     * Paths from {@code input.path}/{@code outputs.*}; non-null overrides win and resolve against the working dir.
     */
    public static OutputLayout fromConfig(Config config, Path inputOverride, Path outputDirOverride) {
        Path input = inputOverride == null
                ? config.getPath("input.path")
                : config.workingDir().resolve(inputOverride).normalize();
        Path dir = outputDirOverride == null
                ? config.getPath("outputs.dir")
                : config.workingDir().resolve(outputDirOverride).normalize();
        return new OutputLayout(
                input,
                dir,
                dir.resolve(config.requireString("outputs.debug_file")),
                dir.resolve(config.requireString("outputs.alerts_raw_file")),
                dir.resolve(config.requireString("outputs.alerts_gated_file")),
                dir.resolve(config.requireString("outputs.events_file"))
        );
    }

    public Path inputSummary() {
        return outputDir.resolve(summaryName(input));
    }

    public Path stageSummary() {
        return outputDir.resolve(STAGE_SUMMARY_FILE);
    }

    public static Path summaryOf(Path csv) {
        return csv.resolveSibling(summaryName(csv));
    }

    private static String summaryName(Path csv) {
        String name = csv.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return stem + ".summary.json";
    }
}
