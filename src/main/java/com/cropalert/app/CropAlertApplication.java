package com.cropalert.app;

import com.cropalert.config.Config;
import com.cropalert.config.EngineSettings;
import com.cropalert.core.RunTelemetry;
import com.cropalert.core.TableSchemaException;
import com.cropalert.engine.CompositeAlertEngine;
import com.cropalert.engine.EngineResult;
import com.cropalert.io.AlertTableWriter;
import com.cropalert.io.DailyTableReader;
import com.cropalert.io.OutputLayout;
import com.cropalert.io.StageSummaryBuilder;
import com.cropalert.model.DailyTable;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 模块说明：CropAlertApplication（class）。
 * 主要职责：命令行入口；加载配置与日表，运行复合告警引擎，写出 02~05 四张表与阶段摘要。
 * 退出码：0 成功；2 参数或配置错误；3 输入表结构错误；1 其他失败。
 */
public final class CropAlertApplication {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_SCHEMA = 3;

    private static final DateTimeFormatter RUN_ID_FMT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final List<String> LOGGED_KEYS = List.of(
            "input.path",
            "outputs.dir",
            "gating.mode",
            "remote_sensing.window_mode",
            "remote_sensing.support_pick"
    );
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final Path workingDir;
    private final boolean routeLogs;

    public CropAlertApplication() {
        this(Path.of(".").toAbsolutePath().normalize(), true);
    }

    public CropAlertApplication(Path workingDir, boolean routeLogs) {
        this.workingDir = workingDir;
        this.routeLogs = routeLogs;
    }

    public static void main(String[] args) {
        int exit = new CropAlertApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("cropalert", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("cropalert", options);
            return EXIT_OK;
        }

        Config config;
        EngineSettings settings;
        OutputLayout layout;
        try {
            String explicit = cmd.getOptionValue("config");
            config = Config.load(workingDir, explicit == null ? null : Path.of(explicit));
            if (routeLogs) {
                installLogRoutingIfNeeded(config);
            }
            settings = EngineSettings.fromConfig(config);
            layout = OutputLayout.fromConfig(
                    config,
                    optionalPath(cmd, "input"),
                    optionalPath(cmd, "output-dir")
            );
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        for (String key : LOGGED_KEYS) {
            Config.ResolvedValue value = config.resolve(key);
            System.out.println("config " + value.key + "=" + value.value + " (source=" + value.source + ")");
        }

        boolean summaryEnabled = !cmd.hasOption("no-summary") && config.getBoolean("outputs.summary.enabled", true);
        Instant startedAt = Instant.now();
        RunTelemetry telemetry = new RunTelemetry(RUN_ID_FMT.format(startedAt), layout.input.toString(), startedAt);
        try {
            return execute(settings, layout, summaryEnabled, telemetry);
        } catch (TableSchemaException e) {
            telemetry.incrementErrors(1);
            System.err.println("ERROR: input schema: " + e.getMessage());
            return EXIT_SCHEMA;
        } catch (Exception e) {
            telemetry.incrementErrors(1);
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return EXIT_FAILURE;
        } finally {
            telemetry.finish();
            System.out.println(telemetry.getSummary());
        }
    }

    int execute(EngineSettings settings, OutputLayout layout, boolean summaryEnabled, RunTelemetry telemetry) {
        telemetry.startStep(RunTelemetry.STEP_LOAD_INPUT);
        DailyTable table = new DailyTableReader().read(layout.input);
        telemetry.endStep(RunTelemetry.STEP_LOAD_INPUT, table.size(), table.size(), 0L, layout.input.toString());
        System.out.println("Loaded " + table.size() + " days from " + layout.input);

        EngineResult result = new CompositeAlertEngine(settings).run(table, telemetry);

        telemetry.startStep(RunTelemetry.STEP_WRITE_OUTPUTS);
        AlertTableWriter writer = new AlertTableWriter();
        writer.writeDebug(layout.debug, result.debug);
        writer.writeAlerts(layout.alertsRaw, result.rawAlerts);
        writer.writeAlerts(layout.alertsGated, result.gatedAlerts);
        writer.writeEvents(layout.events, result.events);
        long rows = result.debug.size() + result.rawAlerts.size() + result.gatedAlerts.size() + result.events.size();
        telemetry.endStep(RunTelemetry.STEP_WRITE_OUTPUTS, rows, 4L, 0L, layout.outputDir.toString());
        System.out.println("Wrote debug=" + layout.debug.getFileName()
                + ", raw=" + result.rawAlerts.size()
                + ", gated=" + result.gatedAlerts.size()
                + ", events=" + result.events.size()
                + " to " + layout.outputDir);

        if (summaryEnabled) {
            telemetry.startStep(RunTelemetry.STEP_STAGE_SUMMARY);
            List<Path> written = new StageSummaryBuilder(settings, layout, Instant.now()).writeAll(result);
            telemetry.endStep(RunTelemetry.STEP_STAGE_SUMMARY, 5L, written.size(), 0L);
        } else {
            telemetry.setStepNote(RunTelemetry.STEP_STAGE_SUMMARY, "disabled");
        }
        return EXIT_OK;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (CropAlertApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("logs.dir");
                Files.createDirectories(logDir);
                System.setProperty("cropalert.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(CropAlertApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private static Path optionalPath(CommandLine cmd, String option) {
        String raw = cmd.getOptionValue(option);
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        return Path.of(raw.trim());
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("i").longOpt("input").hasArg().argName("csv").desc("merged daily table (overrides input.path)").build());
        options.addOption(Option.builder("o").longOpt("output-dir").hasArg().argName("dir").desc("directory for the output tables (overrides outputs.dir)").build());
        options.addOption(Option.builder("c").longOpt("config").hasArg().argName("file").desc("extra properties file applied over config.properties").build());
        options.addOption(Option.builder().longOpt("no-summary").desc("skip the JSON stage summaries").build());
        options.addOption(Option.builder("h").longOpt("help").desc("show help").build());
        return options;
    }
}
