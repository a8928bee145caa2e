package com.cropalert.io;

import com.cropalert.model.AlertRecord;
import com.cropalert.model.DebugRecord;
import com.cropalert.model.MergedEvent;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：AlertTableWriter（class）。
 * 主要职责：把调试表、原始告警、门控告警与合并事件写为列顺序固定的 CSV。
 * 实现要点：布尔值写 true/false，缺失数值与空日期写空串，换行固定为 \n，保证同输入输出逐字节一致。
 */
public final class AlertTableWriter {
    public static final List<String> DEBUG_COLUMNS = List.of(
            "date",
            "real_obs_day",
            "rs_support_date",
            "rs_support_age",
            "rs_window_ok",
            "missing_remote",
            "missing_weather",
            "qc_ok",
            "skip_reason",
            "canopy_obs_streak",
            "canopy_obs_ready",
            "month_ok",
            "gating_ok",
            "allow_alert"
    );
    public static final List<String> ALERT_COLUMNS = List.of("date", "event_type", "reason");
    public static final List<String> EVENT_COLUMNS = List.of(
            "event_type",
            "start_date",
            "end_date",
            "duration_days",
            "peak_date",
            "peak_value",
            "peak_metric",
            "reason_summary"
    );

    private static final int NUMBER_SCALE = 6;

    private final CsvMapper mapper = new CsvMapper();

    public void writeDebug(Path path, List<DebugRecord> rows) {
        List<String[]> out = new ArrayList<>(rows.size());
        for (DebugRecord row : rows) {
            out.add(debugRow(row));
        }
        write(path, DEBUG_COLUMNS, out);
    }

    public void writeAlerts(Path path, List<AlertRecord> rows) {
        List<String[]> out = new ArrayList<>(rows.size());
        for (AlertRecord row : rows) {
            out.add(alertRow(row));
        }
        write(path, ALERT_COLUMNS, out);
    }

    public void writeEvents(Path path, List<MergedEvent> rows) {
        List<String[]> out = new ArrayList<>(rows.size());
        for (MergedEvent row : rows) {
            out.add(eventRow(row));
        }
        write(path, EVENT_COLUMNS, out);
    }

    public void write(Path path, List<String> columns, List<String[]> rows) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                write(writer, columns, rows);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write " + path, e);
        }
    }

    public void write(Writer writer, List<String> columns, List<String[]> rows) throws IOException {
        // header written as a plain row so that empty tables still carry it
        CsvSchema schema = CsvSchema.emptySchema().withLineSeparator("\n");
        try (SequenceWriter sequence = mapper.writer(schema).writeValues(writer)) {
            sequence.write(columns.toArray(new String[0]));
            for (String[] row : rows) {
                sequence.write(row);
            }
        }
    }

    static String[] debugRow(DebugRecord row) {
        return new String[]{
                date(row.date),
                bool(row.realObsDay),
                date(row.rsSupportDate),
                String.valueOf(row.rsSupportAge),
                bool(row.rsWindowOk),
                bool(row.missingRemote),
                bool(row.missingWeather),
                bool(row.qcOk),
                row.skipReason.code(),
                String.valueOf(row.canopyObsStreak),
                bool(row.canopyObsReady),
                bool(row.monthOk),
                bool(row.gatingOk),
                bool(row.allowAlert)
        };
    }

    static String[] alertRow(AlertRecord row) {
        return new String[]{date(row.date), row.eventType.code(), row.reason};
    }

    static String[] eventRow(MergedEvent row) {
        return new String[]{
                row.eventType.code(),
                date(row.startDate),
                date(row.endDate),
                String.valueOf(row.durationDays),
                date(row.peakDate),
                number(row.peakValue),
                row.peakMetric == null ? "" : row.peakMetric,
                row.reasonSummary == null ? "" : row.reasonSummary
        };
    }

    /**
     * Fixed-scale plain rendering with trailing zeros removed; non-finite values render empty.
     */
    public static String number(double value) {
        if (!Double.isFinite(value)) {
            return "";
        }
        BigDecimal scaled = BigDecimal.valueOf(value).setScale(NUMBER_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
        if (scaled.signum() == 0) {
            return "0";
        }
        return scaled.toPlainString();
    }

    private static String bool(boolean value) {
        return value ? "true" : "false";
    }

    private static String date(LocalDate value) {
        return value == null ? "" : value.toString();
    }
}
