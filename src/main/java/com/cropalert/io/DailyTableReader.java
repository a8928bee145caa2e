package com.cropalert.io;

import com.cropalert.core.TableSchemaException;
import com.cropalert.model.DailyTable;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 模块说明：DailyTableReader（class）。
 * 主要职责：用 Jackson CSV 读取合并后的日表；date 列必填，其余数值列按表头原名保留。
 * 实现要点：行按日期排序；日期重复或无法解析视为结构错误；空值与 nan/NA/null/None 记为 NaN，inf 记为无穷。
 */
public final class DailyTableReader {
    private static final Logger LOG = LogManager.getLogger(DailyTableReader.class);

    public static final String DATE_COLUMN = "date";
    private static final Set<String> MISSING_TOKENS = Set.of("", "nan", "na", "n/a", "null", "none");

    private final CsvMapper mapper;

    public DailyTableReader() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.mapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    public DailyTable read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new UncheckedIOException(new NoSuchFileException(path.toString()));
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read daily table " + path, e);
        }
    }

    public DailyTable read(Reader reader, String sourceName) throws IOException {
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(reader)) {
            if (!it.hasNextValue()) {
                throw new TableSchemaException("daily table " + sourceName + " is empty (no header row)");
            }
            String[] header = normalizeHeader(it.nextValue());
            int dateIndex = indexOf(header, DATE_COLUMN);
            if (dateIndex < 0) {
                throw new TableSchemaException("daily table " + sourceName + " has no '" + DATE_COLUMN + "' column");
            }

            Map<String, Integer> numericColumns = new LinkedHashMap<>();
            for (int i = 0; i < header.length; i++) {
                if (i == dateIndex || header[i].isEmpty()) {
                    continue;
                }
                if (numericColumns.containsKey(header[i])) {
                    LOG.warn("duplicate column '{}' in {}; keeping the first occurrence", header[i], sourceName);
                    continue;
                }
                numericColumns.put(header[i], i);
            }

            TreeMap<LocalDate, double[]> rows = new TreeMap<>();
            int line = 1;
            while (it.hasNextValue()) {
                String[] cells = it.nextValue();
                line++;
                if (isBlankRow(cells)) {
                    continue;
                }
                String rawDate = dateIndex < cells.length ? cells[dateIndex] : "";
                LocalDate date = parseDate(rawDate, sourceName, line);
                double[] values = new double[numericColumns.size()];
                int k = 0;
                for (int index : numericColumns.values()) {
                    values[k++] = index < cells.length ? parseNumber(cells[index]) : Double.NaN;
                }
                if (rows.put(date, values) != null) {
                    throw new TableSchemaException("duplicate date " + date + " in " + sourceName + " (line " + line + ")");
                }
            }

            List<LocalDate> dates = new ArrayList<>(rows.keySet());
            Map<String, double[]> columns = new LinkedHashMap<>();
            int k = 0;
            for (String name : numericColumns.keySet()) {
                double[] column = new double[dates.size()];
                int row = 0;
                for (double[] values : rows.values()) {
                    column[row++] = values[k];
                }
                columns.put(name, column);
                k++;
            }
            LOG.info("loaded {} days x {} columns from {}", dates.size(), columns.size(), sourceName);
            return new DailyTable(dates, columns);
        }
    }

    /**
     * Parses one numeric cell. Missing markers and unparseable text become {@code NaN}.
     */
    public static double parseNumber(String raw) {
        if (raw == null) {
            return Double.NaN;
        }
        String text = raw.trim();
        String lower = text.toLowerCase(Locale.ROOT);
        if (MISSING_TOKENS.contains(lower)) {
            return Double.NaN;
        }
        switch (lower) {
            case "inf":
            case "+inf":
            case "infinity":
            case "+infinity":
                return Double.POSITIVE_INFINITY;
            case "-inf":
            case "-infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    static LocalDate parseDate(String raw, String sourceName, int line) {
        String text = raw == null ? "" : raw.trim();
        if (text.length() > 10 && (text.charAt(10) == ' ' || text.charAt(10) == 'T')) {
            text = text.substring(0, 10);
        }
        if (text.isEmpty()) {
            throw new TableSchemaException("missing date in " + sourceName + " (line " + line + ")");
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new TableSchemaException("unparseable date '" + raw + "' in " + sourceName + " (line " + line + ")", e);
        }
    }

    private static String[] normalizeHeader(String[] header) {
        String[] out = new String[header.length];
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].trim();
            if (i == 0 && name.startsWith("\uFEFF")) {
                name = name.substring(1).trim();
            }
            out[i] = name;
        }
        return out;
    }

    private static int indexOf(String[] header, String name) {
        for (int i = 0; i < header.length; i++) {
            if (header[i].equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isBlankRow(String[] cells) {
        for (String cell : cells) {
            if (cell != null && !cell.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
