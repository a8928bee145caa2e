package com.cropalert.model;

import com.cropalert.core.TableSchemaException;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column-oriented daily input table as loaded from disk: one row per date, numeric columns keyed by their
 * source header. Absent cells are {@code NaN}. Instances are immutable.
 */
public final class DailyTable {
    private final List<LocalDate> dates;
    private final Map<String, double[]> columns;

    public DailyTable(List<LocalDate> dates, Map<String, double[]> columns) {
        this.dates = List.copyOf(dates);
        Map<String, double[]> copy = new LinkedHashMap<>();
        if (columns != null) {
            for (Map.Entry<String, double[]> e : columns.entrySet()) {
                double[] values = e.getValue();
                if (values == null || values.length != this.dates.size()) {
                    throw new TableSchemaException("column " + e.getKey() + " has "
                            + (values == null ? 0 : values.length) + " values for " + this.dates.size() + " dates");
                }
                copy.put(e.getKey(), values.clone());
            }
        }
        this.columns = Collections.unmodifiableMap(copy);
        for (int i = 1; i < this.dates.size(); i++) {
            if (!this.dates.get(i).isAfter(this.dates.get(i - 1))) {
                throw new TableSchemaException("dates must be strictly increasing, got "
                        + this.dates.get(i - 1) + " then " + this.dates.get(i));
            }
        }
    }

    public int size() {
        return dates.size();
    }

    public List<LocalDate> dates() {
        return dates;
    }

    public Set<String> columnNames() {
        return columns.keySet();
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public double value(String column, int row) {
        double[] values = columns.get(column);
        if (values == null) {
            return Double.NaN;
        }
        return values[row];
    }
}
