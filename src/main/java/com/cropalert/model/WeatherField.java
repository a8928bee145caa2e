package com.cropalert.model;

import java.util.Locale;

/**
 * 7-day rolling weather aggregates consumed by the rules.
 */
public enum WeatherField {
    PRECIP_7D("precip_7d"),
    TMEAN_7D("tmean_7d"),
    RH_7D("rh_7d"),
    TMIN_7D("tmin_7d");

    private final String column;

    WeatherField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public static WeatherField parse(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (WeatherField field : values()) {
                if (field.column.equals(normalized)) {
                    return field;
                }
            }
        }
        throw new IllegalArgumentException("unknown weather field: " + raw);
    }
}
