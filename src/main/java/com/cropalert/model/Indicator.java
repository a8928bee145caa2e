package com.cropalert.model;

import java.util.Locale;

/**
 * Remote-sensing vegetation / moisture indices carried by the daily table.
 */
public enum Indicator {
    NDVI,
    EVI,
    NDMI,
    NDRE,
    GNDVI,
    MSI;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String obsColumn() {
        return key() + "_obs";
    }

    public String fillColumn() {
        return key() + "_fill";
    }

    public static Indicator parse(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toUpperCase(Locale.ROOT);
            for (Indicator indicator : values()) {
                if (indicator.name().equals(normalized)) {
                    return indicator;
                }
            }
        }
        throw new IllegalArgumentException("unknown indicator: " + raw);
    }
}
