package com.cropalert.config;

import java.util.Locale;

/**
 * How the calendar mask and the canopy streak combine into {@code gating_ok}.
 */
public enum GatingMode {
    OFF("off"),
    MONTH_WINDOW("month_window"),
    CANOPY_OBS("canopy_obs"),
    BOTH("both");

    private final String code;

    GatingMode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static GatingMode parse(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (GatingMode mode : values()) {
            if (mode.code.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown gating.mode: '" + raw
                + "' (expected off, month_window, canopy_obs or both)");
    }
}
