package com.cropalert.config;

import java.util.Locale;

/**
 * Which observations may back a day: any within the half-window, or only past/same-day ones.
 */
public enum WindowMode {
    SYMMETRIC("symmetric"),
    PAST_ONLY("past_only");

    private final String code;

    WindowMode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static WindowMode parse(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (WindowMode mode : values()) {
            if (mode.code.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown remote_sensing.window_mode: '" + raw
                + "' (expected symmetric or past_only)");
    }
}
