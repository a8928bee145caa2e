package com.cropalert.config;

import java.util.Locale;

/**
 * Tie-break between equidistant past and future support observations.
 */
public enum SupportPick {
    /** Equal distance resolves to the later (future) observation. */
    NEAREST("nearest"),
    /** Equal distance resolves to the past observation. */
    PREFER_PAST("prefer_past");

    private final String code;

    SupportPick(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static SupportPick parse(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (SupportPick pick : values()) {
            if (pick.code.equals(normalized)) {
                return pick;
            }
        }
        throw new IllegalArgumentException("unknown remote_sensing.support_pick: '" + raw
                + "' (expected nearest or prefer_past)");
    }
}
