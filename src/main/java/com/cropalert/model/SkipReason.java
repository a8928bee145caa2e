package com.cropalert.model;

/**
 * Why a day was excluded from classification, in attribution priority order.
 */
public enum SkipReason {
    MISSING_REMOTE("missing_remote"),
    MISSING_WEATHER("missing_weather"),
    NONFINITE("nonfinite"),
    OK("ok");

    private final String code;

    SkipReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
