package com.cropalert.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Set;
import java.util.TreeSet;

/**
 * Calendar / canopy-establishment gating. {@code months} holds calendar month numbers 1..12.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class GatingSettings {
    @Builder.Default
    public final GatingMode mode = GatingMode.CANOPY_OBS;
    @Builder.Default
    public final int canopyObsMin = 2;
    @Builder.Default
    public final Set<Integer> months = Set.of(4, 5, 6, 7, 8, 9, 10);
    @Builder.Default
    public final double canopyNdviMin = 0.45;
    @Builder.Default
    public final double canopyEviMin = 0.35;

    public static GatingSettings defaults() {
        return GatingSettings.builder().build();
    }

    static GatingSettings fromConfig(Config config, AlertThresholds thresholds) {
        int canopyObsMin = config.requireInt("gating.canopy_obs_min", 2);
        if (canopyObsMin < 0) {
            throw new IllegalArgumentException("gating.canopy_obs_min must be >= 0, got " + canopyObsMin);
        }
        return new GatingSettings(
                GatingMode.parse(config.getString("gating.mode", GatingMode.CANOPY_OBS.code())),
                canopyObsMin,
                parseMonths(config),
                config.requireDouble("gating.canopy_ndvi_min", thresholds.ndviCrop),
                config.requireDouble("gating.canopy_evi_min", thresholds.eviCrop)
        );
    }

    private static Set<Integer> parseMonths(Config config) {
        Set<Integer> out = new TreeSet<>();
        for (String token : config.getList("gating.months")) {
            int month;
            try {
                month = Integer.parseInt(token);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid month in gating.months: " + token, e);
            }
            if (month < 1 || month > 12) {
                throw new IllegalArgumentException("month out of range in gating.months: " + month);
            }
            out.add(month);
        }
        return Set.copyOf(out);
    }
}
