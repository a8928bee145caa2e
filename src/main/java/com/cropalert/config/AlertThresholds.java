package com.cropalert.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Rule thresholds. Builder defaults match the shipped configuration.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class AlertThresholds {
    @Builder.Default
    public final double ndviCrop = 0.45;
    @Builder.Default
    public final double eviCrop = 0.35;
    @Builder.Default
    public final int rsMaxAge = 5;
    @Builder.Default
    public final double ndmiDry = 0.20;
    @Builder.Default
    public final double msiDry = 1.50;
    @Builder.Default
    public final double precipLow7 = 15.0;
    @Builder.Default
    public final double ndmiWet = 0.45;
    @Builder.Default
    public final double precipHigh7 = 60.0;
    @Builder.Default
    public final double heatTmean7 = 30.0;
    @Builder.Default
    public final double heatRh7 = 60.0;
    @Builder.Default
    public final double coldTmin7 = 3.0;
    @Builder.Default
    public final double coldEviLow = 0.40;
    @Builder.Default
    public final double coldNdviLow = 0.50;
    @Builder.Default
    public final double ndreLow = 0.30;
    @Builder.Default
    public final double gndviLow = 0.50;
    @Builder.Default
    public final double slope7Drop = -0.03;
    @Builder.Default
    public final int mergeGapDays = 1;

    public static AlertThresholds defaults() {
        return AlertThresholds.builder().build();
    }

    static AlertThresholds fromConfig(Config config) {
        AlertThresholds d = defaults();
        int mergeGap = config.requireInt("alerts.merge_gap_days", d.mergeGapDays);
        if (mergeGap < 0) {
            throw new IllegalArgumentException("alerts.merge_gap_days must be >= 0, got " + mergeGap);
        }
        int maxAge = config.requireInt("alerts.rs_max_age", d.rsMaxAge);
        if (maxAge < 0) {
            throw new IllegalArgumentException("alerts.rs_max_age must be >= 0, got " + maxAge);
        }
        return AlertThresholds.builder()
                .ndviCrop(config.requireDouble("alerts.ndvi_crop", d.ndviCrop))
                .eviCrop(config.requireDouble("alerts.evi_crop", d.eviCrop))
                .rsMaxAge(maxAge)
                .ndmiDry(config.requireDouble("alerts.ndmi_dry", d.ndmiDry))
                .msiDry(config.requireDouble("alerts.msi_dry", d.msiDry))
                .precipLow7(config.requireDouble("alerts.precip_low7", d.precipLow7))
                .ndmiWet(config.requireDouble("alerts.ndmi_wet", d.ndmiWet))
                .precipHigh7(config.requireDouble("alerts.precip_high7", d.precipHigh7))
                .heatTmean7(config.requireDouble("alerts.heat_tmean7", d.heatTmean7))
                .heatRh7(config.requireDouble("alerts.heat_rh7", d.heatRh7))
                .coldTmin7(config.requireDouble("alerts.cold_tmin7", d.coldTmin7))
                .coldEviLow(config.requireDouble("alerts.cold_evi_low", d.coldEviLow))
                .coldNdviLow(config.requireDouble("alerts.cold_ndvi_low", d.coldNdviLow))
                .ndreLow(config.requireDouble("alerts.ndre_low", d.ndreLow))
                .gndviLow(config.requireDouble("alerts.gndvi_low", d.gndviLow))
                .slope7Drop(config.requireDouble("alerts.slope7_drop", d.slope7Drop))
                .mergeGapDays(mergeGap)
                .build();
    }
}
