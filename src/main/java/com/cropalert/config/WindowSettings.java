package com.cropalert.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Remote-sensing support window.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class WindowSettings {
    @Builder.Default
    public final int halfDays = 5;
    @Builder.Default
    public final WindowMode mode = WindowMode.SYMMETRIC;
    @Builder.Default
    public final SupportPick pick = SupportPick.PREFER_PAST;

    public static WindowSettings defaults() {
        return WindowSettings.builder().build();
    }

    static WindowSettings fromConfig(Config config, AlertThresholds thresholds) {
        int halfDays = config.requireInt("remote_sensing.window_half_days", thresholds.rsMaxAge);
        if (halfDays < 0) {
            throw new IllegalArgumentException("remote_sensing.window_half_days must be >= 0, got " + halfDays);
        }
        return new WindowSettings(
                halfDays,
                WindowMode.parse(config.getString("remote_sensing.window_mode", WindowMode.SYMMETRIC.code())),
                SupportPick.parse(config.getString("remote_sensing.support_pick", SupportPick.PREFER_PAST.code()))
        );
    }
}
