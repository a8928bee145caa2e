package com.cropalert.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Per-day internal judgments of the engine: remote-sensing support, QC and gating.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class DebugRecord {
    public static final int NO_SUPPORT_AGE = 9999;

    public final LocalDate date;
    public final boolean realObsDay;
    /** Null when no observation falls inside the window. */
    public final LocalDate rsSupportDate;
    public final int rsSupportAge;
    public final boolean rsWindowOk;
    public final boolean missingRemote;
    public final boolean missingWeather;
    public final boolean qcOk;
    public final SkipReason skipReason;
    public final int canopyObsStreak;
    public final boolean canopyObsReady;
    public final boolean monthOk;
    public final boolean gatingOk;
    public final boolean allowAlert;
}
