package com.cropalert.engine.gate;

import com.cropalert.model.SkipReason;

/**
 * Outcome of the quality gate for one day.
 */
public final class QcDecision {
    public final boolean missingRemote;
    public final boolean missingWeather;
    public final boolean nonfinite;
    public final SkipReason skipReason;

    public QcDecision(boolean missingRemote, boolean missingWeather, boolean nonfinite) {
        this.missingRemote = missingRemote;
        this.missingWeather = missingWeather;
        this.nonfinite = nonfinite;
        if (missingRemote) {
            this.skipReason = SkipReason.MISSING_REMOTE;
        } else if (missingWeather) {
            this.skipReason = SkipReason.MISSING_WEATHER;
        } else if (nonfinite) {
            this.skipReason = SkipReason.NONFINITE;
        } else {
            this.skipReason = SkipReason.OK;
        }
    }

    public boolean qcOk() {
        return skipReason == SkipReason.OK;
    }
}
