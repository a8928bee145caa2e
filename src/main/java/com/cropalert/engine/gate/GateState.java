package com.cropalert.engine.gate;

import java.time.LocalDate;

/**
 * Calendar and canopy gating for one day.
 */
public final class GateState {
    public final LocalDate date;
    public final boolean realObsDay;
    public final int canopyObsStreak;
    public final boolean canopyObsReady;
    public final boolean monthOk;
    public final boolean gatingOk;

    public GateState(
            LocalDate date,
            boolean realObsDay,
            int canopyObsStreak,
            boolean canopyObsReady,
            boolean monthOk,
            boolean gatingOk
    ) {
        this.date = date;
        this.realObsDay = realObsDay;
        this.canopyObsStreak = canopyObsStreak;
        this.canopyObsReady = canopyObsReady;
        this.monthOk = monthOk;
        this.gatingOk = gatingOk;
    }
}
