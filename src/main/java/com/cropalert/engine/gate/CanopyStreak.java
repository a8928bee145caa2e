package com.cropalert.engine.gate;

/**
 * Immutable accumulator for consecutive canopy-confirming observations.
 */
public final class CanopyStreak {
    private static final CanopyStreak EMPTY = new CanopyStreak(0);

    public final int length;

    private CanopyStreak(int length) {
        this.length = length;
    }

    public static CanopyStreak initial() {
        return EMPTY;
    }

    /**
     * Non-observation days carry the streak over unchanged; an observation either extends it or resets it.
     */
    public CanopyStreak advance(boolean realObservation, boolean canopyConfirmed) {
        if (!realObservation) {
            return this;
        }
        return canopyConfirmed ? new CanopyStreak(length + 1) : EMPTY;
    }

    public boolean ready(int minimum) {
        return length >= minimum;
    }
}
