package com.cropalert.engine.gate;

import com.cropalert.config.GatingSettings;
import com.cropalert.model.DailyRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：CanopyReadinessGate（class）。
 * 主要职责：按日期顺序折叠冠层连续确认次数，结合月份窗口给出 gating_ok。
 * 实现要点：只有真实观测日会改变连续计数；非观测日沿用前值。输入必须按日期严格递增。
 */
public final class CanopyReadinessGate {
    private final GatingSettings settings;

    public CanopyReadinessGate(GatingSettings settings) {
        this.settings = settings == null ? GatingSettings.defaults() : settings;
    }

    public List<GateState> scan(List<DailyRecord> records) {
        List<GateState> out = new ArrayList<>(records.size());
        CanopyStreak streak = CanopyStreak.initial();
        LocalDate previous = null;
        for (DailyRecord record : records) {
            if (previous != null && !record.date.isAfter(previous)) {
                throw new IllegalStateException("records must be in strictly increasing date order: "
                        + previous + " then " + record.date);
            }
            previous = record.date;

            boolean realObs = record.realObservation();
            streak = streak.advance(realObs, canopyConfirmed(record));
            boolean ready = streak.ready(settings.canopyObsMin);
            boolean monthOk = monthOk(record.date);
            out.add(new GateState(record.date, realObs, streak.length, ready, monthOk, gatingOk(monthOk, ready)));
        }
        return out;
    }

    /**
     * Observed (not filled) NDVI or EVI at or above the canopy minimum.
     */
    public boolean canopyConfirmed(DailyRecord record) {
        return record.ndviObs >= settings.canopyNdviMin || record.eviObs >= settings.canopyEviMin;
    }

    public boolean monthOk(LocalDate date) {
        return settings.months.contains(date.getMonthValue());
    }

    public boolean gatingOk(boolean monthOk, boolean canopyReady) {
        switch (settings.mode) {
            case OFF:
                return true;
            case MONTH_WINDOW:
                return monthOk;
            case CANOPY_OBS:
                return canopyReady;
            case BOTH:
                return monthOk && canopyReady;
            default:
                throw new IllegalStateException("unsupported gating mode: " + settings.mode);
        }
    }
}
