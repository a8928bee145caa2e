package com.cropalert.engine;

import com.cropalert.model.AlertRecord;
import com.cropalert.model.DailyRecord;
import com.cropalert.model.DebugRecord;
import com.cropalert.model.MergedEvent;

import java.util.List;

/**
 * Everything one engine run derives from a daily table. Lists are unmodifiable.
 */
public final class EngineResult {
    public final List<DailyRecord> records;
    public final List<DebugRecord> debug;
    public final List<AlertRecord> rawAlerts;
    public final List<AlertRecord> gatedAlerts;
    public final List<MergedEvent> events;

    public EngineResult(
            List<DailyRecord> records,
            List<DebugRecord> debug,
            List<AlertRecord> rawAlerts,
            List<AlertRecord> gatedAlerts,
            List<MergedEvent> events
    ) {
        this.records = List.copyOf(records);
        this.debug = List.copyOf(debug);
        this.rawAlerts = List.copyOf(rawAlerts);
        this.gatedAlerts = List.copyOf(gatedAlerts);
        this.events = List.copyOf(events);
    }

    public long qcOkDays() {
        return debug.stream().filter(d -> d.qcOk).count();
    }

    public long allowAlertDays() {
        return debug.stream().filter(d -> d.allowAlert).count();
    }
}
