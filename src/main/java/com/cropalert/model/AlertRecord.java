package com.cropalert.model;

import java.time.LocalDate;
import java.util.List;

/**
 * 模块说明：AlertRecord（class）。
 * 主要职责：单日告警；triggeredRules 记录当天命中的规则名（按规则顺序），仅供事件合并计算强度，不写入输出表。
 */
public final class AlertRecord {
    public final LocalDate date;
    public final EventType eventType;
    public final String reason;
    public final List<String> triggeredRules;

    public AlertRecord(LocalDate date, EventType eventType, String reason, List<String> triggeredRules) {
        this.date = date;
        this.eventType = eventType;
        this.reason = reason == null ? "" : reason;
        this.triggeredRules = triggeredRules == null ? List.of() : List.copyOf(triggeredRules);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AlertRecord)) {
            return false;
        }
        AlertRecord other = (AlertRecord) o;
        return date.equals(other.date)
                && eventType == other.eventType
                && reason.equals(other.reason)
                && triggeredRules.equals(other.triggeredRules);
    }

    @Override
    public int hashCode() {
        int result = date.hashCode();
        result = 31 * result + eventType.hashCode();
        result = 31 * result + reason.hashCode();
        result = 31 * result + triggeredRules.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return date + " " + eventType.code() + " [" + reason + "]";
    }
}
