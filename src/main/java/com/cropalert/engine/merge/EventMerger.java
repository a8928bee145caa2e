package com.cropalert.engine.merge;

import com.cropalert.config.AlertThresholds;
import com.cropalert.engine.rule.RuleIntensity;
import com.cropalert.engine.rule.StressRule;
import com.cropalert.model.AlertRecord;
import com.cropalert.model.DailyRecord;
import com.cropalert.model.EventType;
import com.cropalert.model.MergedEvent;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 模块说明：EventMerger（class）。
 * 主要职责：把同类型、日期间隔不超过 merge_gap_days + 1 的门控告警合并为事件，并计算峰值日期、峰值强度与原因摘要。
 * 实现要点：不同类型永不合并；composite 强度取当日命中规则强度的最大值；无可计算强度时回退到首个成员。
 */
public final class EventMerger {
    private static final int MAX_SUMMARY_REASONS = 2;
    private static final String SUMMARY_SEPARATOR = " | ";

    private final AlertThresholds thresholds;
    private final Map<String, StressRule> rulesByName = new LinkedHashMap<>();

    public EventMerger(AlertThresholds thresholds, List<StressRule> rules) {
        this.thresholds = thresholds == null ? AlertThresholds.defaults() : thresholds;
        for (StressRule rule : rules) {
            rulesByName.put(rule.name, rule);
        }
    }

    public List<MergedEvent> merge(List<AlertRecord> alerts, List<DailyRecord> records) {
        Map<LocalDate, DailyRecord> byDate = new HashMap<>();
        for (DailyRecord record : records) {
            byDate.put(record.date, record);
        }

        Map<EventType, List<AlertRecord>> byType = new EnumMap<>(EventType.class);
        for (AlertRecord alert : alerts) {
            byType.computeIfAbsent(alert.eventType, ignored -> new ArrayList<>()).add(alert);
        }

        List<MergedEvent> events = new ArrayList<>();
        long maxGap = thresholds.mergeGapDays + 1L;
        for (List<AlertRecord> group : byType.values()) {
            group.sort(Comparator.comparing(a -> a.date));
            List<AlertRecord> bucket = new ArrayList<>();
            for (AlertRecord alert : group) {
                if (!bucket.isEmpty()) {
                    LocalDate previous = bucket.get(bucket.size() - 1).date;
                    if (ChronoUnit.DAYS.between(previous, alert.date) > maxGap) {
                        events.add(toEvent(bucket, byDate));
                        bucket = new ArrayList<>();
                    }
                }
                bucket.add(alert);
            }
            if (!bucket.isEmpty()) {
                events.add(toEvent(bucket, byDate));
            }
        }
        events.sort(Comparator.comparing((MergedEvent e) -> e.startDate)
                .thenComparing(e -> e.eventType.code()));
        return events;
    }

    /**
     * Maximum intensity over the rules that produced this alert; rules of the alert's own type when none are recorded.
     */
    public Optional<RuleIntensity> intensity(AlertRecord alert, DailyRecord record) {
        if (record == null) {
            return Optional.empty();
        }
        List<StressRule> contributing = new ArrayList<>();
        for (String name : alert.triggeredRules) {
            StressRule rule = rulesByName.get(name);
            if (rule != null) {
                contributing.add(rule);
            }
        }
        if (contributing.isEmpty()) {
            for (StressRule rule : rulesByName.values()) {
                if (rule.eventType == alert.eventType) {
                    contributing.add(rule);
                }
            }
        }
        RuleIntensity best = null;
        for (StressRule rule : contributing) {
            Optional<RuleIntensity> candidate = rule.intensity(record);
            if (candidate.isPresent() && (best == null || candidate.get().value > best.value)) {
                best = candidate.get();
            }
        }
        return Optional.ofNullable(best);
    }

    private MergedEvent toEvent(List<AlertRecord> bucket, Map<LocalDate, DailyRecord> byDate) {
        AlertRecord first = bucket.get(0);
        AlertRecord last = bucket.get(bucket.size() - 1);

        AlertRecord peak = first;
        RuleIntensity peakIntensity = null;
        for (AlertRecord alert : bucket) {
            Optional<RuleIntensity> candidate = intensity(alert, byDate.get(alert.date));
            if (candidate.isPresent() && (peakIntensity == null || candidate.get().value > peakIntensity.value)) {
                peak = alert;
                peakIntensity = candidate.get();
            }
        }

        List<String> reasons = new ArrayList<>();
        for (AlertRecord alert : bucket) {
            if (reasons.size() >= MAX_SUMMARY_REASONS) {
                break;
            }
            if (!alert.reason.isEmpty() && !reasons.contains(alert.reason)) {
                reasons.add(alert.reason);
            }
        }

        return MergedEvent.builder()
                .eventType(first.eventType)
                .startDate(first.date)
                .endDate(last.date)
                .durationDays((int) ChronoUnit.DAYS.between(first.date, last.date) + 1)
                .peakDate(peak.date)
                .peakValue(peakIntensity == null ? Double.NaN : peakIntensity.value)
                .peakMetric(peakIntensity == null ? "" : peakIntensity.metric.column())
                .reasonSummary(String.join(SUMMARY_SEPARATOR, reasons))
                .build();
    }
}
