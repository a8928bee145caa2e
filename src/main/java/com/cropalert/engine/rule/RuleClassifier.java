package com.cropalert.engine.rule;

import com.cropalert.config.AlertThresholds;
import com.cropalert.model.AlertRecord;
import com.cropalert.model.DailyRecord;
import com.cropalert.model.DebugRecord;
import com.cropalert.model.EventType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 模块说明：RuleClassifier（class）。
 * 主要职责：对单日按固定顺序独立评估全部规则；命中 0 条不告警，1 条输出该类型，2 条及以上输出 composite。
 * 实现要点：所有规则都要求冠层存在（ndvi_fill 或 evi_fill 达到作物阈值）。
 */
public final class RuleClassifier {
    private final AlertThresholds thresholds;
    private final List<StressRule> rules;

    public RuleClassifier(AlertThresholds thresholds) {
        this(thresholds, StressRules.standard(thresholds));
    }

    public RuleClassifier(AlertThresholds thresholds, List<StressRule> rules) {
        this.thresholds = thresholds == null ? AlertThresholds.defaults() : thresholds;
        this.rules = List.copyOf(rules);
    }

    public List<StressRule> rules() {
        return rules;
    }

    public boolean canopyPresent(DailyRecord record) {
        return record.ndviFill >= thresholds.ndviCrop || record.eviFill >= thresholds.eviCrop;
    }

    public List<StressRule> firedRules(DailyRecord record) {
        if (!canopyPresent(record)) {
            return List.of();
        }
        List<StressRule> fired = new ArrayList<>();
        for (StressRule rule : rules) {
            if (rule.fires(record)) {
                fired.add(rule);
            }
        }
        return fired;
    }

    /**
     * Classifies one day without looking at QC or gating.
     */
    public Optional<AlertRecord> classify(DailyRecord record) {
        List<StressRule> fired = firedRules(record);
        if (fired.isEmpty()) {
            return Optional.empty();
        }
        if (fired.size() == 1) {
            StressRule rule = fired.get(0);
            return Optional.of(new AlertRecord(record.date, rule.eventType, rule.evidence(record), List.of(rule.name)));
        }
        List<String> names = new ArrayList<>();
        List<String> evidence = new ArrayList<>();
        for (StressRule rule : fired) {
            names.add(rule.name);
            evidence.add(rule.name + ": " + rule.evidence(record));
        }
        String reason = String.join("+", names) + "; " + String.join("; ", evidence);
        return Optional.of(new AlertRecord(record.date, EventType.COMPOSITE, reason, names));
    }

    /**
     * Raw pass ({@code gated=false}) admits days with qc_ok; the gated pass admits days with allow_alert.
     */
    public List<AlertRecord> classifyAll(List<DailyRecord> records, List<DebugRecord> debug, boolean gated) {
        if (records.size() != debug.size()) {
            throw new IllegalArgumentException("records and debug rows differ in size: "
                    + records.size() + " vs " + debug.size());
        }
        List<AlertRecord> out = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            DebugRecord day = debug.get(i);
            boolean eligible = gated ? day.allowAlert : day.qcOk;
            if (!eligible) {
                continue;
            }
            classify(records.get(i)).ifPresent(out::add);
        }
        return out;
    }
}
