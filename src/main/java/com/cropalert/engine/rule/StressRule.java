package com.cropalert.engine.rule;

import com.cropalert.model.DailyRecord;
import com.cropalert.model.EventType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * 模块说明：StressRule（class）。
 * 主要职责：单条胁迫规则的描述符，包含名称、事件类型、引用的输入、判定条件、证据文本与强度计算。
 * 实现要点：任一输入非有限值时规则不触发，也不计算强度。
 */
public final class StressRule {
    public final String name;
    public final EventType eventType;
    public final List<Metric> inputs;
    private final Predicate<DailyRecord> condition;
    private final Function<DailyRecord, String> evidence;
    private final List<IntensityTerm> intensityTerms;

    private StressRule(
            String name,
            EventType eventType,
            List<Metric> inputs,
            Predicate<DailyRecord> condition,
            Function<DailyRecord, String> evidence,
            List<IntensityTerm> intensityTerms
    ) {
        this.name = name;
        this.eventType = eventType;
        this.inputs = List.copyOf(inputs);
        this.condition = condition;
        this.evidence = evidence;
        this.intensityTerms = List.copyOf(intensityTerms);
    }

    public static Builder builder(String name, EventType eventType) {
        return new Builder(name, eventType);
    }

    public boolean inputsFinite(DailyRecord record) {
        for (Metric metric : inputs) {
            if (!Double.isFinite(metric.of(record))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Predicate alone; canopy presence is checked by the classifier.
     */
    public boolean fires(DailyRecord record) {
        return inputsFinite(record) && condition.test(record);
    }

    public String evidence(DailyRecord record) {
        return evidence.apply(record);
    }

    /**
     * Largest candidate distance, first candidate winning ties. Empty when any input is not finite.
     */
    public Optional<RuleIntensity> intensity(DailyRecord record) {
        if (!inputsFinite(record)) {
            return Optional.empty();
        }
        RuleIntensity best = null;
        for (IntensityTerm term : intensityTerms) {
            double value = term.distance.applyAsDouble(record);
            if (!Double.isFinite(value)) {
                continue;
            }
            if (best == null || value > best.value) {
                best = new RuleIntensity(term.metric, value);
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public String toString() {
        return name;
    }

    private static final class IntensityTerm {
        private final Metric metric;
        private final ToDoubleFunction<DailyRecord> distance;

        private IntensityTerm(Metric metric, ToDoubleFunction<DailyRecord> distance) {
            this.metric = metric;
            this.distance = distance;
        }
    }

    public static final class Builder {
        private final String name;
        private final EventType eventType;
        private final List<Metric> inputs = new ArrayList<>();
        private final List<IntensityTerm> intensityTerms = new ArrayList<>();
        private Predicate<DailyRecord> condition = r -> false;
        private Function<DailyRecord, String> evidence = r -> "";

        private Builder(String name, EventType eventType) {
            this.name = name;
            this.eventType = eventType;
        }

        public Builder inputs(Metric... metrics) {
            inputs.addAll(List.of(metrics));
            return this;
        }

        public Builder when(Predicate<DailyRecord> condition) {
            this.condition = condition;
            return this;
        }

        public Builder evidence(Function<DailyRecord, String> evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder intensity(Metric metric, ToDoubleFunction<DailyRecord> distance) {
            intensityTerms.add(new IntensityTerm(metric, distance));
            return this;
        }

        public StressRule build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("rule name is required");
            }
            if (eventType == null) {
                throw new IllegalArgumentException("event type is required for rule " + name);
            }
            return new StressRule(name, eventType, inputs, condition, evidence, intensityTerms);
        }
    }
}
