package com.cropalert.engine.rule;

/**
 * Signed distance past a rule threshold, with the metric that produced it.
 */
public final class RuleIntensity {
    public final Metric metric;
    public final double value;

    public RuleIntensity(Metric metric, double value) {
        this.metric = metric;
        this.value = value;
    }

    @Override
    public String toString() {
        return metric.column() + "=" + value;
    }
}
