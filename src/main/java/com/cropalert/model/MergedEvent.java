package com.cropalert.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A maximal run of same-type gated alerts. {@code peakValue} is {@code NaN} and {@code peakMetric} empty when no
 * member had a computable intensity.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class MergedEvent {
    public final EventType eventType;
    public final LocalDate startDate;
    public final LocalDate endDate;
    public final int durationDays;
    public final LocalDate peakDate;
    public final double peakValue;
    public final String peakMetric;
    public final String reasonSummary;
}
