package com.cropalert.engine.rule;

import com.cropalert.config.AlertThresholds;
import com.cropalert.model.DailyRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StressRuleTest {

    private static final AlertThresholds T = AlertThresholds.defaults();

    @Test
    void intensity_shouldTakeLargestCandidate() {
        DailyRecord day = DailyRecord.builder()
                .date(LocalDate.of(2024, 7, 1))
                .ndmiFill(0.125)
                .msiFill(1.75)
                .precip7d(3.0)
                .build();

        RuleIntensity intensity = StressRules.drought(T).intensity(day).orElseThrow();

        assertEquals(Metric.MSI_FILL, intensity.metric);
        assertEquals(0.25, intensity.value, 1e-12);
    }

    @Test
    void intensity_shouldBeEmptyWhenInputsNotFinite() {
        DailyRecord day = DailyRecord.builder()
                .date(LocalDate.of(2024, 7, 1))
                .tmean7d(33.0)
                .rh7d(Double.POSITIVE_INFINITY)
                .eviFill(0.2)
                .ndviSlope7(-0.1)
                .build();

        assertTrue(StressRules.heatStress(T).intensity(day).isEmpty());
    }

    @Test
    void heatStress_slopeDropShouldSatisfyVegetationClause() {
        DailyRecord day = DailyRecord.builder()
                .date(LocalDate.of(2024, 7, 1))
                .tmean7d(30.0)
                .rh7d(60.0)
                .eviFill(0.50)
                .ndviSlope7(-0.03)
                .build();

        assertTrue(StressRules.heatStress(T).fires(day));
        assertEquals(0.0, StressRules.heatStress(T).intensity(day).orElseThrow().value, 1e-12);
    }
}
