package com.cropalert.engine.rule;

import com.cropalert.config.AlertThresholds;
import com.cropalert.model.EventType;

import java.util.List;
import java.util.Locale;

/**
 * 模块说明：StressRules（class）。
 * 主要职责：构建固定顺序的胁迫规则表（干旱、渍涝、热害、冷害、营养/病虫），阈值来自 {@link AlertThresholds}。
 */
public final class StressRules {
    public static final String DROUGHT = "drought";
    public static final String WATERLOGGING = "waterlogging";
    public static final String HEAT_STRESS = "heat_stress";
    public static final String COLD_STRESS = "cold_stress";
    public static final String NUTRIENT_OR_PEST = "nutrient_or_pest";

    private static final List<String> RULE_NAMES = List.of(
            DROUGHT,
            WATERLOGGING,
            HEAT_STRESS,
            COLD_STRESS,
            NUTRIENT_OR_PEST
    );

    private StressRules() {
    }

    public static List<String> ruleNames() {
        return RULE_NAMES;
    }

    public static List<StressRule> standard(AlertThresholds t) {
        return List.of(
                drought(t),
                waterlogging(t),
                heatStress(t),
                coldStress(t),
                nutrientOrPest(t)
        );
    }

    static StressRule drought(AlertThresholds t) {
        return StressRule.builder(DROUGHT, EventType.DROUGHT)
                .inputs(Metric.NDMI_FILL, Metric.MSI_FILL, Metric.PRECIP_7D)
                .when(r -> (r.ndmiFill < t.ndmiDry || r.msiFill > t.msiDry) && r.precip7d < t.precipLow7)
                .evidence(r -> fmt("ndmi_fill=%.3f (dry<%.2f), msi_fill=%.3f (dry>%.2f), precip_7d=%.1f (<%.1f)",
                        r.ndmiFill, t.ndmiDry, r.msiFill, t.msiDry, r.precip7d, t.precipLow7))
                .intensity(Metric.NDMI_FILL, r -> t.ndmiDry - r.ndmiFill)
                .intensity(Metric.MSI_FILL, r -> r.msiFill - t.msiDry)
                .build();
    }

    static StressRule waterlogging(AlertThresholds t) {
        return StressRule.builder(WATERLOGGING, EventType.WATERLOGGING)
                .inputs(Metric.NDMI_FILL, Metric.PRECIP_7D, Metric.EVI_FILL, Metric.NDVI_FILL)
                .when(r -> r.ndmiFill > t.ndmiWet
                        && r.precip7d > t.precipHigh7
                        && (r.eviFill < t.eviCrop || r.ndviFill < t.ndviCrop))
                .evidence(r -> fmt("ndmi_fill=%.3f (wet>%.2f), precip_7d=%.1f (>%.1f), evi_fill=%.3f, ndvi_fill=%.3f",
                        r.ndmiFill, t.ndmiWet, r.precip7d, t.precipHigh7, r.eviFill, r.ndviFill))
                .intensity(Metric.NDMI_FILL, r -> r.ndmiFill - t.ndmiWet)
                .build();
    }

    static StressRule heatStress(AlertThresholds t) {
        return StressRule.builder(HEAT_STRESS, EventType.HEAT_STRESS)
                .inputs(Metric.TMEAN_7D, Metric.RH_7D, Metric.EVI_FILL, Metric.NDVI_SLOPE7)
                .when(r -> r.tmean7d >= t.heatTmean7
                        && r.rh7d <= t.heatRh7
                        && (r.eviFill < t.eviCrop || r.ndviSlope7 <= t.slope7Drop))
                .evidence(r -> fmt("tmean_7d=%.1f (>=%.1f), rh_7d=%.1f (<=%.1f), evi_fill=%.3f, ndvi_slope7=%.3f",
                        r.tmean7d, t.heatTmean7, r.rh7d, t.heatRh7, r.eviFill, r.ndviSlope7))
                .intensity(Metric.TMEAN_7D, r -> r.tmean7d - t.heatTmean7)
                .build();
    }

    static StressRule coldStress(AlertThresholds t) {
        return StressRule.builder(COLD_STRESS, EventType.COLD_STRESS)
                .inputs(Metric.TMIN_7D, Metric.EVI_FILL, Metric.NDVI_FILL, Metric.NDVI_SLOPE7)
                .when(r -> r.tmin7d <= t.coldTmin7
                        && (r.eviFill < t.coldEviLow || r.ndviFill < t.coldNdviLow || r.ndviSlope7 <= t.slope7Drop))
                .evidence(r -> fmt("tmin_7d=%.1f (<=%.1f), evi_fill=%.3f, ndvi_fill=%.3f, ndvi_slope7=%.3f",
                        r.tmin7d, t.coldTmin7, r.eviFill, r.ndviFill, r.ndviSlope7))
                .intensity(Metric.TMIN_7D, r -> t.coldTmin7 - r.tmin7d)
                .build();
    }

    static StressRule nutrientOrPest(AlertThresholds t) {
        return StressRule.builder(NUTRIENT_OR_PEST, EventType.NUTRIENT_OR_PEST)
                .inputs(Metric.NDRE_FILL, Metric.GNDVI_FILL, Metric.NDMI_FILL)
                .when(r -> (r.ndreFill < t.ndreLow || r.gndviFill < t.gndviLow) && r.ndmiFill >= t.ndmiDry)
                .evidence(r -> fmt("ndre_fill=%.3f (<%.2f), gndvi_fill=%.3f (<%.2f), ndmi_fill=%.3f (>=%.2f)",
                        r.ndreFill, t.ndreLow, r.gndviFill, t.gndviLow, r.ndmiFill, t.ndmiDry))
                .intensity(Metric.NDRE_FILL, r -> t.ndreLow - r.ndreFill)
                .intensity(Metric.GNDVI_FILL, r -> t.gndviLow - r.gndviFill)
                .build();
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.US, pattern, args);
    }
}
