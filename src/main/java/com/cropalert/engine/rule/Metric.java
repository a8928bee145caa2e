package com.cropalert.engine.rule;

import com.cropalert.model.DailyRecord;

import java.util.function.ToDoubleFunction;

/**
 * Canonical daily metrics a rule can reference, named as they appear in the output tables.
 */
public enum Metric {
    NDVI_FILL("ndvi_fill", r -> r.ndviFill),
    EVI_FILL("evi_fill", r -> r.eviFill),
    NDMI_FILL("ndmi_fill", r -> r.ndmiFill),
    NDRE_FILL("ndre_fill", r -> r.ndreFill),
    GNDVI_FILL("gndvi_fill", r -> r.gndviFill),
    MSI_FILL("msi_fill", r -> r.msiFill),
    PRECIP_7D("precip_7d", r -> r.precip7d),
    TMEAN_7D("tmean_7d", r -> r.tmean7d),
    RH_7D("rh_7d", r -> r.rh7d),
    TMIN_7D("tmin_7d", r -> r.tmin7d),
    NDVI_SLOPE7("ndvi_slope7", r -> r.ndviSlope7);

    private final String column;
    private final ToDoubleFunction<DailyRecord> accessor;

    Metric(String column, ToDoubleFunction<DailyRecord> accessor) {
        this.column = column;
        this.accessor = accessor;
    }

    public String column() {
        return column;
    }

    public double of(DailyRecord record) {
        return accessor.applyAsDouble(record);
    }
}
