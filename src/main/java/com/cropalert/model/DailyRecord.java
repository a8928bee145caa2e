package com.cropalert.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One calendar day after column resolution. Missing values are {@code NaN}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class DailyRecord {
    public final LocalDate date;

    @Builder.Default
    public final double ndviObs = Double.NaN;
    @Builder.Default
    public final double ndviFill = Double.NaN;
    @Builder.Default
    public final double eviObs = Double.NaN;
    @Builder.Default
    public final double eviFill = Double.NaN;
    @Builder.Default
    public final double ndmiObs = Double.NaN;
    @Builder.Default
    public final double ndmiFill = Double.NaN;
    @Builder.Default
    public final double ndreObs = Double.NaN;
    @Builder.Default
    public final double ndreFill = Double.NaN;
    @Builder.Default
    public final double gndviObs = Double.NaN;
    @Builder.Default
    public final double gndviFill = Double.NaN;
    @Builder.Default
    public final double msiObs = Double.NaN;
    @Builder.Default
    public final double msiFill = Double.NaN;

    @Builder.Default
    public final double precip7d = Double.NaN;
    @Builder.Default
    public final double tmean7d = Double.NaN;
    @Builder.Default
    public final double rh7d = Double.NaN;
    @Builder.Default
    public final double tmin7d = Double.NaN;
    @Builder.Default
    public final double ndviSlope7 = Double.NaN;

    public double obs(Indicator indicator) {
        switch (indicator) {
            case NDVI:
                return ndviObs;
            case EVI:
                return eviObs;
            case NDMI:
                return ndmiObs;
            case NDRE:
                return ndreObs;
            case GNDVI:
                return gndviObs;
            case MSI:
                return msiObs;
            default:
                throw new IllegalArgumentException("unsupported indicator: " + indicator);
        }
    }

    public double fill(Indicator indicator) {
        switch (indicator) {
            case NDVI:
                return ndviFill;
            case EVI:
                return eviFill;
            case NDMI:
                return ndmiFill;
            case NDRE:
                return ndreFill;
            case GNDVI:
                return gndviFill;
            case MSI:
                return msiFill;
            default:
                throw new IllegalArgumentException("unsupported indicator: " + indicator);
        }
    }

    public double weather(WeatherField field) {
        switch (field) {
            case PRECIP_7D:
                return precip7d;
            case TMEAN_7D:
                return tmean7d;
            case RH_7D:
                return rh7d;
            case TMIN_7D:
                return tmin7d;
            default:
                throw new IllegalArgumentException("unsupported weather field: " + field);
        }
    }

    /**
     * True when at least one indicator carries a finite observed value on this date.
     */
    public boolean realObservation() {
        for (Indicator indicator : Indicator.values()) {
            if (Double.isFinite(obs(indicator))) {
                return true;
            }
        }
        return false;
    }
}
