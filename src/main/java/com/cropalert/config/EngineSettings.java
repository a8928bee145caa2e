package com.cropalert.config;

import com.cropalert.model.Indicator;
import com.cropalert.model.WeatherField;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 模块说明：EngineSettings（class）。
 * 主要职责：把 Config 中的阈值、窗口、门控与 QC 配置一次性解析为强类型对象；未知枚举值在此处直接失败。
 * 使用建议：引擎只依赖本类型，不再读取原始键值。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class EngineSettings {
    @Builder.Default
    public final AlertThresholds thresholds = AlertThresholds.defaults();
    @Builder.Default
    public final WindowSettings window = WindowSettings.defaults();
    @Builder.Default
    public final GatingSettings gating = GatingSettings.defaults();
    @Builder.Default
    public final QcSettings qc = QcSettings.defaults();
    /** Optional inclusive report range used by the stage summaries; null means unbounded. */
    public final LocalDate reportStart;
    public final LocalDate reportEnd;

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }

    public static EngineSettings fromConfig(Config config) {
        AlertThresholds thresholds = AlertThresholds.fromConfig(config);
        LocalDate reportStart = parseDate(config, "period.report_start");
        LocalDate reportEnd = parseDate(config, "period.report_end");
        if (reportStart != null && reportEnd != null && reportStart.isAfter(reportEnd)) {
            throw new IllegalArgumentException("period.report_start must be <= period.report_end");
        }
        return new EngineSettings(
                thresholds,
                WindowSettings.fromConfig(config, thresholds),
                GatingSettings.fromConfig(config, thresholds),
                QcSettings.fromConfig(config),
                reportStart,
                reportEnd
        );
    }

    public boolean inReportRange(LocalDate date) {
        if (date == null) {
            return false;
        }
        if (reportStart != null && date.isBefore(reportStart)) {
            return false;
        }
        return reportEnd == null || !date.isAfter(reportEnd);
    }

    /**
     * Flat view of every setting in effect, keyed like the configuration file.
     */
    public Map<String, Object> describe() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ndvi_crop", thresholds.ndviCrop);
        out.put("evi_crop", thresholds.eviCrop);
        out.put("rs_max_age", thresholds.rsMaxAge);
        out.put("ndmi_dry", thresholds.ndmiDry);
        out.put("msi_dry", thresholds.msiDry);
        out.put("precip_low7", thresholds.precipLow7);
        out.put("ndmi_wet", thresholds.ndmiWet);
        out.put("precip_high7", thresholds.precipHigh7);
        out.put("heat_tmean7", thresholds.heatTmean7);
        out.put("heat_rh7", thresholds.heatRh7);
        out.put("cold_tmin7", thresholds.coldTmin7);
        out.put("cold_evi_low", thresholds.coldEviLow);
        out.put("cold_ndvi_low", thresholds.coldNdviLow);
        out.put("ndre_low", thresholds.ndreLow);
        out.put("gndvi_low", thresholds.gndviLow);
        out.put("slope7_drop", thresholds.slope7Drop);
        out.put("merge_gap_days", thresholds.mergeGapDays);
        out.put("remote_sensing.window_half_days", window.halfDays);
        out.put("remote_sensing.window_mode", window.mode.code());
        out.put("remote_sensing.support_pick", window.pick.code());
        out.put("gating.mode", gating.mode.code());
        out.put("gating.months", new ArrayList<>(new TreeSet<>(gating.months)));
        out.put("gating.canopy_obs_min", gating.canopyObsMin);
        out.put("gating.canopy_ndvi_min", gating.canopyNdviMin);
        out.put("gating.canopy_evi_min", gating.canopyEviMin);
        List<String> weather = new ArrayList<>();
        for (WeatherField field : qc.requiredWeather) {
            weather.add(field.column());
        }
        List<String> indicators = new ArrayList<>();
        for (Indicator indicator : qc.requiredIndicators) {
            indicators.add(indicator.key());
        }
        out.put("qc.required_weather", weather);
        out.put("qc.required_indicators", indicators);
        return out;
    }

    private static LocalDate parseDate(Config config, String key) {
        String raw = config.getString(key);
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid date for " + key + ": " + raw, e);
        }
    }
}
