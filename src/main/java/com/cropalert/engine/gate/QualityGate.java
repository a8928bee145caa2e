package com.cropalert.engine.gate;

import com.cropalert.config.QcSettings;
import com.cropalert.engine.support.SupportWindow;
import com.cropalert.model.DailyRecord;
import com.cropalert.model.Indicator;
import com.cropalert.model.WeatherField;

/**
 * 模块说明：QualityGate（class）。
 * 主要职责：判断某日数据是否足以参与分类；失败原因按 missing_remote > missing_weather > nonfinite 的优先级归因。
 */
public final class QualityGate {
    private final QcSettings settings;

    public QualityGate(QcSettings settings) {
        this.settings = settings == null ? QcSettings.defaults() : settings;
    }

    public QcDecision evaluate(DailyRecord record, SupportWindow support) {
        boolean missingRemote = support == null || !support.windowOk;
        boolean missingWeather = false;
        boolean nonfinite = false;
        for (WeatherField field : settings.requiredWeather) {
            double value = record.weather(field);
            if (Double.isNaN(value)) {
                missingWeather = true;
            }
            if (!Double.isFinite(value)) {
                nonfinite = true;
            }
        }
        for (Indicator indicator : settings.requiredIndicators) {
            if (!Double.isFinite(record.fill(indicator))) {
                nonfinite = true;
            }
        }
        return new QcDecision(missingRemote, missingWeather, nonfinite);
    }
}
