package com.cropalert.config;

import com.cropalert.model.Indicator;
import com.cropalert.model.WeatherField;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Inputs that must be present and finite for a day to be classified at all.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class QcSettings {
    @Builder.Default
    public final List<WeatherField> requiredWeather = List.of(WeatherField.values());
    @Builder.Default
    public final List<Indicator> requiredIndicators = List.of(Indicator.NDVI, Indicator.EVI, Indicator.NDMI);

    public static QcSettings defaults() {
        return QcSettings.builder().build();
    }

    static QcSettings fromConfig(Config config) {
        List<WeatherField> weather = new ArrayList<>();
        for (String token : config.getList("qc.required_weather")) {
            weather.add(WeatherField.parse(token));
        }
        List<Indicator> indicators = new ArrayList<>();
        for (String token : config.getList("qc.required_indicators")) {
            indicators.add(Indicator.parse(token));
        }
        return new QcSettings(List.copyOf(weather), List.copyOf(indicators));
    }
}
