package com.cropalert.engine.metric;

import com.cropalert.model.DailyRecord;
import com.cropalert.model.DailyTable;
import com.cropalert.model.Indicator;
import com.cropalert.model.WeatherField;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：MetricResolver（class）。
 * 主要职责：按声明的别名表把输入表的原始列映射为规范指标，生成不可变的 {@link DailyRecord} 序列。
 * 实现要点：每个规范列只在加载时解析一次来源列；ndvi_slope7 缺列时按 7 个日历日差分推导。
 */
public final class MetricResolver {
    private static final Logger LOG = LogManager.getLogger(MetricResolver.class);

    public static final String SLOPE_COLUMN = "ndvi_slope7";
    public static final int SLOPE_LAG_DAYS = 7;

    public List<String> obsAliases(Indicator indicator) {
        return List.of(indicator.obsColumn(), indicator.key() + "_mean");
    }

    public List<String> fillAliases(Indicator indicator) {
        return List.of(
                indicator.fillColumn(),
                indicator.key() + "_mean_daily",
                indicator.key() + "_mean",
                indicator.obsColumn()
        );
    }

    /**
     * Canonical column name to the source column chosen for it, or empty when nothing matched.
     * {@code ndvi_slope7} maps to {@code derived} when computed from the filled NDVI.
     */
    public Map<String, String> describeSources(DailyTable table) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Indicator indicator : Indicator.values()) {
            out.put(indicator.obsColumn(), blankIfNull(firstPresent(table, obsAliases(indicator))));
            out.put(indicator.fillColumn(), blankIfNull(firstPresent(table, fillAliases(indicator))));
        }
        for (WeatherField field : WeatherField.values()) {
            out.put(field.column(), table.hasColumn(field.column()) ? field.column() : "");
        }
        out.put(SLOPE_COLUMN, table.hasColumn(SLOPE_COLUMN) ? SLOPE_COLUMN : "derived");
        return out;
    }

    public List<DailyRecord> resolve(DailyTable table) {
        Map<Indicator, String> obsSources = new EnumMap<>(Indicator.class);
        Map<Indicator, String> fillSources = new EnumMap<>(Indicator.class);
        for (Indicator indicator : Indicator.values()) {
            obsSources.put(indicator, firstPresent(table, obsAliases(indicator)));
            fillSources.put(indicator, firstPresent(table, fillAliases(indicator)));
            if (fillSources.get(indicator) == null) {
                LOG.warn("no source column for {}; values treated as missing", indicator.key());
            }
        }
        boolean slopeFromColumn = table.hasColumn(SLOPE_COLUMN);
        if (LOG.isDebugEnabled()) {
            LOG.debug("metric sources: {}", describeSources(table));
        }

        List<DailyRecord> records = new ArrayList<>(table.size());
        for (int row = 0; row < table.size(); row++) {
            records.add(DailyRecord.builder()
                    .date(table.dates().get(row))
                    .ndviObs(read(table, obsSources.get(Indicator.NDVI), row))
                    .ndviFill(read(table, fillSources.get(Indicator.NDVI), row))
                    .eviObs(read(table, obsSources.get(Indicator.EVI), row))
                    .eviFill(read(table, fillSources.get(Indicator.EVI), row))
                    .ndmiObs(read(table, obsSources.get(Indicator.NDMI), row))
                    .ndmiFill(read(table, fillSources.get(Indicator.NDMI), row))
                    .ndreObs(read(table, obsSources.get(Indicator.NDRE), row))
                    .ndreFill(read(table, fillSources.get(Indicator.NDRE), row))
                    .gndviObs(read(table, obsSources.get(Indicator.GNDVI), row))
                    .gndviFill(read(table, fillSources.get(Indicator.GNDVI), row))
                    .msiObs(read(table, obsSources.get(Indicator.MSI), row))
                    .msiFill(read(table, fillSources.get(Indicator.MSI), row))
                    .precip7d(table.value(WeatherField.PRECIP_7D.column(), row))
                    .tmean7d(table.value(WeatherField.TMEAN_7D.column(), row))
                    .rh7d(table.value(WeatherField.RH_7D.column(), row))
                    .tmin7d(table.value(WeatherField.TMIN_7D.column(), row))
                    .ndviSlope7(slopeFromColumn ? table.value(SLOPE_COLUMN, row) : Double.NaN)
                    .build());
        }
        if (!slopeFromColumn) {
            records = withDerivedSlope(records);
        }
        LOG.info("resolved {} daily records (slope7 {})", records.size(), slopeFromColumn ? "from column" : "derived");
        return Collections.unmodifiableList(records);
    }

    private List<DailyRecord> withDerivedSlope(List<DailyRecord> records) {
        Map<LocalDate, Double> fillByDate = new HashMap<>();
        for (DailyRecord record : records) {
            fillByDate.put(record.date, record.ndviFill);
        }
        List<DailyRecord> out = new ArrayList<>(records.size());
        for (DailyRecord record : records) {
            Double earlier = fillByDate.get(record.date.minusDays(SLOPE_LAG_DAYS));
            double slope = earlier == null ? Double.NaN : record.ndviFill - earlier;
            out.add(record.toBuilder().ndviSlope7(slope).build());
        }
        return out;
    }

    private static String firstPresent(DailyTable table, List<String> aliases) {
        for (String alias : aliases) {
            if (table.hasColumn(alias)) {
                return alias;
            }
        }
        return null;
    }

    private static double read(DailyTable table, String column, int row) {
        return column == null ? Double.NaN : table.value(column, row);
    }

    private static String blankIfNull(String value) {
        return value == null ? "" : value;
    }
}
