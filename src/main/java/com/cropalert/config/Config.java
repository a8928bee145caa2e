package com.cropalert.config;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：按 默认值 → classpath config.properties → 工作目录 config.properties → --config 文件 的顺序合并配置。
 * 使用建议：阈值与枚举在 {@link EngineSettings} 中一次性解析，业务代码不要直接散读键值。
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        return load(workingDir, null);
    }

/**
 * 方法说明：load，负责加载配置。
 * 处理流程：classpath 配置损坏时忽略；显式指定的配置文件不存在或读取失败时直接抛出异常。
 */
    public static Config load(Path workingDir, Path explicitFile) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            // broken classpath config falls back to built-in defaults
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        if (explicitFile != null) {
            Path file = workingDir.resolve(explicitFile).normalize();
            if (!Files.isRegularFile(file)) {
                throw new IllegalArgumentException("config file not found: " + file);
            }
            try (InputStream in = Files.newInputStream(file)) {
                Properties explicit = new Properties();
                explicit.load(in);
                config.overrideProps.putAll(explicit);
                config.props.putAll(explicit);
            } catch (IOException e) {
                throw new IllegalArgumentException("failed to read config file " + file + ": " + e.getMessage(), e);
            }
        }

        return config;
    }

    /**
     * Build Config from an in-memory (possibly nested) key/value map. Nested maps are flattened with dots.
     */
    public static Config fromMap(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    public static Config defaults(Path workingDir) {
        return new Config(workingDir);
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String raw = props.getProperty(key);
        if ((raw == null || raw.trim().isEmpty()) && !DEFAULTS.containsKey(key)) {
            return fallback;
        }
        return getBoolean(key);
    }

/**
 * 方法说明：requireInt，读取整数配置。
 * 处理流程：未配置时返回 fallback；配置了但无法解析时抛出 IllegalArgumentException，不静默回退。
 */
    public int requireInt(String key, int fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid integer for config " + key + ": " + value, e);
        }
    }

/**
 * 方法说明：requireDouble，读取浮点配置，规则同 {@link #requireInt(String, int)}。
 */
    public double requireDouble(String key, double fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            double parsed = Double.parseDouble(value);
            if (!Double.isFinite(parsed)) {
                throw new IllegalArgumentException("non-finite value for config " + key + ": " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid number for config " + key + ": " + value, e);
        }
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        String[] tokens = value.split("[,;]");
        for (String token : tokens) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public ResolvedValue resolve(String key) {
        return new ResolvedValue(
                key == null ? "" : key,
                getString(key),
                sourceOf(key)
        );
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        String local = nonBlank(overrideProps.getProperty(key));
        if (!local.isEmpty()) {
            return "override";
        }
        String resource = nonBlank(resourceProps.getProperty(key));
        if (!resource.isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        String t = raw.trim();
        return t.isEmpty() ? "" : t;
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (config == null || key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

/**
 * 方法说明：buildDefaults，内置默认值；classpath 与本地配置均可覆盖。
 */
    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("input.path", "data/processed/01_merged.csv");
        defaults.put("outputs.dir", "data/processed");
        defaults.put("outputs.debug_file", "02_rs_debug.csv");
        defaults.put("outputs.alerts_raw_file", "03_alerts_raw.csv");
        defaults.put("outputs.alerts_gated_file", "04_alerts_gated.csv");
        defaults.put("outputs.events_file", "05_events.csv");
        defaults.put("outputs.summary.enabled", "true");
        defaults.put("logs.dir", "logs");

        defaults.put("alerts.ndvi_crop", "0.45");
        defaults.put("alerts.evi_crop", "0.35");
        defaults.put("alerts.rs_max_age", "5");
        defaults.put("alerts.ndmi_dry", "0.20");
        defaults.put("alerts.msi_dry", "1.50");
        defaults.put("alerts.precip_low7", "15.0");
        defaults.put("alerts.ndmi_wet", "0.45");
        defaults.put("alerts.precip_high7", "60.0");
        defaults.put("alerts.heat_tmean7", "30.0");
        defaults.put("alerts.heat_rh7", "60.0");
        defaults.put("alerts.cold_tmin7", "3.0");
        defaults.put("alerts.cold_evi_low", "0.40");
        defaults.put("alerts.cold_ndvi_low", "0.50");
        defaults.put("alerts.ndre_low", "0.30");
        defaults.put("alerts.gndvi_low", "0.50");
        defaults.put("alerts.slope7_drop", "-0.03");
        defaults.put("alerts.merge_gap_days", "1");

        defaults.put("remote_sensing.window_mode", "symmetric");
        defaults.put("remote_sensing.support_pick", "prefer_past");

        defaults.put("gating.mode", "canopy_obs");
        defaults.put("gating.canopy_obs_min", "2");
        defaults.put("gating.months", "4,5,6,7,8,9,10");

        defaults.put("qc.required_weather", "precip_7d,tmean_7d,rh_7d,tmin_7d");
        defaults.put("qc.required_indicators", "ndvi,evi,ndmi");

        return Collections.unmodifiableMap(defaults);
    }

    public static final class ResolvedValue {
        public final String key;
        public final String value;
        public final String source;

        public ResolvedValue(String key, String value, String source) {
            this.key = key == null ? "" : key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }
    }
}
