package com.cropalert.model;

/**
 * 模块说明：EventType（enum）。
 * 主要职责：作物胁迫事件类型；COMPOSITE 表示同一天命中两条及以上规则。
 */
public enum EventType {
    DROUGHT("drought"),
    WATERLOGGING("waterlogging"),
    HEAT_STRESS("heat_stress"),
    COLD_STRESS("cold_stress"),
    NUTRIENT_OR_PEST("nutrient_or_pest"),
    COMPOSITE("composite");

    private final String code;

    EventType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static EventType fromCode(String code) {
        for (EventType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown event type: " + code);
    }
}
