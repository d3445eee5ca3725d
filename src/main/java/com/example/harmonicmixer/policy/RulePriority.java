package com.example.harmonicmixer.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 规则优先级及其在规则集聚合中的权重倍数
 */
public enum RulePriority {
    CRITICAL("critical", 3.0),      // 硬约束
    HIGH("high", 2.0),
    MEDIUM("medium", 1.0),
    LOW("low", 0.5),
    SUGGESTION("suggestion", 0.2);  // 可选提示

    private final String value;
    private final double multiplier;

    RulePriority(String value, double multiplier) {
        this.value = value;
        this.multiplier = multiplier;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getMultiplier() {
        return multiplier;
    }

    @JsonCreator
    public static RulePriority fromValue(String value) {
        for (RulePriority priority : values()) {
            if (priority.value.equals(value.toLowerCase(Locale.ROOT))) {
                return priority;
            }
        }
        throw new IllegalArgumentException("未知的优先级: " + value);
    }
}
