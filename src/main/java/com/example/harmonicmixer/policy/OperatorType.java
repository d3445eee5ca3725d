package com.example.harmonicmixer.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 规则比较运算符
 */
public enum OperatorType {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    GREATER_EQUAL("greater_equal"),
    LESS_EQUAL("less_equal"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    IN_LIST("in_list"),
    NOT_IN_LIST("not_in_list"),
    SIMILAR_TO("similar_to"),
    COMPATIBLE_WITH("compatible_with"),
    WITHIN_RANGE("within_range"),
    MATCHES_PATTERN("matches_pattern");

    private final String value;

    OperatorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static OperatorType fromValue(String value) {
        for (OperatorType operator : values()) {
            if (operator.value.equals(value.toLowerCase(Locale.ROOT))) {
                return operator;
            }
        }
        throw new IllegalArgumentException("未知的运算符: " + value);
    }
}
