package com.example.harmonicmixer.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Locale;

/**
 * 策略规则类型；作为 globalWeights 的 Map 键时同样以小写字符串读写
 */
@JsonSerialize(keyUsing = PolicyTypeKeySerializer.class)
@JsonDeserialize(keyUsing = PolicyTypeKeyDeserializer.class)
public enum PolicyType {
    HARMONIC("harmonic"),       // 调性
    ENERGY("energy"),           // 能量走向
    STYLISTIC("stylistic"),     // 流派/风格
    TEMPORAL("temporal"),       // 年代
    LINGUISTIC("linguistic"),   // 语言
    CONTEXTUAL("contextual"),   // 活动/情绪
    QUALITY("quality"),         // 音质/可舞性
    DIVERSITY("diversity"),     // 多样性
    NARRATIVE("narrative"),     // 叙事
    CUSTOM("custom");           // 用户自定义

    private final String value;

    PolicyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PolicyType fromValue(String value) {
        for (PolicyType type : values()) {
            if (type.value.equals(value.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的策略类型: " + value);
    }
}
