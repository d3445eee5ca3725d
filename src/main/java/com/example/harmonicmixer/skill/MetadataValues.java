package com.example.harmonicmixer.skill;

import java.util.Locale;
import java.util.Map;

/**
 * LLM 元数据取值与归一化
 *
 * 百分比可以是 0-1 的数值、0-100 的数值或以 % 结尾的字符串，统一归一化到 0-1。
 */
public final class MetadataValues {

    private static final String PLACEHOLDER = "-";

    private MetadataValues() {
    }

    /**
     * 字符串归一化：小写 + 去空白；空串与 "-" 视为缺失
     */
    public static String normalizeString(Object value) {
        if (!(value instanceof String)) {
            return null;
        }
        String s = (String) value;
        if (s.isEmpty() || PLACEHOLDER.equals(s)) {
            return null;
        }
        String normalized = s.toLowerCase(Locale.ROOT).trim();
        return normalized.isEmpty() ? null : normalized;
    }

    /**
     * 百分比归一化到 0-1；不带 % 的数值（含数值字符串）大于 1 时按 0-100 处理。
     * null、0、空串、"-" 与无法解析的值返回 null，结果截断到 [0, 1]
     */
    public static Double normalizePercentage(Object value) {
        if (value == null || PLACEHOLDER.equals(value)) {
            return null;
        }
        if (value instanceof String) {
            String s = ((String) value).trim();
            if (s.isEmpty()) {
                return null;
            }
            try {
                if (s.endsWith("%")) {
                    return clamp(Double.parseDouble(s.substring(0, s.length() - 1).trim()) / 100.0);
                }
                return scale(Double.parseDouble(s));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (value instanceof Number) {
            return scale(((Number) value).doubleValue());
        }
        return null;
    }

    private static Double scale(double d) {
        if (d == 0.0 || Double.isNaN(d)) {
            return null;
        }
        return clamp(d > 1.0 ? d / 100.0 : d);
    }

    private static double clamp(double d) {
        return Math.max(0.0, Math.min(1.0, d));
    }

    public static String string(Map<String, Object> metadata, String field) {
        return metadata == null ? null : normalizeString(metadata.get(field));
    }

    public static Double percentage(Map<String, Object> metadata, String field) {
        return metadata == null ? null : normalizePercentage(metadata.get(field));
    }
}
