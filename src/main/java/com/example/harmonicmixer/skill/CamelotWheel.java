package com.example.harmonicmixer.skill;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Camelot 调性轮工具
 *
 * 调性格式：<1-12><A|B>，A 为小调，B 为大调
 */
public final class CamelotWheel {

    private static final Pattern KEY_PATTERN = Pattern.compile("^(1[0-2]|[1-9])([AB])$");

    private static final int WHEEL_SIZE = 12;

    private CamelotWheel() {
    }

    public static boolean isValid(String key) {
        return key != null && KEY_PATTERN.matcher(key).matches();
    }

    public static int number(String key) {
        return Integer.parseInt(parse(key).group(1));
    }

    public static char letter(String key) {
        return parse(key).group(2).charAt(0);
    }

    /**
     * 兼容调：自身、轮上相邻两个、同号关系大小调，共 4 个；非法调性返回空列表
     */
    public static List<String> compatibleKeys(String key) {
        if (!isValid(key)) {
            return List.of();
        }
        int n = number(key);
        char l = letter(key);
        int prev = n == 1 ? WHEEL_SIZE : n - 1;
        int next = n == WHEEL_SIZE ? 1 : n + 1;
        char relative = l == 'A' ? 'B' : 'A';
        return List.of(key, prev + String.valueOf(l), next + String.valueOf(l), n + String.valueOf(relative));
    }

    /**
     * 轮上距离（0-6）
     */
    public static int distance(String key1, String key2) {
        int diff = Math.abs(number(key1) - number(key2));
        return Math.min(diff, WHEEL_SIZE - diff);
    }

    private static Matcher parse(String key) {
        Matcher m = key == null ? null : KEY_PATTERN.matcher(key);
        if (m == null || !m.matches()) {
            throw new IllegalArgumentException("非法的 Camelot 调性: " + key);
        }
        return m;
    }
}
