package com.example.harmonicmixer.skill;

import com.example.harmonicmixer.dto.StyleProfile;

import java.util.function.Function;

/**
 * 查表型风格维度：表名、聚合权重、从风格画像取值的方式
 */
public enum StyleDimension {
    SUBGENRE("subgenre", 0.25, StyleProfile::getSubgenre, true),
    MOOD("mood", 0.2, StyleProfile::getMood, true),
    ERA("era", 0.15, StyleProfile::getEra, true),
    LANGUAGE("language", 0.1, StyleProfile::getLanguage, true),
    ACTIVITY("activity", 0.1, StyleProfile::getActivity, true),
    TIME_OF_DAY("time_of_day", 0.1, StyleProfile::getTimeOfDay, true),
    // 季节参与总分，但不出现在分维度明细中
    SEASON("season", 0.05, StyleProfile::getSeason, false);

    private final String tableName;
    private final double weight;
    private final Function<StyleProfile, String> accessor;
    private final boolean inBreakdown;

    StyleDimension(String tableName, double weight, Function<StyleProfile, String> accessor, boolean inBreakdown) {
        this.tableName = tableName;
        this.weight = weight;
        this.accessor = accessor;
        this.inBreakdown = inBreakdown;
    }

    public String getTableName() {
        return tableName;
    }

    public double getWeight() {
        return weight;
    }

    public String valueOf(StyleProfile profile) {
        return accessor.apply(profile);
    }

    public boolean isInBreakdown() {
        return inBreakdown;
    }
}
