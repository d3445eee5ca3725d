package com.example.harmonicmixer.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 情境能量曲线定义（不可变，调整时长时返回副本）
 */
@Value
@Builder(toBuilder = true)
public class ContextualCurve {

    String name;

    ContextType contextType;

    String contextValue;

    CurveShape shape;

    /**
     * 能量区间的起点和终点（递减曲线的起点可以大于终点）
     */
    double energyFrom;

    double energyTo;

    int durationMinutes;

    @Builder.Default
    double peakPosition = 0.7;

    @Builder.Default
    double transitionSmoothness = 0.8;

    @Singular("moodPreference")
    List<String> moodPreferences;

    @Singular("activityPreference")
    List<String> activityPreferences;

    public double getMinEnergy() {
        return Math.min(energyFrom, energyTo);
    }

    public double getMaxEnergy() {
        return Math.max(energyFrom, energyTo);
    }

    public ContextualCurve withDurationMinutes(int minutes) {
        return toBuilder().durationMinutes(minutes).build();
    }
}
