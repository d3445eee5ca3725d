package com.example.harmonicmixer.skill;

/**
 * 风格兼容等级
 */
public enum CompatibilityLevel {
    PERFECT(1.0),       // 同一风格
    EXCELLENT(0.9),     // 高度兼容
    GOOD(0.7),          // 稍作调整即可
    FAIR(0.5),          // 可用但差异明显
    POOR(0.3),          // 过渡困难
    INCOMPATIBLE(0.1);  // 应避免

    private final double score;

    CompatibilityLevel(double score) {
        this.score = score;
    }

    public double getScore() {
        return score;
    }
}
