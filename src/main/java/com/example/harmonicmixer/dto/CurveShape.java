package com.example.harmonicmixer.dto;

/**
 * 能量曲线形状
 */
public enum CurveShape {
    FLAT,        // 保持稳定
    ASCENDING,   // 逐步升高
    DESCENDING,  // 逐步降低
    PEAK,        // 先升后降
    VALLEY,      // 先降后升
    WAVE,        // 多个起伏
    BUILD_DROP   // 推到高潮后骤降
}
