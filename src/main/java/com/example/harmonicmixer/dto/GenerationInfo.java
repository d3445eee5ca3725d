package com.example.harmonicmixer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 歌单生成统计
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationInfo {

    /**
     * 使用的生成算法（contextual_multi_factor / classic_greedy）
     */
    private String algorithm;

    /**
     * 使用的情境曲线名称
     */
    private String curveUsed;

    /**
     * 实际执行的选曲轮数
     */
    private int iterations;

    /**
     * 未达阈值而走兜底选择的次数
     */
    private int fallbackSelections;

    /**
     * 综合分 > 0.8 的选择次数
     */
    private int perfectMatches;

    /**
     * 情境分 < 0.4 的最佳候选次数
     */
    private int contextMismatches;

    /**
     * 是否被外部取消
     */
    private boolean cancelled;

    /**
     * 兜底比例 = 兜底次数 / 选曲轮数
     */
    public double getFallbackRate() {
        return iterations > 0 ? (double) fallbackSelections / iterations : 0.0;
    }
}
