package com.example.harmonicmixer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 结构分析结果（外部输入，本模块只读取）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructuralAnalysis {

    private String trackId;

    /**
     * 时长（秒）
     */
    private double duration;

    /**
     * 前奏结束位置（秒，可为空）
     */
    private Double introEnd;

    /**
     * 尾奏开始位置（秒，可为空）
     */
    private Double outroStart;

    /**
     * 按适合度排好序的过渡点
     */
    @Builder.Default
    private List<TransitionPoint> transitionPoints = new ArrayList<>();

    /**
     * 节拍时间点（秒，升序）
     */
    @Builder.Default
    private List<Double> beatGrid = new ArrayList<>();

    @Builder.Default
    private List<TempoChange> tempoChanges = new ArrayList<>();

    @Builder.Default
    private List<EnergySample> energyCurve = new ArrayList<>();
}
