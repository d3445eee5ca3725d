package com.example.harmonicmixer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 两首曲目之间的一次候选过渡
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MixTransition {

    private Track from;

    private Track to;

    private TransitionPoint mixOutPoint;

    private TransitionPoint mixInPoint;

    private double compatibilityScore;

    private double transitionQuality;

    /**
     * 预估混音时长（秒，8-32）
     */
    private double estimatedMixDuration;
}
