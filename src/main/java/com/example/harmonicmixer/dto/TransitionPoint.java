package com.example.harmonicmixer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 过渡点（由外部音频分析流水线产出）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransitionPoint {

    private double timeSeconds;

    private double confidence;

    private StructuralElement elementType;

    private double energyLevel;

    private double beatStrength;

    /**
     * 作为混音点的适合度（0-1）
     */
    private double mixSuitability;
}
