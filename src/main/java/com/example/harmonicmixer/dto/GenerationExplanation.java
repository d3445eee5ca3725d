package com.example.harmonicmixer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 歌单生成过程说明
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationExplanation {

    private String curveName;

    private ContextType curveType;

    private CurveShape curveShape;

    private double minEnergy;

    private double maxEnergy;

    private int durationMinutes;

    private GenerationInfo stats;

    @Builder.Default
    private List<Double> energyProgression = new ArrayList<>();

    @Builder.Default
    private List<Double> trackScores = new ArrayList<>();

    private double averageScore;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();
}
