package com.example.harmonicmixer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 兼容性解释：各维度原始分数、可读的过渡描述与建议
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompatibilityExplanation {

    private double overallScore;

    private HarmonicDetail harmonic;

    /**
     * 缺少任一方元数据时为 null
     */
    private StylisticDetail stylistic;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HarmonicDetail {
        private double score;
        private String keyMatch;
        private String bpmMatch;
        private String energyMatch;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StylisticDetail {
        private double score;
        private String subgenreMatch;
        private String moodMatch;
        private String eraMatch;
        private String languageMatch;

        @Builder.Default
        private Map<String, Double> breakdown = new LinkedHashMap<>();
    }
}
