package com.example.harmonicmixer.policy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 整个策略应用到单首曲目的结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyApplicationResult {

    private String policyId;

    private double totalScore;

    @Builder.Default
    private List<PolicyEvaluationResult> ruleResults = new ArrayList<>();

    /**
     * 规则集 ID -> 规则集得分
     */
    @Builder.Default
    private Map<String, Double> ruleSetScores = new LinkedHashMap<>();

    @Builder.Default
    private boolean satisfiedCriticalRules = true;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
