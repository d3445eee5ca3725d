package com.example.harmonicmixer.policy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单条规则对单首曲目的评估结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyEvaluationResult {

    private String ruleId;

    private String ruleName;

    private boolean satisfied;

    /**
     * 0-1，未满足时可能有部分得分
     */
    private double score;

    private Object expectedValue;

    private Object actualValue;

    private String message;

    private double weight;

    private RulePriority priority;
}
