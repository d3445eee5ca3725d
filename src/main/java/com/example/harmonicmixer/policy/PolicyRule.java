package com.example.harmonicmixer.policy;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单条混音规则（不可变）
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PolicyRule {

    String id;

    String name;

    String description;

    /**
     * 缺省为 CUSTOM
     */
    @Builder.Default
    PolicyType policyType = PolicyType.CUSTOM;

    /**
     * 被评估的字段，例如 key / bpm / subgenre / danceability
     */
    String field;

    OperatorType operator;

    /**
     * 比较值：字符串、数值或列表
     */
    Object value;

    /**
     * 作用范围：track / transition / sequence / global
     */
    @Builder.Default
    String context = "track";

    @Builder.Default
    RulePriority priority = RulePriority.MEDIUM;

    @Builder.Default
    double weight = 1.0;

    @Builder.Default
    boolean enabled = true;

    /**
     * 数值比较容差；similar_to / compatible_with 用作相似度阈值
     */
    @Builder.Default
    double tolerance = 0.0;

    @Builder.Default
    boolean adaptive = false;

    @Builder.Default
    boolean timeSensitive = false;

    @Builder.Default
    String createdBy = MixingPolicy.SYSTEM;

    @Builder.Default
    List<String> tags = List.of();

    @Builder.Default
    String notes = "";

    PolicyRule(String id, String name, String description, PolicyType policyType, String field,
               OperatorType operator, Object value, String context, RulePriority priority, double weight,
               boolean enabled, double tolerance, boolean adaptive, boolean timeSensitive, String createdBy,
               List<String> tags, String notes) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.policyType = policyType != null ? policyType : PolicyType.CUSTOM;
        this.field = field;
        this.operator = operator;
        this.value = value instanceof List ? Collections.unmodifiableList(new ArrayList<>((List<?>) value)) : value;
        this.context = context;
        this.priority = priority != null ? priority : RulePriority.MEDIUM;
        this.weight = weight;
        this.enabled = enabled;
        this.tolerance = tolerance;
        this.adaptive = adaptive;
        this.timeSensitive = timeSensitive;
        this.createdBy = createdBy;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.notes = notes;
    }
}
