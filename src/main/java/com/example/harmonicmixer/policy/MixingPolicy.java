package com.example.harmonicmixer.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * 完整的混音策略（不可变，修改通过 toBuilder 生成新实例）
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MixingPolicy {

    public static final String SYSTEM = "system";
    public static final String USER = "user";

    String id;

    String name;

    String description;

    @Builder.Default
    String version = "1.0";

    @Builder.Default
    List<PolicyRuleSet> ruleSets = List.of();

    /**
     * 各策略类型的全局权重，未配置的类型按 1.0 计
     */
    @Builder.Default
    Map<PolicyType, Double> globalWeights = Map.of();

    @Builder.Default
    String optimizationObjective = "balanced";

    @Builder.Default
    String fallbackStrategy = "greedy";

    @Builder.Default
    boolean strictMode = false;

    @Builder.Default
    boolean adaptiveWeights = true;

    @Builder.Default
    String createdBy = USER;

    @Builder.Default
    String createdAt = "";

    @Builder.Default
    String lastModified = "";

    @Builder.Default
    int usageCount = 0;

    @Builder.Default
    List<String> tags = List.of();

    /**
     * 集合字段在构造时复制为只读副本，实例构造后不可修改，可并发读取
     */
    MixingPolicy(String id, String name, String description, String version,
                 List<PolicyRuleSet> ruleSets, Map<PolicyType, Double> globalWeights,
                 String optimizationObjective, String fallbackStrategy, boolean strictMode,
                 boolean adaptiveWeights, String createdBy, String createdAt, String lastModified,
                 int usageCount, List<String> tags) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.version = version;
        this.ruleSets = ruleSets == null ? List.of() : List.copyOf(ruleSets);
        this.globalWeights = globalWeights == null ? Map.of() : Map.copyOf(globalWeights);
        this.optimizationObjective = optimizationObjective;
        this.fallbackStrategy = fallbackStrategy;
        this.strictMode = strictMode;
        this.adaptiveWeights = adaptiveWeights;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.lastModified = lastModified;
        this.usageCount = usageCount;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * 未配置的类型（含缺失类型）按 1.0 计
     */
    public double globalWeight(PolicyType type) {
        if (type == null) {
            return 1.0;
        }
        return globalWeights.getOrDefault(type, 1.0);
    }

    @JsonIgnore
    public boolean isUserDefined() {
        return !SYSTEM.equals(createdBy);
    }
}
