package com.example.harmonicmixer.policy;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 一组相关规则
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PolicyRuleSet {

    String id;

    String name;

    String description;

    @Builder.Default
    List<PolicyRule> rules = List.of();

    /**
     * 目前只支持 weighted_sum
     */
    @Builder.Default
    String combinationMode = "weighted_sum";

    @Builder.Default
    double minimumScore = 0.6;

    @Builder.Default
    String version = "1.0";

    @Builder.Default
    String createdBy = MixingPolicy.SYSTEM;

    @Builder.Default
    List<String> tags = List.of();

    @Builder.Default
    boolean enabled = true;

    PolicyRuleSet(String id, String name, String description, List<PolicyRule> rules,
                  String combinationMode, double minimumScore, String version, String createdBy,
                  List<String> tags, boolean enabled) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.combinationMode = combinationMode;
        this.minimumScore = minimumScore;
        this.version = version;
        this.createdBy = createdBy;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.enabled = enabled;
    }

    /**
     * 规则集的类型取第一条规则的类型，空规则集为 CUSTOM
     */
    public PolicyType leadingType() {
        return rules.isEmpty() ? PolicyType.CUSTOM : rules.get(0).getPolicyType();
    }
}
