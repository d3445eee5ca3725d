package com.example.harmonicmixer.policy;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * policies.json 的文件结构：{ "policies": [...], "rule_sets": [...] }
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PolicyDocument {

    private List<MixingPolicy> policies = new ArrayList<>();

    private List<PolicyRuleSet> ruleSets = new ArrayList<>();
}
