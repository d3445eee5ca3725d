package com.example.harmonicmixer.policy;

import java.util.List;
import java.util.Map;

/**
 * 内置规则集与策略
 */
public final class BuiltinPolicies {

    public static final PolicyRuleSet CLASSIC_HARMONIC = PolicyRuleSet.builder()
        .id("classic_harmonic")
        .name("Classic Harmonic Mixing")
        .description("基于 Camelot 调性轮的传统和声混音规则")
        .rules(List.of(
            PolicyRule.builder()
                .id("key_compatibility")
                .name("Key Compatibility")
                .description("曲目应处于兼容调性")
                .policyType(PolicyType.HARMONIC)
                .field("key")
                .operator(OperatorType.COMPATIBLE_WITH)
                .value("adjacent_camelot")
                .priority(RulePriority.HIGH)
                .weight(2.0)
                .build(),
            PolicyRule.builder()
                .id("bpm_proximity")
                .name("BPM Proximity")
                .description("BPM 应在 ±10% 范围内")
                .policyType(PolicyType.ENERGY)
                .field("bpm")
                .operator(OperatorType.WITHIN_RANGE)
                .value(List.of(0.9, 1.1))
                .priority(RulePriority.MEDIUM)
                .weight(1.5)
                .tolerance(5.0)
                .build()))
        .build();

    public static final PolicyRuleSet AI_STYLISTIC = PolicyRuleSet.builder()
        .id("ai_stylistic")
        .name("AI-Enhanced Stylistic Matching")
        .description("基于 LLM 元数据的风格兼容规则")
        .rules(List.of(
            PolicyRule.builder()
                .id("subgenre_compatibility")
                .name("Subgenre Compatibility")
                .description("子流派应相互兼容")
                .policyType(PolicyType.STYLISTIC)
                .field("subgenre")
                .operator(OperatorType.SIMILAR_TO)
                .value("compatible_subgenres")
                .priority(RulePriority.HIGH)
                .weight(1.8)
                .build(),
            PolicyRule.builder()
                .id("mood_progression")
                .name("Mood Progression")
                .description("情绪应形成良好的递进")
                .policyType(PolicyType.STYLISTIC)
                .field("mood")
                .operator(OperatorType.COMPATIBLE_WITH)
                .value("mood_transitions")
                .priority(RulePriority.MEDIUM)
                .weight(1.3)
                .build(),
            PolicyRule.builder()
                .id("high_danceability")
                .name("High Danceability")
                .description("派对场景保持高可舞性")
                .policyType(PolicyType.QUALITY)
                .field("danceability")
                .operator(OperatorType.GREATER_EQUAL)
                .value(0.7)
                .priority(RulePriority.MEDIUM)
                .weight(1.2)
                .adaptive(true)
                .build()))
        .build();

    public static final PolicyRuleSet CULTURAL_JOURNEY_RULES = PolicyRuleSet.builder()
        .id("cultural_journey")
        .name("Cultural Journey Rules")
        .description("跨文化音乐旅程规则")
        .rules(List.of(
            PolicyRule.builder()
                .id("language_bridges")
                .name("Language Bridges")
                .description("用器乐曲桥接不同语言")
                .policyType(PolicyType.LINGUISTIC)
                .field("language")
                .operator(OperatorType.IN_LIST)
                .value(List.of("instrumental", "spanish", "english"))
                .priority(RulePriority.MEDIUM)
                .weight(1.0)
                .build(),
            PolicyRule.builder()
                .id("era_progression")
                .name("Era Progression")
                .description("年代递进保持合理")
                .policyType(PolicyType.TEMPORAL)
                .field("era")
                .operator(OperatorType.COMPATIBLE_WITH)
                .value("era_transitions")
                .priority(RulePriority.LOW)
                .weight(0.8)
                .build()))
        .build();

    public static final MixingPolicy CLASSIC_DJ = MixingPolicy.builder()
        .id("classic_dj")
        .name("Classic DJ Mixing")
        .description("传统和声混音")
        .ruleSets(List.of(CLASSIC_HARMONIC))
        .globalWeights(Map.of(
            PolicyType.HARMONIC, 0.6,
            PolicyType.ENERGY, 0.3,
            PolicyType.STYLISTIC, 0.1))
        .createdBy(MixingPolicy.SYSTEM)
        .build();

    public static final MixingPolicy MODERN_AI = MixingPolicy.builder()
        .id("modern_ai")
        .name("Modern AI Mixing")
        .description("结合 LLM 元数据的智能混音")
        .ruleSets(List.of(CLASSIC_HARMONIC, AI_STYLISTIC))
        .globalWeights(Map.of(
            PolicyType.HARMONIC, 0.3,
            PolicyType.STYLISTIC, 0.4,
            PolicyType.ENERGY, 0.2,
            PolicyType.QUALITY, 0.1))
        .adaptiveWeights(true)
        .createdBy(MixingPolicy.SYSTEM)
        .build();

    public static final MixingPolicy CULTURAL_JOURNEY = MixingPolicy.builder()
        .id("cultural_journey")
        .name("Cultural Journey")
        .description("跨文化混音与智能过渡")
        .ruleSets(List.of(CULTURAL_JOURNEY_RULES))
        .globalWeights(Map.of(
            PolicyType.LINGUISTIC, 0.4,
            PolicyType.TEMPORAL, 0.3,
            PolicyType.HARMONIC, 0.2,
            PolicyType.STYLISTIC, 0.1))
        .createdBy(MixingPolicy.SYSTEM)
        .build();

    private BuiltinPolicies() {
    }

    public static List<MixingPolicy> policies() {
        return List.of(CLASSIC_DJ, MODERN_AI, CULTURAL_JOURNEY);
    }

    public static List<PolicyRuleSet> ruleSets() {
        return List.of(CLASSIC_HARMONIC, AI_STYLISTIC, CULTURAL_JOURNEY_RULES);
    }
}
