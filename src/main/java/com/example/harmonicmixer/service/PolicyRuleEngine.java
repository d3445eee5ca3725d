package com.example.harmonicmixer.service;

import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.policy.MixingPolicy;
import com.example.harmonicmixer.policy.OperatorType;
import com.example.harmonicmixer.policy.PolicyApplicationResult;
import com.example.harmonicmixer.policy.PolicyConfigurationException;
import com.example.harmonicmixer.policy.PolicyEvaluationResult;
import com.example.harmonicmixer.policy.PolicyRule;
import com.example.harmonicmixer.policy.PolicyRuleSet;
import com.example.harmonicmixer.policy.PolicyType;
import com.example.harmonicmixer.policy.RulePriority;
import com.example.harmonicmixer.skill.MetadataValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 策略规则引擎
 *
 * 按字段提取表取值，用运算符比较，未满足的数值规则给部分分，
 * 再按优先级倍数聚合成规则集分，按全局类型权重聚合成策略分。
 */
@Slf4j
@Service
public class PolicyRuleEngine {

    // ==================== 自适应权重 ====================
    private static final double ACTIVE_TIME_BOOST = 1.2;    // 早晨/傍晚
    private static final double NIGHT_DAMPING = 0.8;        // 深夜
    private static final double WORKOUT_BOOST = 1.3;
    private static final double CHILL_BOOST = 1.1;
    private static final double MIN_MULTIPLIER = 0.1;
    private static final double MAX_MULTIPLIER = 2.0;

    // 部分得分的惩罚区间（期望值的 20%）
    private static final double PENALTY_RANGE_RATIO = 0.2;

    private final Map<String, BiFunction<Track, Map<String, Object>, Object>> fieldExtractors = buildFieldExtractors();

    // ==================== 字段提取 ====================

    private static Map<String, BiFunction<Track, Map<String, Object>, Object>> buildFieldExtractors() {
        Map<String, BiFunction<Track, Map<String, Object>, Object>> extractors = new LinkedHashMap<>();

        // 曲目自身属性
        extractors.put("id", (track, metadata) -> track.getId());
        extractors.put("title", (track, metadata) -> track.getTitle());
        extractors.put("artist", (track, metadata) -> track.getArtist());
        extractors.put("key", (track, metadata) -> track.getKey());
        extractors.put("bpm", (track, metadata) -> track.getBpm());
        extractors.put("energy", (track, metadata) -> track.getEnergy());

        // LLM 元数据原始值
        for (String field : List.of("subgenre", "mood", "era", "language", "time_of_day", "activity", "season")) {
            extractors.put(field, (track, metadata) -> metadata == null ? null : metadata.get(field));
        }

        // 百分比字段归一化到 0-1
        for (String field : List.of("danceability", "crowd_appeal", "mix_friendly")) {
            extractors.put(field, (track, metadata) -> MetadataValues.percentage(metadata, field));
        }
        return Collections.unmodifiableMap(extractors);
    }

    public Object extractField(String field, Track track, Map<String, Object> metadata) {
        BiFunction<Track, Map<String, Object>, Object> extractor = fieldExtractors.get(field);
        if (extractor != null) {
            return extractor.apply(track, metadata);
        }
        return metadata == null ? null : metadata.get(field);
    }

    // ==================== 单条规则 ====================

    /**
     * 评估单条规则；缺少运算符属于配置错误，直接抛出
     */
    public PolicyEvaluationResult evaluate(PolicyRule rule, Track track,
                                           Map<String, Object> metadata, Map<String, Object> context) {
        if (rule.getOperator() == null) {
            throw new PolicyConfigurationException("规则 '" + rule.getId() + "' 缺少运算符");
        }

        PolicyEvaluationResult result = PolicyEvaluationResult.builder()
            .ruleId(rule.getId())
            .ruleName(rule.getName())
            .expectedValue(rule.getValue())
            .weight(rule.getWeight())
            .priority(rule.getPriority())
            .build();

        Object actual = extractField(rule.getField(), track, metadata);
        if (actual == null) {
            result.setSatisfied(false);
            result.setScore(0.0);
            result.setMessage("字段 '" + rule.getField() + "' 不可用");
            return result;
        }
        result.setActualValue(actual);

        try {
            boolean satisfied = test(rule.getOperator(), actual, rule.getValue(), rule.getTolerance());
            double score = satisfied ? 1.0 : partialScore(rule, actual);

            if (rule.isAdaptive() && context != null && !context.isEmpty()) {
                score *= adaptiveMultiplier(rule, context);
            }

            result.setSatisfied(satisfied);
            result.setScore(clamp(score));
            result.setMessage(satisfied ? "已满足" : "未满足");
        } catch (RuntimeException e) {
            log.debug("[PolicyEngine] 规则 {} 评估出错: {}", rule.getId(), e.getMessage());
            result.setSatisfied(false);
            result.setScore(0.0);
            result.setMessage("规则评估出错: " + e.getMessage());
        }
        return result;
    }

    /**
     * 运算符语义；tolerance 对数值比较是容差，对 similar_to / compatible_with 是相似度阈值
     */
    public boolean test(OperatorType operator, Object actual, Object expected, double tolerance) {
        switch (operator) {
            case EQUALS:
                return equalsWithTolerance(actual, expected, tolerance);
            case NOT_EQUALS:
                return !equalsWithTolerance(actual, expected, tolerance);
            case GREATER_THAN:
                return toNumeric(actual) > toNumeric(expected) - tolerance;
            case LESS_THAN:
                return toNumeric(actual) < toNumeric(expected) + tolerance;
            case GREATER_EQUAL:
                return toNumeric(actual) >= toNumeric(expected) - tolerance;
            case LESS_EQUAL:
                return toNumeric(actual) <= toNumeric(expected) + tolerance;
            case CONTAINS:
                return lower(actual).contains(lower(expected));
            case NOT_CONTAINS:
                return !lower(actual).contains(lower(expected));
            case IN_LIST:
                return inList(actual, expected);
            case NOT_IN_LIST:
                return !inList(actual, expected);
            case SIMILAR_TO:
            case COMPATIBLE_WITH:
                return similarity(actual, expected) >= tolerance;
            case WITHIN_RANGE:
                return withinRange(actual, expected, tolerance);
            case MATCHES_PATTERN:
                return matchesPattern(actual, expected);
            default:
                throw new PolicyConfigurationException("未知的运算符: " + operator);
        }
    }

    /**
     * 未满足规则的部分得分，只对数值规则生效；惩罚区间为 |期望值| 的 20%，期望值为 0 时不给部分分
     */
    public double partialScore(PolicyRule rule, Object actual) {
        if (!isNumeric(actual) || !isNumeric(rule.getValue())) {
            return 0.0;
        }
        double actualNum = toNumeric(actual);
        double expectedNum = toNumeric(rule.getValue());

        switch (rule.getOperator()) {
            case EQUALS:
                if (rule.getTolerance() > 0) {
                    double distance = Math.abs(actualNum - expectedNum);
                    return Math.max(0.0, 1.0 - distance / (rule.getTolerance() * 2));
                }
                return 0.0;
            case GREATER_THAN:
            case GREATER_EQUAL:
                if (actualNum < expectedNum) {
                    return penalized(expectedNum - actualNum, expectedNum);
                }
                return 0.0;
            case LESS_THAN:
            case LESS_EQUAL:
                if (actualNum > expectedNum) {
                    return penalized(actualNum - expectedNum, expectedNum);
                }
                return 0.0;
            default:
                return 0.0;
        }
    }

    private static double penalized(double gap, double expected) {
        double range = Math.abs(expected) * PENALTY_RANGE_RATIO;
        if (range == 0.0) {
            return 0.0;
        }
        return clamp(1.0 - gap / range);
    }

    public double adaptiveMultiplier(PolicyRule rule, Map<String, Object> context) {
        double multiplier = 1.0;

        if (rule.isTimeSensitive() && context.containsKey("time_of_day")
            && rule.getPolicyType() == PolicyType.ENERGY
            && rule.getField() != null && rule.getField().toLowerCase(Locale.ROOT).contains("energy")) {
            Object timeOfDay = context.get("time_of_day");
            if ("morning".equals(timeOfDay) || "evening".equals(timeOfDay)) {
                multiplier *= ACTIVE_TIME_BOOST;
            } else if ("night".equals(timeOfDay)) {
                multiplier *= NIGHT_DAMPING;
            }
        }

        Object activity = context.get("activity");
        if ("workout".equals(activity) && rule.getPolicyType() == PolicyType.ENERGY) {
            multiplier *= WORKOUT_BOOST;
        } else if ("chill".equals(activity) && rule.getPolicyType() == PolicyType.HARMONIC) {
            multiplier *= CHILL_BOOST;
        }

        return Math.max(MIN_MULTIPLIER, Math.min(MAX_MULTIPLIER, multiplier));
    }

    // ==================== 规则集 / 策略聚合 ====================

    /**
     * 将策略应用到单首曲目
     */
    public PolicyApplicationResult apply(MixingPolicy policy, Track track,
                                         Map<String, Object> metadata, Map<String, Object> context) {
        PolicyApplicationResult result = PolicyApplicationResult.builder()
            .policyId(policy.getId())
            .build();

        double totalWeightedScore = 0.0;
        double totalWeight = 0.0;

        for (PolicyRuleSet ruleSet : policy.getRuleSets()) {
            if (!ruleSet.isEnabled()) {
                continue;
            }

            double setScore = 0.0;
            double setWeight = 0.0;
            for (PolicyRule rule : ruleSet.getRules()) {
                if (!rule.isEnabled()) {
                    continue;
                }
                PolicyEvaluationResult ruleResult = evaluate(rule, track, metadata, context);
                result.getRuleResults().add(ruleResult);

                if (rule.getPriority() == RulePriority.CRITICAL && !ruleResult.isSatisfied()) {
                    result.setSatisfiedCriticalRules(false);
                    result.getWarnings().add("关键规则 '" + rule.getName() + "' 未满足");
                }

                double weight = ruleResult.getWeight() * rule.getPriority().getMultiplier();
                setScore += ruleResult.getScore() * weight;
                setWeight += weight;
            }

            double finalSetScore = setWeight > 0 ? clamp(setScore / setWeight) : 0.0;
            result.getRuleSetScores().put(ruleSet.getId(), finalSetScore);

            double typeWeight = policy.globalWeight(ruleSet.leadingType());
            totalWeightedScore += finalSetScore * typeWeight * setWeight;
            totalWeight += typeWeight * setWeight;
        }

        result.setTotalScore(totalWeight > 0 ? clamp(totalWeightedScore / totalWeight) : 0.0);
        result.setRecommendations(recommendations(result.getRuleResults()));

        log.debug("[PolicyEngine] 策略 {} 应用于 {}: score={}, ruleSets={}",
            policy.getId(), track.getId(), result.getTotalScore(), result.getRuleSetScores());
        return result;
    }

    private List<String> recommendations(List<PolicyEvaluationResult> ruleResults) {
        List<String> recommendations = new ArrayList<>();
        for (PolicyEvaluationResult r : ruleResults) {
            if (r.isSatisfied()
                || (r.getPriority() != RulePriority.CRITICAL && r.getPriority() != RulePriority.HIGH)) {
                continue;
            }
            String ruleId = r.getRuleId() == null ? "" : r.getRuleId().toLowerCase(Locale.ROOT);
            if (ruleId.contains("key")) {
                recommendations.add("建议选择兼容调性的曲目（当前 " + r.getActualValue() + "）");
            } else if (ruleId.contains("bpm")) {
                recommendations.add("寻找 BPM 更接近 " + r.getExpectedValue() + " 的曲目");
            } else if (ruleId.contains("energy") || ruleId.contains("danceability")) {
                recommendations.add("选择能量/可舞性更高的曲目");
            }
        }
        return recommendations;
    }

    // ==================== 比较工具 ====================

    private boolean equalsWithTolerance(Object actual, Object expected, double tolerance) {
        if (isNumeric(actual) && isNumeric(expected)) {
            return Math.abs(toNumeric(actual) - toNumeric(expected)) <= tolerance;
        }
        return lower(actual).equals(lower(expected));
    }

    private boolean inList(Object actual, Object expected) {
        List<?> candidates = expected instanceof List ? (List<?>) expected : Collections.singletonList(expected);
        String value = lower(actual);
        for (Object candidate : candidates) {
            if (lower(candidate).equals(value)) {
                return true;
            }
        }
        return false;
    }

    private boolean withinRange(Object actual, Object range, double tolerance) {
        if (!isNumeric(actual) || !(range instanceof List) || ((List<?>) range).size() != 2) {
            return false;
        }
        double value = toNumeric(actual);
        double min = toNumeric(((List<?>) range).get(0));
        double max = toNumeric(((List<?>) range).get(1));
        return min - tolerance <= value && value <= max + tolerance;
    }

    private boolean matchesPattern(Object actual, Object pattern) {
        try {
            return Pattern.compile(String.valueOf(pattern)).matcher(String.valueOf(actual)).lookingAt();
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    /**
     * 按空白分词的 Jaccard 相似度；完全相同为 1
     */
    public static double similarity(Object a, Object b) {
        String strA = lower(a);
        String strB = lower(b);
        if (strA.equals(strB)) {
            return 1.0;
        }
        Set<String> setA = words(strA);
        Set<String> setB = words(strB);
        if (setA.isEmpty() && setB.isEmpty()) {
            return 1.0;
        }
        if (setA.isEmpty() || setB.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(setA);
        intersection.retainAll(setB);
        Set<String> union = new HashSet<>(setA);
        union.addAll(setB);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> words(String s) {
        String trimmed = s.trim();
        if (trimmed.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(Arrays.asList(trimmed.split("\\s+")));
    }

    static boolean isNumeric(Object value) {
        if (value instanceof Number) {
            return true;
        }
        if (value instanceof String) {
            try {
                Double.parseDouble((String) value);
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }

    /**
     * 数值转换，支持 "75%" 形式；无法转换时抛出 IllegalArgumentException
     */
    static double toNumeric(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            String s = (String) value;
            if (s.endsWith("%")) {
                return Double.parseDouble(s.substring(0, s.length() - 1)) / 100.0;
            }
            return Double.parseDouble(s);
        }
        throw new IllegalArgumentException("无法转换为数值: " + value);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String lower(Object value) {
        return Objects.toString(value).toLowerCase(Locale.ROOT);
    }
}
