package com.example.harmonicmixer.skill;

import com.example.harmonicmixer.dto.BridgeCandidate;
import com.example.harmonicmixer.dto.StyleProfile;
import com.example.harmonicmixer.dto.TrackWithMetadata;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 风格兼容性矩阵
 *
 * 七张查表（子流派、情绪、年代、语言、活动、时段、季节）+ 可舞性数值差，
 * 只在双方都有值的维度上按权重加权，并按实际使用的权重归一化；
 * 没有任何可比较维度时返回中性分 0.5。
 */
@Slf4j
@Component
public class StylisticCompatibilityMatrix {

    public static final String TABLES_RESOURCE = "stylistic-compatibility.json";

    private static final double DANCEABILITY_WEIGHT = 0.05;
    private static final double NEUTRAL_SCORE = 0.5;

    // ==================== 桥接曲目 ====================
    private static final double BRIDGE_BONUS_THRESHOLD = 0.7;
    private static final double BRIDGE_BONUS = 1.2;
    private static final int MAX_BRIDGES = 10;

    private final Map<StyleDimension, Map<String, Map<String, CompatibilityLevel>>> tables =
        new EnumMap<>(StyleDimension.class);

    public StylisticCompatibilityMatrix(ObjectMapper objectMapper) {
        Map<String, Map<String, Map<String, CompatibilityLevel>>> raw;
        try (InputStream in = new ClassPathResource(TABLES_RESOURCE).getInputStream()) {
            raw = objectMapper.readValue(in, new TypeReference<Map<String, Map<String, Map<String, CompatibilityLevel>>>>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("无法加载风格兼容表: " + TABLES_RESOURCE, e);
        }
        for (StyleDimension dimension : StyleDimension.values()) {
            tables.put(dimension, raw.getOrDefault(dimension.getTableName(), Map.of()));
        }
        log.info("[StylisticMatrix] 风格兼容表加载完成: {}", raw.keySet());
    }

    /**
     * 从元数据构建风格画像；元数据为空时返回全空画像
     */
    public StyleProfile extractProfile(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return new StyleProfile();
        }
        return StyleProfile.builder()
            .subgenre(MetadataValues.string(metadata, "subgenre"))
            .mood(MetadataValues.string(metadata, "mood"))
            .era(MetadataValues.string(metadata, "era"))
            .language(MetadataValues.string(metadata, "language"))
            .timeOfDay(MetadataValues.string(metadata, "time_of_day"))
            .activity(MetadataValues.string(metadata, "activity"))
            .season(MetadataValues.string(metadata, "season"))
            .danceability(MetadataValues.percentage(metadata, "danceability"))
            .crowdAppeal(MetadataValues.percentage(metadata, "crowd_appeal"))
            .mixFriendly(MetadataValues.percentage(metadata, "mix_friendly"))
            .build();
    }

    /**
     * 单维度查表：先查 [a][b]，再查 [b][a]，都没有时为 FAIR
     */
    public double lookup(StyleDimension dimension, String a, String b) {
        Map<String, Map<String, CompatibilityLevel>> table = tables.get(dimension);
        Map<String, CompatibilityLevel> row = table.get(a);
        if (row != null && row.containsKey(b)) {
            return row.get(b).getScore();
        }
        Map<String, CompatibilityLevel> reverse = table.get(b);
        if (reverse != null && reverse.containsKey(a)) {
            return reverse.get(a).getScore();
        }
        return CompatibilityLevel.FAIR.getScore();
    }

    public double compatibility(StyleProfile p1, StyleProfile p2) {
        double totalScore = 0.0;
        double totalWeight = 0.0;

        for (StyleDimension dimension : StyleDimension.values()) {
            String v1 = dimension.valueOf(p1);
            String v2 = dimension.valueOf(p2);
            if (v1 != null && v2 != null) {
                totalScore += lookup(dimension, v1, v2) * dimension.getWeight();
                totalWeight += dimension.getWeight();
            }
        }

        if (p1.getDanceability() != null && p2.getDanceability() != null) {
            totalScore += danceabilityScore(p1, p2) * DANCEABILITY_WEIGHT;
            totalWeight += DANCEABILITY_WEIGHT;
        }

        return totalWeight > 0 ? totalScore / totalWeight : NEUTRAL_SCORE;
    }

    public double compatibility(Map<String, Object> metadata1, Map<String, Object> metadata2) {
        return compatibility(extractProfile(metadata1), extractProfile(metadata2));
    }

    /**
     * 分维度明细（只包含双方都有值的维度）
     */
    public Map<String, Double> breakdown(StyleProfile p1, StyleProfile p2) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (StyleDimension dimension : StyleDimension.values()) {
            if (!dimension.isInBreakdown()) {
                continue;
            }
            String v1 = dimension.valueOf(p1);
            String v2 = dimension.valueOf(p2);
            if (v1 != null && v2 != null) {
                result.put(dimension.getTableName(), lookup(dimension, v1, v2));
            }
        }
        if (p1.getDanceability() != null && p2.getDanceability() != null) {
            result.put("danceability", danceabilityScore(p1, p2));
        }
        return result;
    }

    /**
     * 为两个风格差异较大的画像寻找桥接曲目，按桥接分数降序返回前 10 个
     */
    public List<BridgeCandidate> bridgeTracks(StyleProfile from, StyleProfile to, List<TrackWithMetadata> candidates) {
        List<BridgeCandidate> bridges = new ArrayList<>();
        for (TrackWithMetadata candidate : candidates) {
            StyleProfile bridgeProfile = extractProfile(candidate.getMetadata());
            double toBridge = compatibility(from, bridgeProfile);
            double fromBridge = compatibility(bridgeProfile, to);
            if (toBridge > 0 && fromBridge > 0) {
                bridges.add(new BridgeCandidate(candidate.getTrack(), bridgeScore(toBridge, fromBridge)));
            }
        }
        bridges.sort(Comparator.comparingDouble(BridgeCandidate::getScore).reversed());
        log.debug("[StylisticMatrix] 桥接候选 {} 个", bridges.size());
        return bridges.size() > MAX_BRIDGES ? new ArrayList<>(bridges.subList(0, MAX_BRIDGES)) : bridges;
    }

    /**
     * 桥接分 = 两段兼容分的调和平均；两段都 > 0.7 时乘 1.2，上限 1.0
     */
    public double bridgeScore(double toBridge, double fromBridge) {
        double score = 2 * toBridge * fromBridge / (toBridge + fromBridge);
        if (toBridge > BRIDGE_BONUS_THRESHOLD && fromBridge > BRIDGE_BONUS_THRESHOLD) {
            score *= BRIDGE_BONUS;
        }
        return Math.min(score, 1.0);
    }

    private static double danceabilityScore(StyleProfile p1, StyleProfile p2) {
        return Math.max(0.0, 1.0 - Math.abs(p1.getDanceability() - p2.getDanceability()));
    }
}
