package com.example.harmonicmixer.skill;

import com.example.harmonicmixer.dto.CompatibilityExplanation;
import com.example.harmonicmixer.dto.MixTransition;
import com.example.harmonicmixer.dto.StructuralAnalysis;
import com.example.harmonicmixer.dto.StyleProfile;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.dto.TransitionPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 增强兼容性引擎
 *
 * 在和声分基础上融合风格、结构、过渡点与时序分：
 * harmonic 0.25 + stylistic 0.25 + structural 0.2 + transition 0.2 + temporal 0.1。
 * 缺少双方元数据时风格分取 0.5，缺少双方结构分析时三个结构分量都取 0.5。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "mixer.enhanced.enabled", havingValue = "true", matchIfMissing = true)
public class EnhancedCompatibilityEngine {

    private static final double HARMONIC_WEIGHT = 0.25;
    private static final double STYLISTIC_WEIGHT = 0.25;
    private static final double STRUCTURAL_WEIGHT = 0.2;
    private static final double TRANSITION_WEIGHT = 0.2;
    private static final double TEMPORAL_WEIGHT = 0.1;
    private static final double NEUTRAL = 0.5;

    private static final double LOW_SCORE = 0.5;

    private final HarmonicScorer harmonicScorer;
    private final StylisticCompatibilityMatrix stylisticMatrix;
    private final StructuralCompatibilityScorer structuralScorer;

    public double compatibility(Track a, Track b,
                                StructuralAnalysis structuralA, StructuralAnalysis structuralB,
                                Map<String, Object> metadataA, Map<String, Object> metadataB) {
        double harmonic = harmonicScorer.compatibility(a, b);

        double stylistic = NEUTRAL;
        if (hasMetadata(metadataA) && hasMetadata(metadataB)) {
            stylistic = stylisticMatrix.compatibility(metadataA, metadataB);
        }

        double structural = NEUTRAL;
        double transition = NEUTRAL;
        double temporal = NEUTRAL;
        if (structuralA != null && structuralB != null) {
            structural = structuralScorer.structuralScore(structuralA, structuralB);
            transition = structuralScorer.transitionQuality(structuralA, structuralB);
            temporal = structuralScorer.temporalScore(structuralA, structuralB);
        }

        double score = HARMONIC_WEIGHT * harmonic
            + STYLISTIC_WEIGHT * stylistic
            + STRUCTURAL_WEIGHT * structural
            + TRANSITION_WEIGHT * transition
            + TEMPORAL_WEIGHT * temporal;

        log.debug("[EnhancedEngine] {} -> {}: harmonic={}, stylistic={}, structural={}, transition={}, temporal={}",
            a.getId(), b.getId(), harmonic, stylistic, structural, transition, temporal);
        return Math.min(score, 1.0);
    }

    /**
     * 在双方前 5 个过渡点的组合中寻找质量最高的过渡；任一方没有过渡点时为空
     */
    public Optional<MixTransition> findOptimalTransition(Track from, Track to,
                                                         StructuralAnalysis structuralFrom,
                                                         StructuralAnalysis structuralTo) {
        List<TransitionPoint> outPoints = structuralScorer.topPoints(structuralFrom);
        List<TransitionPoint> inPoints = structuralScorer.topPoints(structuralTo);
        if (outPoints.isEmpty() || inPoints.isEmpty()) {
            return Optional.empty();
        }

        TransitionPoint bestOut = null;
        TransitionPoint bestIn = null;
        double bestQuality = 0.0;
        for (TransitionPoint outPoint : outPoints) {
            for (TransitionPoint inPoint : inPoints) {
                double quality = structuralScorer.evaluatePair(outPoint, inPoint, structuralFrom);
                if (quality > bestQuality) {
                    bestQuality = quality;
                    bestOut = outPoint;
                    bestIn = inPoint;
                }
            }
        }
        if (bestOut == null) {
            return Optional.empty();
        }

        return Optional.of(MixTransition.builder()
            .from(from)
            .to(to)
            .mixOutPoint(bestOut)
            .mixInPoint(bestIn)
            .compatibilityScore(compatibility(from, to, structuralFrom, structuralTo, null, null))
            .transitionQuality(bestQuality)
            .estimatedMixDuration(structuralScorer.estimateMixDuration(bestOut, bestIn))
            .build());
    }

    /**
     * 兼容性解释；总分使用不含结构数据的增强分
     */
    public CompatibilityExplanation explain(Track a, Track b,
                                            Map<String, Object> metadataA, Map<String, Object> metadataB) {
        CompatibilityExplanation explanation = new CompatibilityExplanation();

        explanation.setHarmonic(CompatibilityExplanation.HarmonicDetail.builder()
            .score(harmonicScorer.compatibility(a, b))
            .keyMatch(hasText(a.getKey()) && hasText(b.getKey())
                ? a.getKey() + " → " + b.getKey() : "No key data")
            .bpmMatch(present(a.getBpm()) && present(b.getBpm())
                ? a.getBpm() + " → " + b.getBpm() + " BPM" : "No BPM data")
            .energyMatch(present(a.getEnergy()) && present(b.getEnergy())
                ? a.getEnergy() + " → " + b.getEnergy() : "No energy data")
            .build());

        if (hasMetadata(metadataA) && hasMetadata(metadataB)) {
            StyleProfile p1 = stylisticMatrix.extractProfile(metadataA);
            StyleProfile p2 = stylisticMatrix.extractProfile(metadataB);
            double stylistic = stylisticMatrix.compatibility(p1, p2);
            Map<String, Double> breakdown = stylisticMatrix.breakdown(p1, p2);

            explanation.setStylistic(CompatibilityExplanation.StylisticDetail.builder()
                .score(stylistic)
                .subgenreMatch(p1.getSubgenre() + " → " + p2.getSubgenre())
                .moodMatch(p1.getMood() + " → " + p2.getMood())
                .eraMatch(p1.getEra() + " → " + p2.getEra())
                .languageMatch(p1.getLanguage() + " → " + p2.getLanguage())
                .breakdown(breakdown)
                .build());

            if (stylistic < LOW_SCORE) {
                explanation.getRecommendations().add("风格差异较大，建议插入一首桥接曲目平滑过渡");
            }
            // 缺少该维度时按 0 分处理，同样给出建议
            if (breakdown.getOrDefault(StyleDimension.MOOD.getTableName(), 0.0) < LOW_SCORE) {
                explanation.getRecommendations().add("情绪不匹配，建议渐进式过渡能量");
            }
            if (breakdown.getOrDefault(StyleDimension.ERA.getTableName(), 0.0) < LOW_SCORE) {
                explanation.getRecommendations().add("年代不匹配，可能造成时代割裂感");
            }
        }

        explanation.setOverallScore(compatibility(a, b, null, null, metadataA, metadataB));
        return explanation;
    }

    private static boolean hasMetadata(Map<String, Object> metadata) {
        return metadata != null && !metadata.isEmpty();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isEmpty();
    }

    private static boolean present(Double value) {
        return value != null && value != 0.0;
    }
}
