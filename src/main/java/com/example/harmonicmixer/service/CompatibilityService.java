package com.example.harmonicmixer.service;

import com.example.harmonicmixer.config.MixerProperties;
import com.example.harmonicmixer.dto.BridgeCandidate;
import com.example.harmonicmixer.dto.CompatibilityExplanation;
import com.example.harmonicmixer.dto.MixTransition;
import com.example.harmonicmixer.dto.StructuralAnalysis;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.dto.TrackWithMetadata;
import com.example.harmonicmixer.policy.MixingPolicy;
import com.example.harmonicmixer.policy.PolicyConfigurationException;
import com.example.harmonicmixer.skill.EnhancedCompatibilityEngine;
import com.example.harmonicmixer.skill.HarmonicScorer;
import com.example.harmonicmixer.skill.MixMode;
import com.example.harmonicmixer.skill.StylisticCompatibilityMatrix;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 兼容性编排服务
 *
 * 对外统一入口：基础和声分、增强分（引擎未启用时退化为和声分）、
 * 叠加策略分、兼容性解释、桥接曲目与最优过渡。
 */
@Slf4j
@Service
public class CompatibilityService {

    private final HarmonicScorer harmonicScorer;
    private final StylisticCompatibilityMatrix stylisticMatrix;
    private final Optional<EnhancedCompatibilityEngine> enhancedEngine;
    private final MixingPolicyService policyService;
    private final PolicyRuleEngine ruleEngine;
    private final double policyBlendWeight;

    public CompatibilityService(HarmonicScorer harmonicScorer,
                                StylisticCompatibilityMatrix stylisticMatrix,
                                Optional<EnhancedCompatibilityEngine> enhancedEngine,
                                MixingPolicyService policyService,
                                PolicyRuleEngine ruleEngine,
                                MixerProperties properties) {
        this.harmonicScorer = harmonicScorer;
        this.stylisticMatrix = stylisticMatrix;
        this.enhancedEngine = enhancedEngine;
        this.policyService = policyService;
        this.ruleEngine = ruleEngine;
        this.policyBlendWeight = properties.getPolicy().getBlendWeight();
        if (enhancedEngine.isEmpty()) {
            log.info("[CompatibilityService] 增强引擎未启用，增强评分退化为和声评分");
        }
    }

    public double score(Track a, Track b, MixMode mode) {
        return harmonicScorer.compatibility(a, b, mode);
    }

    /**
     * 增强兼容分；结构分析与元数据均可为 null
     */
    public double scoreEnhanced(Track a, Track b,
                                StructuralAnalysis structuralA, StructuralAnalysis structuralB,
                                Map<String, Object> metadataA, Map<String, Object> metadataB) {
        return enhancedEngine
            .map(engine -> engine.compatibility(a, b, structuralA, structuralB, metadataA, metadataB))
            .orElseGet(() -> harmonicScorer.compatibility(a, b));
    }

    /**
     * 在增强分中按 blend-weight 融入策略对目标曲目的评分
     */
    public double scoreWithPolicy(Track a, Track b,
                                  StructuralAnalysis structuralA, StructuralAnalysis structuralB,
                                  Map<String, Object> metadataA, Map<String, Object> metadataB,
                                  String policyId, Map<String, Object> context) {
        MixingPolicy policy = policyService.getPolicy(policyId)
            .orElseThrow(() -> new PolicyConfigurationException("策略 '" + policyId + "' 不存在"));
        double enhanced = scoreEnhanced(a, b, structuralA, structuralB, metadataA, metadataB);
        double policyScore = ruleEngine.apply(policy, b, metadataB, context).getTotalScore();
        double blended = enhanced * (1 - policyBlendWeight) + policyScore * policyBlendWeight;
        log.debug("[CompatibilityService] {} -> {}: enhanced={}, policy({})={}, blended={}",
            a.getId(), b.getId(), enhanced, policyId, policyScore, blended);
        return Math.min(blended, 1.0);
    }

    public CompatibilityExplanation explain(Track a, Track b,
                                            Map<String, Object> metadataA, Map<String, Object> metadataB) {
        return enhancedEngine
            .map(engine -> engine.explain(a, b, metadataA, metadataB))
            .orElseGet(() -> {
                double harmonic = harmonicScorer.compatibility(a, b);
                CompatibilityExplanation explanation = new CompatibilityExplanation();
                explanation.setOverallScore(harmonic);
                explanation.setHarmonic(CompatibilityExplanation.HarmonicDetail.builder().score(harmonic).build());
                return explanation;
            });
    }

    public Optional<MixTransition> findOptimalTransition(Track from, Track to,
                                                         StructuralAnalysis structuralFrom,
                                                         StructuralAnalysis structuralTo) {
        return enhancedEngine.flatMap(engine -> engine.findOptimalTransition(from, to, structuralFrom, structuralTo));
    }

    public Map<String, Double> styleBreakdown(Map<String, Object> metadataA, Map<String, Object> metadataB) {
        return stylisticMatrix.breakdown(
            stylisticMatrix.extractProfile(metadataA), stylisticMatrix.extractProfile(metadataB));
    }

    public List<BridgeCandidate> bridgeTracks(Map<String, Object> metadataFrom, Map<String, Object> metadataTo,
                                              List<TrackWithMetadata> candidates) {
        return stylisticMatrix.bridgeTracks(
            stylisticMatrix.extractProfile(metadataFrom), stylisticMatrix.extractProfile(metadataTo), candidates);
    }

    public double[][] compatibilityMatrix(List<Track> tracks, MixMode mode) {
        return harmonicScorer.compatibilityMatrix(tracks, mode);
    }
}
