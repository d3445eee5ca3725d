package com.example.harmonicmixer.sequence;

import com.example.harmonicmixer.dto.ContextualCurve;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.service.ContextualCurveService;
import com.example.harmonicmixer.skill.HarmonicScorer;
import com.example.harmonicmixer.skill.MixMode;
import com.example.harmonicmixer.skill.ProgressionScorer;
import com.example.harmonicmixer.skill.StylisticCompatibilityMatrix;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 候选曲目综合评分
 *
 * harmonic 0.25 + stylistic 0.25 + context 0.25 + energy progression 0.15 + variety 0.1
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidateScorer {

    private static final double HARMONIC_WEIGHT = 0.25;
    private static final double STYLISTIC_WEIGHT = 0.25;
    private static final double CONTEXT_WEIGHT = 0.25;
    private static final double ENERGY_WEIGHT = 0.15;
    private static final double VARIETY_WEIGHT = 0.1;

    private final HarmonicScorer harmonicScorer;
    private final StylisticCompatibilityMatrix stylisticMatrix;
    private final ContextualCurveService curveService;
    private final ProgressionScorer progressionScorer;

    public double comprehensiveScore(Track current, Track candidate,
                                     Map<String, Object> currentMetadata, Map<String, Object> candidateMetadata,
                                     ContextualCurve curve, double targetEnergy, MixMode mode) {
        double harmonic = harmonicScorer.compatibility(current, candidate, mode);
        double stylistic = stylisticMatrix.compatibility(currentMetadata, candidateMetadata);
        double context = curveService.contextScore(candidateMetadata, curve, targetEnergy);
        double energy = progressionScorer.energyProgressionScore(currentMetadata, candidateMetadata, targetEnergy);
        double variety = progressionScorer.varietyScore(currentMetadata, candidateMetadata);

        double score = HARMONIC_WEIGHT * harmonic
            + STYLISTIC_WEIGHT * stylistic
            + CONTEXT_WEIGHT * context
            + ENERGY_WEIGHT * energy
            + VARIETY_WEIGHT * variety;

        log.debug("[CandidateScorer] {} -> {}: harmonic={}, stylistic={}, context={}, energy={}, variety={}, total={}",
            current.getId(), candidate.getId(), harmonic, stylistic, context, energy, variety, score);
        return score;
    }

    public double contextScore(Map<String, Object> metadata, ContextualCurve curve, double targetEnergy) {
        return curveService.contextScore(metadata, curve, targetEnergy);
    }

    /**
     * 经典模式的转换分：和声兼容分，按能量走向对升/降能量的候选乘 1.2
     */
    public double classicScore(Track current, Track candidate, String progressionCurve, MixMode mode) {
        double score = harmonicScorer.compatibility(current, candidate, mode);
        if (!hasEnergy(candidate) || !hasEnergy(current)) {
            return score;
        }
        if ("ascending".equals(progressionCurve) && candidate.getEnergy() > current.getEnergy()) {
            score *= 1.2;
        } else if ("descending".equals(progressionCurve) && candidate.getEnergy() < current.getEnergy()) {
            score *= 1.2;
        }
        return score;
    }

    private static boolean hasEnergy(Track track) {
        return track.getEnergy() != null && track.getEnergy() != 0.0;
    }
}
