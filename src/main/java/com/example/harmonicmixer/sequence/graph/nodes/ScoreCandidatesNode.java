package com.example.harmonicmixer.sequence.graph.nodes;

import com.example.harmonicmixer.context.PlaylistContext;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.sequence.CandidateScorer;
import com.example.harmonicmixer.sequence.graph.SequenceNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 候选评分节点：对所有候选计算综合分，记录最佳候选；
 * 最佳候选的上下文分 < 0.4 时计一次情境不匹配
 */
@Slf4j
@RequiredArgsConstructor
public class ScoreCandidatesNode implements SequenceNode {

    private static final double CONTEXT_MISMATCH_THRESHOLD = 0.4;
    private static final double DEFAULT_TARGET_ENERGY = 0.5;

    private final CandidateScorer candidateScorer;

    @Override
    public NodeResult execute(PlaylistContext state) {
        state.setCurrentStage(PlaylistContext.Stage.CANDIDATE_SCORING);
        double targetEnergy = targetEnergy(state);
        Track current = state.getCurrentTrack();
        Map<String, Object> currentMetadata = state.metadataFor(current);

        Track best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Track candidate : state.getCandidates()) {
            if (candidate.equals(current)) {
                continue;
            }
            double score = candidateScorer.comprehensiveScore(current, candidate,
                currentMetadata, state.metadataFor(candidate),
                state.getCurve(), targetEnergy, state.getHarmonicMode());
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }

        state.setBestCandidate(best);
        state.setBestScore(best != null ? bestScore : 0.0);

        if (best != null) {
            double contextScore = candidateScorer.contextScore(state.metadataFor(best), state.getCurve(), targetEnergy);
            if (contextScore < CONTEXT_MISMATCH_THRESHOLD) {
                state.getGenerationInfo().setContextMismatches(state.getGenerationInfo().getContextMismatches() + 1);
            }
            log.debug("[ScoreCandidates] position={}, best={} score={} context={}",
                state.getControl().getPosition(), best.getId(), bestScore, contextScore);
        }
        return NodeResult.success();
    }

    /**
     * 超出能量曲线长度的位置目标能量为 0.5
     */
    static double targetEnergy(PlaylistContext state) {
        int position = state.getControl().getPosition();
        return position < state.getEnergyProgression().size()
            ? state.getEnergyProgression().get(position)
            : DEFAULT_TARGET_ENERGY;
    }
}
