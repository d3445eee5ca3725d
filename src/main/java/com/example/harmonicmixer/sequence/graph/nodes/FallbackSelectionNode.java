package com.example.harmonicmixer.sequence.graph.nodes;

import com.example.harmonicmixer.context.PlaylistContext;
import com.example.harmonicmixer.dto.GenerationInfo;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.sequence.CandidateScorer;
import com.example.harmonicmixer.sequence.graph.SequenceNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 兜底节点：没有候选达到阈值时，放宽要求只看上下文契合度；
 * 仍然没有得分 > 0 的曲目时提前结束
 */
@Slf4j
@RequiredArgsConstructor
public class FallbackSelectionNode implements SequenceNode {

    private final CandidateScorer candidateScorer;

    @Override
    public NodeResult execute(PlaylistContext state) {
        state.setCurrentStage(PlaylistContext.Stage.FALLBACK);
        double targetEnergy = ScoreCandidatesNode.targetEnergy(state);

        Track best = null;
        double bestScore = 0.0;
        for (Track candidate : state.getCandidates()) {
            if (candidate.equals(state.getCurrentTrack())) {
                continue;
            }
            double score = candidateScorer.contextScore(state.metadataFor(candidate), state.getCurve(), targetEnergy);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }

        if (best == null) {
            log.warn("[Fallback] position={} 没有可用的兜底曲目，提前结束", state.getControl().getPosition());
            state.getControl().stop();
            return NodeResult.failure("没有可用的兜底曲目");
        }

        state.append(best, bestScore);
        GenerationInfo info = state.getGenerationInfo();
        info.setFallbackSelections(info.getFallbackSelections() + 1);
        log.warn("[Fallback] position={} 未达阈值，兜底选择 {} (context={})",
            state.getControl().getPosition(), best.getId(), bestScore);

        state.getControl().advance();
        return NodeResult.success();
    }
}
