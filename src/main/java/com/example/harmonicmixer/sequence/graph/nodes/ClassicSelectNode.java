package com.example.harmonicmixer.sequence.graph.nodes;

import com.example.harmonicmixer.context.PlaylistContext;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.sequence.CandidateScorer;
import com.example.harmonicmixer.sequence.graph.SequenceNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 经典模式选曲节点：取转换分最高的候选，分数不超过 0.3 时结束
 */
@Slf4j
@RequiredArgsConstructor
public class ClassicSelectNode implements SequenceNode {

    private static final double MIN_SCORE = 0.3;

    private final CandidateScorer candidateScorer;

    @Override
    public NodeResult execute(PlaylistContext state) {
        state.setCurrentStage(PlaylistContext.Stage.CANDIDATE_SCORING);
        Track current = state.getCurrentTrack();
        String progressionCurve = state.getRequest().getProgressionCurve();

        Track best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Track candidate : state.getCandidates()) {
            double score = candidateScorer.classicScore(current, candidate, progressionCurve, state.getHarmonicMode());
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }

        if (best == null || bestScore <= MIN_SCORE) {
            log.debug("[ClassicSelect] 最佳转换分 {} 未超过 {}，结束", bestScore, MIN_SCORE);
            state.getControl().stop();
            return NodeResult.failure("没有足够兼容的候选");
        }

        state.setCurrentStage(PlaylistContext.Stage.TRACK_ACCEPTED);
        state.append(best, bestScore);
        state.getCandidates().remove(best); // 经典模式不重复
        state.getControl().advance();
        return NodeResult.success();
    }
}
