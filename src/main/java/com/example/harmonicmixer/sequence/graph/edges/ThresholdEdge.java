package com.example.harmonicmixer.sequence.graph.edges;

import com.example.harmonicmixer.context.PlaylistContext;
import com.example.harmonicmixer.sequence.graph.ConditionalEdge;
import com.example.harmonicmixer.sequence.graph.SequenceNode;
import lombok.extern.slf4j.Slf4j;

/**
 * 阈值条件边
 *
 * 决策逻辑：
 * - 最佳候选综合分 >= minCompatibility -> track_accepted
 * - 否则 -> fallback_selection
 */
@Slf4j
public class ThresholdEdge implements ConditionalEdge {

    public static final String ACCEPTED = "track_accepted";
    public static final String FALLBACK = "fallback_selection";

    @Override
    public String decide(PlaylistContext state, SequenceNode.NodeResult lastResult) {
        if (state.getBestCandidate() != null && state.getBestScore() >= state.getMinCompatibility()) {
            return ACCEPTED;
        }
        log.debug("[ThresholdEdge] 最佳分 {} 未达到阈值 {}", state.getBestScore(), state.getMinCompatibility());
        return FALLBACK;
    }
}
