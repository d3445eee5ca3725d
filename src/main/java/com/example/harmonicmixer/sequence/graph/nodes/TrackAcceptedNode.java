package com.example.harmonicmixer.sequence.graph.nodes;

import com.example.harmonicmixer.context.PlaylistContext;
import com.example.harmonicmixer.dto.GenerationInfo;
import com.example.harmonicmixer.sequence.graph.SequenceNode;
import lombok.extern.slf4j.Slf4j;

/**
 * 采纳节点：最佳候选达到最低兼容分，加入歌单；综合分 > 0.8 计为完美匹配
 */
@Slf4j
public class TrackAcceptedNode implements SequenceNode {

    private static final double PERFECT_MATCH_THRESHOLD = 0.8;

    @Override
    public NodeResult execute(PlaylistContext state) {
        state.setCurrentStage(PlaylistContext.Stage.TRACK_ACCEPTED);
        double score = state.getBestScore();
        state.append(state.getBestCandidate(), score);

        if (score > PERFECT_MATCH_THRESHOLD) {
            GenerationInfo info = state.getGenerationInfo();
            info.setPerfectMatches(info.getPerfectMatches() + 1);
        }
        log.debug("[TrackAccepted] position={}, track={}, score={}",
            state.getControl().getPosition(), state.getBestCandidate().getId(), score);

        state.getControl().advance();
        return NodeResult.success();
    }
}
