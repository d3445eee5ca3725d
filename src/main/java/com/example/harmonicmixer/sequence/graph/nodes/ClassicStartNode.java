package com.example.harmonicmixer.sequence.graph.nodes;

import com.example.harmonicmixer.context.PlaylistContext;
import com.example.harmonicmixer.dto.Track;
import com.example.harmonicmixer.sequence.graph.SequenceNode;
import lombok.extern.slf4j.Slf4j;

/**
 * 经典模式起始节点：未指定时取第一首；指定的起始曲目不在曲库中时失败
 */
@Slf4j
public class ClassicStartNode implements SequenceNode {

    public static final String ALGORITHM = "classic_greedy";

    @Override
    public NodeResult execute(PlaylistContext state) {
        state.setCurrentStage(PlaylistContext.Stage.START_SELECTION);
        state.getGenerationInfo().setAlgorithm(ALGORITHM);
        state.getGenerationInfo().setCurveUsed(state.getRequest().getProgressionCurve());

        if (state.getCandidates().isEmpty()) {
            return NodeResult.failure("曲库为空");
        }
        Track start = state.getRequest().getStartTrack();
        if (start == null) {
            start = state.getCandidates().get(0);
        } else if (!state.getCandidates().contains(start)) {
            log.warn("[ClassicStart] 起始曲目 {} 不在曲库中", start.getId());
            return NodeResult.failure("起始曲目不在曲库中");
        }

        // 起始曲目不计转换分
        state.getPlaylist().add(start);
        state.setCurrentTrack(start);
        state.getCandidates().removeIf(start::equals);
        return NodeResult.success();
    }
}
