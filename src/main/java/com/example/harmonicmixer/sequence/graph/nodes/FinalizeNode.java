package com.example.harmonicmixer.sequence.graph.nodes;

import com.example.harmonicmixer.context.PlaylistContext;
import com.example.harmonicmixer.sequence.graph.SequenceNode;
import lombok.extern.slf4j.Slf4j;

/**
 * 汇总节点（终止节点，无出边）
 */
@Slf4j
public class FinalizeNode implements SequenceNode {

    @Override
    public NodeResult execute(PlaylistContext state) {
        state.setCurrentStage(PlaylistContext.Stage.FINALIZE);
        log.info("[Finalize] 歌单长度 {}/{}，迭代 {} 次，兜底 {} 次，完美匹配 {} 次",
            state.getPlaylist().size(), state.getTargetLength(),
            state.getGenerationInfo().getIterations(),
            state.getGenerationInfo().getFallbackSelections(),
            state.getGenerationInfo().getPerfectMatches());
        state.setCurrentStage(PlaylistContext.Stage.END);
        return NodeResult.success();
    }
}
