package com.example.harmonicmixer.sequence.graph.edges;

import com.example.harmonicmixer.context.PlaylistContext;
import com.example.harmonicmixer.sequence.graph.ConditionalEdge;
import com.example.harmonicmixer.sequence.graph.SequenceNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 继续选曲条件边（循环控制）
 *
 * 决策逻辑：
 * - shouldContinue=true -> 选曲节点（回环）
 * - 否则 -> finalize（跳出循环）
 */
@Slf4j
@RequiredArgsConstructor
public class ContinueSequenceEdge implements ConditionalEdge {

    private final String loopTarget;
    private final String finalizeNode;

    @Override
    public String decide(PlaylistContext state, SequenceNode.NodeResult lastResult) {
        if (state.getControl().isShouldContinue()) {
            return loopTarget;
        }
        log.debug("[ContinueSequenceEdge] 选曲结束，当前长度 {}", state.getPlaylist().size());
        return finalizeNode;
    }
}
