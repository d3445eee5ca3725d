package com.example.harmonicmixer.sequence.graph.edges;

import com.example.harmonicmixer.context.PlaylistContext;
import com.example.harmonicmixer.sequence.graph.ConditionalEdge;
import com.example.harmonicmixer.sequence.graph.SequenceNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 起始曲目选择后的条件边
 *
 * 决策逻辑：
 * - 没有起始曲目 -> finalize（空歌单）
 * - 否则 -> loop_control
 */
@Slf4j
@RequiredArgsConstructor
public class AfterStartEdge implements ConditionalEdge {

    private final String loopNode;
    private final String finalizeNode;

    @Override
    public String decide(PlaylistContext state, SequenceNode.NodeResult lastResult) {
        if (!lastResult.isSuccess()) {
            log.warn("[AfterStartEdge] 起始曲目选择失败: {}", lastResult.getReason());
            return finalizeNode;
        }
        return loopNode;
    }
}
