package com.example.harmonicmixer.sequence.graph;

import com.example.harmonicmixer.context.PlaylistContext;

/**
 * 条件边：根据当前 State 决定下一个节点，不修改 State
 */
@FunctionalInterface
public interface ConditionalEdge {

    /**
     * @param state      当前状态
     * @param lastResult 上一个节点的执行结果
     * @return 下一个节点的名称，null 表示结束
     */
    String decide(PlaylistContext state, SequenceNode.NodeResult lastResult);
}
