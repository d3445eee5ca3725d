package com.example.harmonicmixer.sequence.graph;

/**
 * 选曲策略接口，用于按生成模式装配节点和边。
 */
public interface SequenceStrategy {

    /**
     * 根据策略配置状态图：添加节点、条件边并设置起始节点。
     *
     * @param graph   要配置的 SequenceGraph 实例
     * @param builder 依赖提供方（访问各类评分组件）
     */
    void configure(SequenceGraph graph, SequenceGraphBuilder builder);
}
