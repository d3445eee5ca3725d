package com.example.harmonicmixer.sequence.graph;

import com.example.harmonicmixer.config.MixerProperties;
import com.example.harmonicmixer.sequence.CandidateScorer;
import com.example.harmonicmixer.service.ContextualCurveService;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 选曲状态图构建器
 *
 * 持有节点所需的依赖，由 SequenceStrategy 负责装配具体的节点和边
 */
@Slf4j
@Getter
@Component
@RequiredArgsConstructor
public class SequenceGraphBuilder {

    private final CandidateScorer candidateScorer;
    private final ContextualCurveService curveService;
    private final MixerProperties properties;

    // 每个位置最多经过 循环控制、评分、采纳/兜底 三个节点
    private static final int NODES_PER_POSITION = 3;
    // 曲线、起始曲目、最后一次循环控制与汇总
    private static final int FIXED_NODES = 10;

    /**
     * @param limit 需要填充的位置总数；迭代上限不低于完成这些位置所需的节点数
     */
    public SequenceGraph build(SequenceStrategy strategy, int limit) {
        long required = (long) NODES_PER_POSITION * Math.max(0, limit) + FIXED_NODES;
        int maxIterations = (int) Math.min(Integer.MAX_VALUE,
            Math.max(properties.getPlaylist().getMaxGraphIterations(), required));
        SequenceGraph graph = new SequenceGraph(maxIterations);
        strategy.configure(graph, this);
        log.debug("[GraphBuilder] 使用策略 {} 构建状态图, maxIterations={}",
            strategy.getClass().getSimpleName(), maxIterations);
        return graph;
    }
}
