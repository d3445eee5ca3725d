package com.example.harmonicmixer.sequence.graph;

import com.example.harmonicmixer.context.PlaylistContext;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 选曲状态图
 *
 * 把贪心选曲的 if/for/break 映射为节点、条件边与循环边
 */
@Slf4j
public class SequenceGraph {

    private final Map<String, SequenceNode> nodes = new LinkedHashMap<>();
    private final Map<String, ConditionalEdge> edges = new LinkedHashMap<>();
    private final int maxIterations;
    private String startNode;

    public SequenceGraph(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public SequenceGraph addNode(String name, SequenceNode node) {
        nodes.put(name, node);
        return this;
    }

    public SequenceGraph addEdge(String fromNode, ConditionalEdge edge) {
        edges.put(fromNode, edge);
        return this;
    }

    public SequenceGraph setStart(String nodeName) {
        this.startNode = nodeName;
        return this;
    }

    /**
     * 执行图
     *
     * @return 实际执行的节点数
     */
    public int execute(PlaylistContext state) {
        if (startNode == null) {
            throw new IllegalStateException("起始节点未设置");
        }

        String currentNode = startNode;
        int iterations = 0;

        while (currentNode != null && iterations < maxIterations) {
            iterations++;
            log.debug("[SequenceGraph] 执行节点: {}", currentNode);

            SequenceNode node = nodes.get(currentNode);
            if (node == null) {
                throw new IllegalStateException("节点不存在: " + currentNode);
            }

            SequenceNode.NodeResult lastResult = node.execute(state);

            ConditionalEdge edge = edges.get(currentNode);
            if (edge == null) {
                // 没有出边，说明是终止节点
                log.debug("[SequenceGraph] 节点 {} 没有出边，执行结束", currentNode);
                break;
            }

            String nextNode = edge.decide(state, lastResult);
            if (nextNode == null) {
                log.debug("[SequenceGraph] 条件边返回 null，执行结束");
                break;
            }

            log.debug("[SequenceGraph] 从 {} -> {}", currentNode, nextNode);
            currentNode = nextNode;
        }

        if (iterations >= maxIterations) {
            log.error("[SequenceGraph] 达到最大迭代次数 {}，可能存在无限循环", maxIterations);
        }

        log.debug("[SequenceGraph] 图执行完成，共执行 {} 个节点", iterations);
        return iterations;
    }

    /**
     * 图的文本表示（用于调试）
     */
    public String visualize() {
        StringBuilder sb = new StringBuilder();
        sb.append("选曲状态图:\n");
        sb.append("起始节点: ").append(startNode).append("\n\n");
        sb.append("节点列表:\n");
        for (String nodeName : nodes.keySet()) {
            sb.append("  - ").append(nodeName).append("\n");
        }
        sb.append("\n边列表:\n");
        for (String from : edges.keySet()) {
            sb.append("  ").append(from).append(" -> [条件边]\n");
        }
        return sb.toString();
    }
}
