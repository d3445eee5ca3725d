package com.example.harmonicmixer.sequence.graph;

import com.example.harmonicmixer.sequence.graph.edges.AfterStartEdge;
import com.example.harmonicmixer.sequence.graph.edges.ContinueSequenceEdge;
import com.example.harmonicmixer.sequence.graph.nodes.ClassicSelectNode;
import com.example.harmonicmixer.sequence.graph.nodes.ClassicStartNode;
import com.example.harmonicmixer.sequence.graph.nodes.FinalizeNode;
import com.example.harmonicmixer.sequence.graph.nodes.LoopControlNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 经典贪心策略：只看和声转换分，可选按能量升/降加权
 *
 * classic_start → loop_control ─[结束]→ finalize → END
 *                      ↕
 *               classic_select
 */
@Slf4j
@Component
public class ClassicSequenceStrategy implements SequenceStrategy {

    static final String CLASSIC_START = "classic_start";
    static final String LOOP_CONTROL = "loop_control";
    static final String CLASSIC_SELECT = "classic_select";
    static final String FINALIZE = "finalize";

    @Override
    public void configure(SequenceGraph graph, SequenceGraphBuilder builder) {
        graph.addNode(CLASSIC_START, new ClassicStartNode());
        graph.addNode(LOOP_CONTROL, new LoopControlNode());
        graph.addNode(CLASSIC_SELECT, new ClassicSelectNode(builder.getCandidateScorer()));
        graph.addNode(FINALIZE, new FinalizeNode());

        graph.addEdge(CLASSIC_START, new AfterStartEdge(LOOP_CONTROL, FINALIZE));
        graph.addEdge(LOOP_CONTROL, new ContinueSequenceEdge(CLASSIC_SELECT, FINALIZE));
        graph.addEdge(CLASSIC_SELECT, (state, result) -> LOOP_CONTROL);

        graph.setStart(CLASSIC_START);

        log.debug("[ClassicStrategy] 图结构:\n{}", graph.visualize());
    }
}
