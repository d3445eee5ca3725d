package com.example.harmonicmixer.sequence.graph;

import com.example.harmonicmixer.sequence.graph.edges.AfterStartEdge;
import com.example.harmonicmixer.sequence.graph.edges.ContinueSequenceEdge;
import com.example.harmonicmixer.sequence.graph.edges.ThresholdEdge;
import com.example.harmonicmixer.sequence.graph.nodes.FallbackSelectionNode;
import com.example.harmonicmixer.sequence.graph.nodes.FinalizeNode;
import com.example.harmonicmixer.sequence.graph.nodes.LoopControlNode;
import com.example.harmonicmixer.sequence.graph.nodes.ScoreCandidatesNode;
import com.example.harmonicmixer.sequence.graph.nodes.SelectCurveNode;
import com.example.harmonicmixer.sequence.graph.nodes.SelectStartNode;
import com.example.harmonicmixer.sequence.graph.nodes.TrackAcceptedNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 情境选曲策略
 *
 * select_curve → select_start ─[无起始曲目]→ finalize
 *                      ↓
 *               loop_control ─[结束]→ finalize → END
 *                      ↓
 *              score_candidates ─[达到阈值]→ track_accepted ─┐
 *                      ↓                                      │
 *             fallback_selection ─────────────────────→ loop_control
 */
@Slf4j
@Component
public class ContextualSequenceStrategy implements SequenceStrategy {

    static final String SELECT_CURVE = "select_curve";
    static final String SELECT_START = "select_start";
    static final String LOOP_CONTROL = "loop_control";
    static final String SCORE_CANDIDATES = "score_candidates";
    static final String FINALIZE = "finalize";

    @Override
    public void configure(SequenceGraph graph, SequenceGraphBuilder builder) {
        // 1. 添加所有节点
        graph.addNode(SELECT_CURVE, new SelectCurveNode(builder.getCurveService()));
        graph.addNode(SELECT_START, new SelectStartNode(builder.getCandidateScorer()));
        graph.addNode(LOOP_CONTROL, new LoopControlNode());
        graph.addNode(SCORE_CANDIDATES, new ScoreCandidatesNode(builder.getCandidateScorer()));
        graph.addNode(ThresholdEdge.ACCEPTED, new TrackAcceptedNode());
        graph.addNode(ThresholdEdge.FALLBACK, new FallbackSelectionNode(builder.getCandidateScorer()));
        graph.addNode(FINALIZE, new FinalizeNode());

        // 2. 添加条件边
        graph.addEdge(SELECT_CURVE, (state, result) -> SELECT_START);
        graph.addEdge(SELECT_START, new AfterStartEdge(LOOP_CONTROL, FINALIZE));
        graph.addEdge(LOOP_CONTROL, new ContinueSequenceEdge(SCORE_CANDIDATES, FINALIZE));
        graph.addEdge(SCORE_CANDIDATES, new ThresholdEdge());
        graph.addEdge(ThresholdEdge.ACCEPTED, (state, result) -> LOOP_CONTROL);
        graph.addEdge(ThresholdEdge.FALLBACK, (state, result) -> LOOP_CONTROL);
        // finalize -> END（终止节点，无边）

        // 3. 设置起始节点
        graph.setStart(SELECT_CURVE);

        log.debug("[ContextualStrategy] 图结构:\n{}", graph.visualize());
    }
}
