package com.example.harmonicmixer.sequence.graph;

import com.example.harmonicmixer.context.PlaylistContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SequenceGraphTest {

    @Test
    @DisplayName("follows conditional edges until a node without an outgoing edge")
    void runsUntilTerminalNode() {
        List<String> visited = new ArrayList<>();
        SequenceGraph graph = new SequenceGraph(100)
            .addNode("a", state -> { visited.add("a"); return SequenceNode.NodeResult.success(); })
            .addNode("b", state -> { visited.add("b"); return SequenceNode.NodeResult.failure("stop"); })
            .addNode("c", state -> { visited.add("c"); return SequenceNode.NodeResult.success(); })
            .addEdge("a", (state, result) -> "b")
            .addEdge("b", (state, result) -> result.isSuccess() ? "a" : "c")
            .setStart("a");

        int executed = graph.execute(new PlaylistContext());

        assertEquals(List.of("a", "b", "c"), visited);
        assertEquals(3, executed);
    }

    @Test
    void edgeReturningNullEndsExecution() {
        SequenceGraph graph = new SequenceGraph(100)
            .addNode("a", state -> SequenceNode.NodeResult.success())
            .addEdge("a", (state, result) -> null)
            .setStart("a");

        assertEquals(1, graph.execute(new PlaylistContext()));
    }

    @Test
    void iterationCapStopsEndlessLoops() {
        SequenceGraph graph = new SequenceGraph(10)
            .addNode("loop", state -> SequenceNode.NodeResult.success())
            .addEdge("loop", (state, result) -> "loop")
            .setStart("loop");

        assertEquals(10, graph.execute(new PlaylistContext()));
    }

    @Test
    void missingStartOrNodeIsAnError() {
        assertThrows(IllegalStateException.class, () -> new SequenceGraph(10).execute(new PlaylistContext()));

        SequenceGraph graph = new SequenceGraph(10)
            .addNode("a", state -> SequenceNode.NodeResult.success())
            .addEdge("a", (state, result) -> "ghost")
            .setStart("a");
        assertThrows(IllegalStateException.class, () -> graph.execute(new PlaylistContext()));
    }

    @Test
    void visualizeListsNodes() {
        SequenceGraph graph = new SequenceGraph(10)
            .addNode("select_curve", state -> SequenceNode.NodeResult.success())
            .setStart("select_curve");
        assertTrue(graph.visualize().contains("select_curve"));
    }
}
