package com.asciigraf;

import com.asciigraf.export.DotExporter;
import com.asciigraf.graph.GraphModels.Graph;
import com.asciigraf.graph.GraphModels.GraphEdge;
import com.asciigraf.graph.GraphModels.GraphNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DotExporterTest {
    private final DotExporter exporter = new DotExporter();

    private final List<GraphNode> nodes = List.of(
            new GraphNode(0, "A", 0, 0),
            new GraphNode(1, "B \"quoted\"", 0, 10),
            new GraphNode(2, "C", 4, 0));

    @Test
    void writesUndirectedGraph() {
        Graph graph = new Graph(nodes, List.of(new GraphEdge(0, 1, false, "link", 5)));

        assertEquals("""
                graph diagram {
                  node [shape=box];
                  n0 [label="A"];
                  n1 [label="B \\"quoted\\""];
                  n2 [label="C"];

                  n0 -- n1 [label="link"];
                }
                """, exporter.toDot(graph));
    }

    @Test
    void mixedGraphBecomesDigraphWithUndirectedEdgesMarked() {
        Graph graph = new Graph(nodes, List.of(
                new GraphEdge(0, 1, true, null, 5),
                new GraphEdge(1, 2, false, "x", 3),
                new GraphEdge(2, 0, false, null, 4)));

        String dot = exporter.toDot(graph);
        assertTrue(dot.startsWith("digraph diagram {\n"));
        assertTrue(dot.contains("  n0 -> n1;\n"));
        assertTrue(dot.contains("  n1 -> n2 [label=\"x\", dir=none];\n"));
        assertTrue(dot.contains("  n2 -> n0 [dir=none];\n"));
    }

    @Test
    void emptyGraphHasNoEdgeSection() {
        assertEquals("graph diagram {\n  node [shape=box];\n}\n", exporter.toDot(Graph.empty()));
    }
}
