package com.asciigraf.graph;

import java.util.List;

public class GraphModels {
    public record Graph(List<GraphNode> nodes, List<GraphEdge> edges) {
        public static Graph empty() {
            return new Graph(List.of(), List.of());
        }
    }

    public record GraphNode(int id, String label, int row, int col) {}

    public record GraphEdge(int source, int target, boolean directed, String label, int length) {}
}
