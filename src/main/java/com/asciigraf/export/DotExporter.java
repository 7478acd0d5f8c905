package com.asciigraf.export;

import com.asciigraf.graph.GraphModels.Graph;
import com.asciigraf.graph.GraphModels.GraphEdge;
import com.asciigraf.graph.GraphModels.GraphNode;
import org.springframework.stereotype.Component;

@Component
public class DotExporter {

    public String toDot(Graph graph) {
        boolean directed = graph.edges().stream().anyMatch(GraphEdge::directed);
        String connector = directed ? " -> " : " -- ";

        StringBuilder sb = new StringBuilder();
        sb.append(directed ? "digraph" : "graph").append(" diagram {\n");
        sb.append("  node [shape=box];\n");

        for (GraphNode node : graph.nodes()) {
            sb.append("  n").append(node.id())
                    .append(" [label=\"").append(escape(node.label())).append("\"];\n");
        }

        if (!graph.edges().isEmpty()) sb.append("\n");
        for (GraphEdge edge : graph.edges()) {
            sb.append("  n").append(edge.source()).append(connector).append("n").append(edge.target());

            StringBuilder attrs = new StringBuilder();
            if (edge.label() != null && !edge.label().isEmpty()) {
                attrs.append("label=\"").append(escape(edge.label())).append("\"");
            }
            if (directed && !edge.directed()) {
                if (attrs.length() > 0) attrs.append(", ");
                attrs.append("dir=none");
            }
            if (attrs.length() > 0) sb.append(" [").append(attrs).append("]");
            sb.append(";\n");
        }

        sb.append("}\n");
        return sb.toString();
    }

    private static String escape(String s) {
        return s == null ? "" : s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
