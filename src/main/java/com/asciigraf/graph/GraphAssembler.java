package com.asciigraf.graph;

import com.asciigraf.graph.GraphModels.*;
import com.asciigraf.parser.DiagramDtos.CandidateEdge;
import com.asciigraf.parser.DiagramDtos.NodeRegion;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class GraphAssembler {

    public Graph assemble(List<NodeRegion> regions, List<CandidateEdge> candidates) {
        List<NodeRegion> discovered = regions.stream()
                .sorted(Comparator.comparing(NodeRegion::topLeft))
                .toList();

        Map<Integer, Integer> idByRegion = new HashMap<>();
        List<GraphNode> nodes = new ArrayList<>();
        for (NodeRegion region : discovered) {
            int id = nodes.size();
            idByRegion.put(region.index(), id);
            nodes.add(new GraphNode(id, region.label(), region.top(), region.left()));
        }

        Map<EdgeKey, GraphEdge> edges = new LinkedHashMap<>();
        for (CandidateEdge candidate : candidates) {
            Integer source = idByRegion.get(candidate.sourceRegion());
            Integer target = idByRegion.get(candidate.targetRegion());
            if (source == null || target == null) {
                throw new IllegalStateException("Candidate edge references unknown region: " + candidate);
            }
            EdgeKey key = new EdgeKey(candidate.pathIndex(), Math.min(source, target), Math.max(source, target),
                    candidate.directed(), candidate.label());
            edges.putIfAbsent(key, new GraphEdge(source, target, candidate.directed(), candidate.label(), candidate.length()));
        }
        return new Graph(List.copyOf(nodes), List.copyOf(edges.values()));
    }

    private record EdgeKey(int pathIndex, int low, int high, boolean directed, String label) {}
}
