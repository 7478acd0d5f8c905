package com.asciigraf;

import com.asciigraf.graph.GraphAssembler;
import com.asciigraf.graph.GraphModels.Graph;
import com.asciigraf.graph.GraphModels.GraphEdge;
import com.asciigraf.graph.GraphModels.GraphNode;
import com.asciigraf.parser.DiagramDtos.CandidateEdge;
import com.asciigraf.parser.DiagramDtos.NodeRegion;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphAssemblerTest {
    private final GraphAssembler assembler = new GraphAssembler();

    private final NodeRegion upperRight = new NodeRegion(0, 0, 10, 2, 14, "B");
    private final NodeRegion lower = new NodeRegion(1, 4, 0, 6, 4, "C");
    private final NodeRegion upperLeft = new NodeRegion(2, 0, 0, 2, 4, "A");

    @Test
    void numbersNodesInReadingOrderOfTheirCorners() {
        Graph graph = assembler.assemble(List.of(upperRight, lower, upperLeft), List.of());

        assertEquals(List.of(
                new GraphNode(0, "A", 0, 0),
                new GraphNode(1, "B", 0, 10),
                new GraphNode(2, "C", 4, 0)), graph.nodes());

        assertTrue(graph.edges().isEmpty());
    }

    @Test
    void translatesRegionIndexesToNodeIds() {
        Graph graph = assembler.assemble(List.of(upperRight, lower, upperLeft),
                List.of(new CandidateEdge(0, 2, 1, true, "go", 6)));

        assertEquals(List.of(new GraphEdge(0, 2, true, "go", 6)), graph.edges());
    }

    @Test
    void collapsesRepeatsFromOneConnector() {
        Graph graph = assembler.assemble(List.of(upperLeft, upperRight), List.of(
                new CandidateEdge(4, 2, 0, false, null, 5),
                new CandidateEdge(4, 0, 2, false, null, 5)));

        assertEquals(1, graph.edges().size());
    }

    @Test
    void keepsParallelConnectorsApart() {
        Graph graph = assembler.assemble(List.of(upperLeft, upperRight), List.of(
                new CandidateEdge(0, 2, 0, false, null, 5),
                new CandidateEdge(1, 2, 0, false, null, 5)));

        assertEquals(2, graph.edges().size());
        assertEquals(graph.edges().get(0), graph.edges().get(1));
    }

    @Test
    void rejectsEdgeToUnknownRegion() {
        assertThrows(IllegalStateException.class, () -> assembler.assemble(List.of(upperLeft),
                List.of(new CandidateEdge(0, 2, 7, false, null, 3))));
    }

    @Test
    void graphOffersNoWayBackToText() {
        for (Class<?> type : List.of(Graph.class, GraphNode.class, GraphEdge.class)) {
            List<String> textual = Arrays.stream(type.getDeclaredMethods())
                    .filter(m -> Modifier.isPublic(m.getModifiers()))
                    .filter(m -> m.getReturnType() == String.class || m.getReturnType() == char[].class)
                    .map(Method::getName)
                    .filter(name -> !name.equals("toString") && !name.equals("label"))
                    .toList();
            assertEquals(List.of(), textual, type.getSimpleName());
        }
    }
}
