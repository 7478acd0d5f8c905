package com.asciigraf.service;

import com.asciigraf.config.DiagramOptions;
import com.asciigraf.config.DiagramProperties;
import com.asciigraf.graph.GraphAssembler;
import com.asciigraf.graph.GraphModels.Graph;
import com.asciigraf.grid.Grid;
import com.asciigraf.grid.GridLoader;
import com.asciigraf.grid.GridSize;
import com.asciigraf.parser.ConnectorTracer;
import com.asciigraf.parser.DiagramDtos.ConnectorPath;
import com.asciigraf.parser.DiagramDtos.Diagnostic;
import com.asciigraf.parser.EndpointResolver;
import com.asciigraf.parser.ShapeScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class DiagramParseService {
    private static final Logger log = LoggerFactory.getLogger(DiagramParseService.class);

    private final GridLoader gridLoader;
    private final ShapeScanner shapeScanner;
    private final ConnectorTracer connectorTracer;
    private final EndpointResolver endpointResolver;
    private final GraphAssembler graphAssembler;
    private final DiagramProperties properties;

    public DiagramParseService(GridLoader gridLoader,
                               ShapeScanner shapeScanner,
                               ConnectorTracer connectorTracer,
                               EndpointResolver endpointResolver,
                               GraphAssembler graphAssembler,
                               DiagramProperties properties) {
        this.gridLoader = gridLoader;
        this.shapeScanner = shapeScanner;
        this.connectorTracer = connectorTracer;
        this.endpointResolver = endpointResolver;
        this.graphAssembler = graphAssembler;
        this.properties = properties;
    }

    public ParseResult parse(String content) {
        return parse(content, properties.toOptions());
    }

    public ParseResult parse(String content, DiagramOptions options) {
        GridSize size = gridLoader.measure(content);
        if (size.cellCount() > properties.getMaxCells()) {
            log.warn("Rejecting {}x{} diagram, limit is {} cells", size.width(), size.height(), properties.getMaxCells());
            throw new OversizedDiagramException(size.width(), size.height(), properties.getMaxCells());
        }
        Grid grid = gridLoader.load(content);
        if (grid.isEmpty()) return new ParseResult(Graph.empty(), List.of());

        ShapeScanner.ScanResult scan = shapeScanner.scan(grid, options);
        List<ConnectorPath> paths = connectorTracer.trace(grid, scan.regionMap(), options);
        EndpointResolver.ResolveResult resolved = endpointResolver.resolve(grid, scan, paths, options);
        Graph graph = graphAssembler.assemble(scan.regions(), resolved.edges());

        List<Diagnostic> diagnostics = new ArrayList<>(scan.diagnostics());
        diagnostics.addAll(resolved.diagnostics());

        log.debug("Parsed {}x{} diagram: {} nodes, {} edges, {} diagnostics",
                grid.width(), grid.height(), graph.nodes().size(), graph.edges().size(), diagnostics.size());
        return new ParseResult(graph, List.copyOf(diagnostics));
    }

    public DiagramOptions defaultOptions() {
        return properties.toOptions();
    }

    public record ParseResult(Graph graph, List<Diagnostic> diagnostics) {}
}
