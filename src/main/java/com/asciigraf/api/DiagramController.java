package com.asciigraf.api;

import com.asciigraf.config.DiagramOptions;
import com.asciigraf.export.DotExporter;
import com.asciigraf.service.DiagramParseService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/diagrams")
public class DiagramController {
    static final MediaType GRAPHVIZ = MediaType.parseMediaType("text/vnd.graphviz");

    private final DiagramParseService parseService;
    private final DotExporter dotExporter;

    public DiagramController(DiagramParseService parseService, DotExporter dotExporter) {
        this.parseService = parseService;
        this.dotExporter = dotExporter;
    }

    @PostMapping("/parse")
    public ResponseEntity<DiagramParseService.ParseResult> parse(@RequestBody ParseRequest request) {
        return ResponseEntity.ok(parseService.parse(request.content(), options(request)));
    }

    @PostMapping("/dot")
    public ResponseEntity<String> dot(@RequestBody ParseRequest request) {
        var result = parseService.parse(request.content(), options(request));
        return ResponseEntity.ok().contentType(GRAPHVIZ).body(dotExporter.toDot(result.graph()));
    }

    private DiagramOptions options(ParseRequest request) {
        DiagramOptions options = parseService.defaultOptions();
        if (request.labelMargin() != null) options = options.withLabelMargin(request.labelMargin());
        if (request.endpointTolerance() != null) options = options.withEndpointTolerance(request.endpointTolerance());
        return options;
    }

    public record ParseRequest(String content, Integer labelMargin, Integer endpointTolerance) {}
}
