package com.asciigraf.parser;

import com.asciigraf.config.DiagramOptions;
import com.asciigraf.grid.Cell;
import com.asciigraf.grid.Direction;
import com.asciigraf.grid.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

import static com.asciigraf.parser.DiagramDtos.*;

@Component
public class EndpointResolver {
    private static final Logger log = LoggerFactory.getLogger(EndpointResolver.class);

    public ResolveResult resolve(Grid grid, ShapeScanner.ScanResult scan, List<ConnectorPath> paths, DiagramOptions options) {
        RegionMap regionMap = scan.regionMap();
        List<Diagnostic> diagnostics = new ArrayList<>();

        Map<Integer, List<Attachment>> attachmentsByPath = new LinkedHashMap<>();
        for (ConnectorPath path : paths) {
            attachmentsByPath.put(path.index(), attachments(grid, regionMap, path, options.endpointTolerance(), diagnostics));
        }

        Set<Cell> structural = paths.stream()
                .filter(p -> !attachmentsByPath.get(p.index()).isEmpty())
                .flatMap(p -> p.cells().stream())
                .collect(Collectors.toSet());

        List<CandidateEdge> edges = new ArrayList<>();
        for (ConnectorPath path : paths) {
            List<Attachment> attachments = attachmentsByPath.get(path.index());
            SortedMap<Integer, Boolean> arrowedByRegion = new TreeMap<>();
            attachments.forEach(a -> arrowedByRegion.merge(a.regionIndex(), a.arrowhead(), Boolean::logicalOr));

            if (arrowedByRegion.size() < 2) {
                Cell first = path.cells().get(0);
                diagnostics.add(new Diagnostic(DANGLING_CONNECTOR,
                        "Connector touches " + arrowedByRegion.size() + " node(s) and produces no edge", first.row(), first.col()));
                continue;
            }

            String label = label(grid, regionMap, path, structural, options.labelMargin());
            List<Integer> touched = List.copyOf(arrowedByRegion.keySet());
            for (int i = 0; i < touched.size(); i++) {
                for (int j = i + 1; j < touched.size(); j++) {
                    int a = touched.get(i);
                    int b = touched.get(j);
                    boolean arrowA = arrowedByRegion.get(a);
                    boolean arrowB = arrowedByRegion.get(b);
                    if (arrowA != arrowB) {
                        edges.add(arrowB
                                ? new CandidateEdge(path.index(), a, b, true, label, path.length())
                                : new CandidateEdge(path.index(), b, a, true, label, path.length()));
                    } else {
                        edges.add(new CandidateEdge(path.index(), a, b, false, label, path.length()));
                    }
                }
            }
        }
        log.debug("Resolved {} candidate edges from {} paths", edges.size(), paths.size());
        return new ResolveResult(edges, diagnostics);
    }

    private List<Attachment> attachments(Grid grid, RegionMap regionMap, ConnectorPath path, int tolerance, List<Diagnostic> diagnostics) {
        List<Attachment> attachments = new ArrayList<>();
        for (Cell cell : path.cells()) {
            if (!path.isEndpoint(cell) && !path.isJunction(cell)) continue;

            GlyphRole role = path.role(cell);
            Set<Integer> regionsHere = new LinkedHashSet<>();
            for (Direction side : Direction.values()) {
                if (!role.openSides().contains(side) || path.isLinked(cell, side)) continue;

                int region = regionBeyond(grid, regionMap, cell, side, tolerance);
                if (region == RegionMap.NONE) continue;
                attachments.add(new Attachment(cell, side, region, role.isArrowhead()));
                regionsHere.add(region);
            }
            if (regionsHere.size() > 1 && path.isEndpoint(cell) && path.length() > 1) {
                diagnostics.add(new Diagnostic(AMBIGUOUS_ENDPOINT,
                        "Connector end meets " + regionsHere.size() + " nodes; connecting all of them", cell.row(), cell.col()));
                log.debug("Ambiguous endpoint at {} fans out to regions {}", cell, regionsHere);
            }
        }
        return attachments;
    }

    private int regionBeyond(Grid grid, RegionMap regionMap, Cell cell, Direction side, int tolerance) {
        Cell next = cell.step(side);
        for (int gap = 0; gap <= tolerance && grid.contains(next); gap++) {
            int owner = regionMap.ownerAt(next);
            if (owner != RegionMap.NONE) return owner;
            if (!grid.isBlank(next)) return RegionMap.NONE;
            next = next.step(side);
        }
        return RegionMap.NONE;
    }

    private String label(Grid grid, RegionMap regionMap, ConnectorPath path, Set<Cell> structural, int margin) {
        if (!path.inlineLabels().isEmpty()) {
            return path.inlineLabels().stream()
                    .sorted(Comparator.comparing(InlineLabel::start))
                    .map(InlineLabel::text)
                    .collect(Collectors.joining(" "));
        }

        Cell mid = path.midpoint();
        SortedMap<Cell, String> fragments = new TreeMap<>();
        Set<Cell> covered = new HashSet<>();
        int top = Math.max(0, mid.row() - margin);
        int bottom = (int) Math.min(grid.height() - 1L, (long) mid.row() + margin);
        int left = Math.max(0, mid.col() - margin);
        int right = (int) Math.min(grid.width() - 1L, (long) mid.col() + margin);
        for (int row = top; row <= bottom; row++) {
            for (int col = left; col <= right; col++) {
                Cell seed = new Cell(row, col);
                if (covered.contains(seed) || !isText(grid, regionMap, structural, seed)) continue;

                int start = col;
                while (continuesRun(grid, regionMap, structural, row, start, -1)) start--;
                int end = col;
                while (continuesRun(grid, regionMap, structural, row, end, 1)) end++;
                for (int c = start; c <= end; c++) covered.add(new Cell(row, c));
                fragments.put(new Cell(row, start), grid.text(row, start, end + 1).trim());
            }
        }
        if (fragments.isEmpty()) return null;
        return String.join(" ", fragments.values());
    }

    private boolean continuesRun(Grid grid, RegionMap regionMap, Set<Cell> structural, int row, int col, int step) {
        Cell next = new Cell(row, col + step);
        if (isText(grid, regionMap, structural, next)) return true;
        return isGap(grid, regionMap, next) && isText(grid, regionMap, structural, new Cell(row, col + 2 * step));
    }

    private boolean isText(Grid grid, RegionMap regionMap, Set<Cell> structural, Cell cell) {
        return grid.contains(cell) && !grid.isBlank(cell) && !regionMap.isClaimed(cell) && !structural.contains(cell);
    }

    private boolean isGap(Grid grid, RegionMap regionMap, Cell cell) {
        return grid.contains(cell) && grid.isBlank(cell) && !regionMap.isClaimed(cell);
    }

    public record ResolveResult(List<CandidateEdge> edges, List<Diagnostic> diagnostics) {}
}
