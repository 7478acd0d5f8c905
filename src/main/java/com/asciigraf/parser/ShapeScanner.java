package com.asciigraf.parser;

import com.asciigraf.config.DiagramOptions;
import com.asciigraf.config.GlyphSet;
import com.asciigraf.grid.Cell;
import com.asciigraf.grid.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.asciigraf.parser.DiagramDtos.*;

@Component
public class ShapeScanner {
    private static final Logger log = LoggerFactory.getLogger(ShapeScanner.class);

    public ScanResult scan(Grid grid, DiagramOptions options) {
        GlyphSet glyphs = options.glyphs();
        RegionMap map = new RegionMap(grid.height(), grid.width());
        List<NodeRegion> regions = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<Cell> released = new HashSet<>();

        for (int row = 0; row < grid.height(); row++) {
            for (int col = 0; col < grid.width(); col++) {
                if (map.ownerAt(row, col) != RegionMap.NONE || !glyphs.isCorner(grid.charAt(row, col))) continue;
                if (released.contains(new Cell(row, col))) continue;

                Rect rect = findRectangle(grid, glyphs, map, row, col, grid.height() - 1, grid.width() - 1, RegionMap.NONE);
                if (rect == null) {
                    if (looksLikeBorderStart(grid, glyphs, row, col)) {
                        diagnostics.add(new Diagnostic(MALFORMED_REGION, "Border starting here does not close into a rectangle", row, col));
                        log.debug("Unclosed border at ({}, {}) left to the connector tracer", row, col);
                    }
                    continue;
                }

                int index = regions.size();
                rect.forEachCell((r, c) -> map.assign(r, c, index));
                releaseNested(grid, glyphs, map, rect, index, released, diagnostics);
                regions.add(new NodeRegion(index, rect.top, rect.left, rect.bottom, rect.right, label(grid, map, rect, index)));
            }
        }
        return new ScanResult(regions, map, diagnostics);
    }

    private Rect findRectangle(Grid grid, GlyphSet glyphs, RegionMap map,
                               int top, int left, int maxRow, int maxCol, int owner) {
        for (int right = left + 1; right <= maxCol && onBorder(grid, map, owner, top, right) && glyphs.isHorizontalBorder(grid.charAt(top, right)); right++) {
            if (right < left + 2 || !glyphs.isCorner(grid.charAt(top, right))) continue;

            for (int bottom = top + 1; bottom <= maxRow && onBorder(grid, map, owner, bottom, right) && glyphs.isVerticalBorder(grid.charAt(bottom, right)); bottom++) {
                if (bottom < top + 2 || !glyphs.isCorner(grid.charAt(bottom, right))) continue;

                Rect rect = new Rect(top, left, bottom, right);
                if (closes(grid, glyphs, map, owner, rect)) return rect;
            }
        }
        return null;
    }

    private boolean closes(Grid grid, GlyphSet glyphs, RegionMap map, int owner, Rect rect) {
        if (!glyphs.isCorner(grid.charAt(rect.bottom, rect.left)) || !onBorder(grid, map, owner, rect.bottom, rect.left)) return false;
        for (int row = rect.top + 1; row < rect.bottom; row++) {
            if (!glyphs.isVerticalBorder(grid.charAt(row, rect.left)) || !onBorder(grid, map, owner, row, rect.left)) return false;
        }
        for (int col = rect.left + 1; col < rect.right; col++) {
            if (!glyphs.isHorizontalBorder(grid.charAt(rect.bottom, col)) || !onBorder(grid, map, owner, rect.bottom, col)) return false;
        }
        for (int row = rect.top + 1; row < rect.bottom; row++) {
            for (int col = rect.left + 1; col < rect.right; col++) {
                if (map.ownerAt(row, col) != owner) return false;
            }
        }
        return true;
    }

    private boolean onBorder(Grid grid, RegionMap map, int owner, int row, int col) {
        return row < grid.height() && col < grid.width() && map.ownerAt(row, col) == owner;
    }

    private boolean looksLikeBorderStart(Grid grid, GlyphSet glyphs, int row, int col) {
        if (!glyphs.isVerticalBorder(grid.charAt(row + 1, col))) return false;
        for (int c = col + 1; c < grid.width() && glyphs.isHorizontalBorder(grid.charAt(row, c)); c++) {
            if (c >= col + 2 && glyphs.isCorner(grid.charAt(row, c))) return true;
        }
        return false;
    }

    private void releaseNested(Grid grid, GlyphSet glyphs, RegionMap map, Rect outer, int index,
                               Set<Cell> released, List<Diagnostic> diagnostics) {
        for (int row = outer.top + 1; row < outer.bottom; row++) {
            for (int col = outer.left + 1; col < outer.right; col++) {
                if (map.ownerAt(row, col) != index || !glyphs.isCorner(grid.charAt(row, col))) continue;

                Rect inner = findRectangle(grid, glyphs, map, row, col, outer.bottom - 1, outer.right - 1, index);
                if (inner == null) continue;

                inner.forEachBorderCell((r, c) -> {
                    map.assign(r, c, RegionMap.NONE);
                    released.add(new Cell(r, c));
                });
                diagnostics.add(new Diagnostic(NESTED_REGION, "Border nested inside another node is not a node", row, col));
                log.debug("Nested border at ({}, {}) inside region {} released", row, col, index);
            }
        }
    }

    private String label(Grid grid, RegionMap map, Rect rect, int index) {
        List<String> lines = new ArrayList<>();
        for (int row = rect.top + 1; row < rect.bottom; row++) {
            StringBuilder line = new StringBuilder();
            for (int col = rect.left + 1; col < rect.right; col++) {
                line.append(map.ownerAt(row, col) == index ? grid.charAt(row, col) : Grid.BLANK);
            }
            String trimmed = line.toString().trim();
            if (!trimmed.isEmpty()) lines.add(trimmed);
        }
        return String.join(" ", lines);
    }

    public record ScanResult(List<NodeRegion> regions, RegionMap regionMap, List<Diagnostic> diagnostics) {}

    private record Rect(int top, int left, int bottom, int right) {
        void forEachCell(CellAction action) {
            for (int row = top; row <= bottom; row++) {
                for (int col = left; col <= right; col++) action.apply(row, col);
            }
        }

        void forEachBorderCell(CellAction action) {
            forEachCell((row, col) -> {
                if (row == top || row == bottom || col == left || col == right) action.apply(row, col);
            });
        }
    }

    @FunctionalInterface
    private interface CellAction {
        void apply(int row, int col);
    }
}
