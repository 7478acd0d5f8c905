package com.asciigraf.parser;

import com.asciigraf.config.DiagramOptions;
import com.asciigraf.config.Glyph;
import com.asciigraf.config.GlyphSet;
import com.asciigraf.grid.Cell;
import com.asciigraf.grid.Direction;
import com.asciigraf.grid.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

import static com.asciigraf.parser.DiagramDtos.*;

@Component
public class ConnectorTracer {
    private static final Logger log = LoggerFactory.getLogger(ConnectorTracer.class);

    private static final int H = 0;
    private static final int V = 1;

    public List<ConnectorPath> trace(Grid grid, RegionMap regions, DiagramOptions options) {
        int height = grid.height();
        int width = grid.width();
        if (height == 0 || width == 0) return List.of();

        GlyphSet glyphs = options.glyphs();
        Glyph[][] kinds = new Glyph[height][width];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                kinds[row][col] = regions.ownerAt(row, col) == RegionMap.NONE ? glyphs.classify(grid.charAt(row, col)) : Glyph.TEXT;
            }
        }

        boolean[][] labelCells = new boolean[height][width];
        boolean[][] verticalLabelCells = new boolean[height][width];
        List<InlineLabel> inlineLabels = findInlineLabels(grid, regions, glyphs, kinds, labelCells, verticalLabelCells);
        rejectLooseArrowheads(kinds, labelCells, verticalLabelCells);

        boolean[][] hPort = new boolean[height][width];
        boolean[][] vPort = new boolean[height][width];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                Glyph kind = kinds[row][col];
                hPort[row][col] = labelCells[row][col] || kind.hasHorizontalPort()
                        || (kind == Glyph.VERTICAL && intrinsicH(kinds, labelCells, row, col - 1) && intrinsicH(kinds, labelCells, row, col + 1));
                vPort[row][col] = verticalLabelCells[row][col] || kind.hasVerticalPort()
                        || (kind == Glyph.HORIZONTAL && intrinsicV(kinds, verticalLabelCells, row - 1, col)
                        && intrinsicV(kinds, verticalLabelCells, row + 1, col));
            }
        }

        UnionFind ports = new UnionFind(height * width * 2);
        List<Link> links = new ArrayList<>();
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                if (kinds[row][col] == Glyph.JUNCTION) ports.union(port(row, col, H, width), port(row, col, V, width));
                if (hPort[row][col] && col + 1 < width && hPort[row][col + 1]) {
                    ports.union(port(row, col, H, width), port(row, col + 1, H, width));
                    links.add(new Link(new Cell(row, col), Direction.RIGHT, H));
                }
                if (vPort[row][col] && row + 1 < height && vPort[row + 1][col]) {
                    ports.union(port(row, col, V, width), port(row + 1, col, V, width));
                    links.add(new Link(new Cell(row, col), Direction.DOWN, V));
                }
            }
        }

        Map<Integer, PathBuilder> builders = new LinkedHashMap<>();
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                Cell cell = new Cell(row, col);
                if (hPort[row][col]) builders.computeIfAbsent(ports.find(port(row, col, H, width)), k -> new PathBuilder()).add(cell, H);
                if (vPort[row][col]) builders.computeIfAbsent(ports.find(port(row, col, V, width)), k -> new PathBuilder()).add(cell, V);
            }
        }
        for (Link link : links) {
            Cell from = link.from();
            PathBuilder builder = builders.get(ports.find(port(from.row(), from.col(), link.axis(), width)));
            builder.link(from, link.side());
            builder.link(from.step(link.side()), link.side().opposite());
        }
        for (InlineLabel label : inlineLabels) {
            Cell start = label.start();
            int axis = verticalLabelCells[start.row()][start.col()] ? V : H;
            builders.get(ports.find(port(start.row(), start.col(), axis, width))).inlineLabels.add(label);
        }

        List<ConnectorPath> paths = new ArrayList<>();
        for (PathBuilder builder : builders.values()) {
            paths.add(builder.build(paths.size(), kinds, labelCells, verticalLabelCells));
        }
        log.debug("Traced {} connector paths on a {}x{} grid", paths.size(), width, height);
        return paths;
    }

    private List<InlineLabel> findInlineLabels(Grid grid, RegionMap regions, GlyphSet glyphs, Glyph[][] kinds,
                                               boolean[][] labelCells, boolean[][] verticalLabelCells) {
        List<InlineLabel> labels = new ArrayList<>();
        for (int row = 0; row < grid.height(); row++) {
            for (int col = 0; col < grid.width(); col++) {
                if (grid.charAt(row, col) != glyphs.labelOpen() || regions.ownerAt(row, col) != RegionMap.NONE) continue;

                int close = col + 1;
                while (close < grid.width() && regions.ownerAt(row, close) == RegionMap.NONE
                        && grid.charAt(row, close) != glyphs.labelClose() && grid.charAt(row, close) != glyphs.labelOpen()) {
                    close++;
                }
                if (close >= grid.width() || grid.charAt(row, close) != glyphs.labelClose()) continue;

                String text = grid.text(row, col + 1, close).trim();
                if (text.isEmpty()) continue;

                Cell start;
                if (isLine(kinds, row, col - 1) && isLine(kinds, row, close + 1)) {
                    for (int c = col; c <= close; c++) labelCells[row][c] = true;
                    start = new Cell(row, col);
                } else {
                    int through = verticalStroke(kinds, row, col, close);
                    if (through < 0) continue;
                    verticalLabelCells[row][through] = true;
                    start = new Cell(row, through);
                }
                for (int c = col; c <= close; c++) kinds[row][c] = Glyph.TEXT;
                labels.add(new InlineLabel(start, text));
                col = close;
            }
        }
        return labels;
    }

    private int verticalStroke(Glyph[][] kinds, int row, int from, int to) {
        if (row == 0 || row + 1 >= kinds.length) return -1;
        for (int col = from; col <= to; col++) {
            Glyph above = kinds[row - 1][col];
            Glyph below = kinds[row + 1][col];
            boolean fromAbove = above == Glyph.VERTICAL || above == Glyph.JUNCTION || above == Glyph.ARROW_UP;
            boolean intoBelow = below == Glyph.VERTICAL || below == Glyph.JUNCTION || below == Glyph.ARROW_DOWN;
            if (fromAbove && intoBelow) return col;
        }
        return -1;
    }

    private boolean isLine(Glyph[][] kinds, int row, int col) {
        if (col < 0 || col >= kinds[row].length) return false;
        return kinds[row][col] == Glyph.HORIZONTAL || kinds[row][col] == Glyph.JUNCTION;
    }

    private void rejectLooseArrowheads(Glyph[][] kinds, boolean[][] labelCells, boolean[][] verticalLabelCells) {
        for (int row = 0; row < kinds.length; row++) {
            for (int col = 0; col < kinds[row].length; col++) {
                Direction pointing = kinds[row][col].pointing();
                if (pointing == null) continue;

                Direction tail = pointing.opposite();
                int r = row + tail.dRow();
                int c = col + tail.dCol();
                boolean fed = pointing.isHorizontal()
                        ? isLine(kinds, r, c) || (inside(kinds, r, c) && labelCells[r][c])
                        : inside(kinds, r, c) && (kinds[r][c] == Glyph.VERTICAL || kinds[r][c] == Glyph.JUNCTION || verticalLabelCells[r][c]);
                if (!fed) kinds[row][col] = Glyph.TEXT;
            }
        }
    }

    private boolean intrinsicH(Glyph[][] kinds, boolean[][] labelCells, int row, int col) {
        return inside(kinds, row, col) && (labelCells[row][col] || kinds[row][col].hasHorizontalPort());
    }

    private boolean intrinsicV(Glyph[][] kinds, boolean[][] verticalLabelCells, int row, int col) {
        return inside(kinds, row, col) && (verticalLabelCells[row][col] || kinds[row][col].hasVerticalPort());
    }

    private static boolean inside(Glyph[][] kinds, int row, int col) {
        return row >= 0 && row < kinds.length && col >= 0 && col < kinds[row].length;
    }

    private static int port(int row, int col, int axis, int width) {
        return (row * width + col) * 2 + axis;
    }

    private record Link(Cell from, Direction side, int axis) {}

    private static final class PathBuilder {
        private final Map<Cell, Set<Integer>> axes = new LinkedHashMap<>();
        private final Map<Cell, EnumSet<Direction>> links = new HashMap<>();
        private final List<InlineLabel> inlineLabels = new ArrayList<>();

        void add(Cell cell, int axis) {
            axes.computeIfAbsent(cell, k -> new HashSet<>()).add(axis);
            links.computeIfAbsent(cell, k -> EnumSet.noneOf(Direction.class));
        }

        void link(Cell cell, Direction side) {
            links.get(cell).add(side);
        }

        ConnectorPath build(int index, Glyph[][] kinds, boolean[][] labelCells, boolean[][] verticalLabelCells) {
            Map<Cell, GlyphRole> roles = new HashMap<>();
            for (Cell cell : axes.keySet()) {
                boolean label = labelCells[cell.row()][cell.col()] || verticalLabelCells[cell.row()][cell.col()];
                roles.put(cell, role(cell, kinds[cell.row()][cell.col()], label));
            }

            Map<Cell, Set<Direction>> frozenLinks = new HashMap<>();
            links.forEach((cell, sides) -> frozenLinks.put(cell, Collections.unmodifiableSet(EnumSet.copyOf(sides))));

            return new ConnectorPath(index, order(), Map.copyOf(roles), Map.copyOf(frozenLinks), List.copyOf(inlineLabels));
        }

        private GlyphRole role(Cell cell, Glyph kind, boolean label) {
            if (label) return GlyphRole.LABEL;
            Set<Direction> sides = links.get(cell);
            return switch (kind) {
                case ARROW_UP -> GlyphRole.ARROW_UP;
                case ARROW_DOWN -> GlyphRole.ARROW_DOWN;
                case ARROW_LEFT -> GlyphRole.ARROW_LEFT;
                case ARROW_RIGHT -> GlyphRole.ARROW_RIGHT;
                case HORIZONTAL, VERTICAL -> axes.get(cell).contains(H) ? GlyphRole.HORIZONTAL : GlyphRole.VERTICAL;
                case JUNCTION -> {
                    if (sides.size() >= 3 || sides.isEmpty()) yield GlyphRole.JUNCTION;
                    if (sides.size() == 1) yield GlyphRole.CORNER;
                    if (sides.equals(EnumSet.of(Direction.LEFT, Direction.RIGHT))) yield GlyphRole.HORIZONTAL;
                    if (sides.equals(EnumSet.of(Direction.UP, Direction.DOWN))) yield GlyphRole.VERTICAL;
                    yield GlyphRole.CORNER;
                }
                case TEXT -> throw new IllegalStateException("Text cell traced as connector at " + cell);
            };
        }

        private List<Cell> order() {
            Cell start = axes.keySet().stream()
                    .filter(cell -> links.get(cell).size() <= 1)
                    .findFirst()
                    .orElse(axes.keySet().iterator().next());

            List<Cell> ordered = new ArrayList<>(axes.size());
            Set<Cell> visited = new HashSet<>();
            Deque<Cell> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                Cell cell = stack.pop();
                if (!visited.add(cell)) continue;
                ordered.add(cell);

                List<Cell> next = links.get(cell).stream().map(cell::step).filter(n -> !visited.contains(n)).sorted(Comparator.reverseOrder()).toList();
                next.forEach(stack::push);
            }
            return List.copyOf(ordered);
        }
    }

    private static final class UnionFind {
        private final int[] parent;

        UnionFind(int size) {
            parent = new int[size];
            for (int i = 0; i < size; i++) parent[i] = i;
        }

        int find(int x) {
            while (parent[x] != x) {
                parent[x] = parent[parent[x]];
                x = parent[x];
            }
            return x;
        }

        void union(int a, int b) {
            int ra = find(a);
            int rb = find(b);
            if (ra != rb) parent[Math.max(ra, rb)] = Math.min(ra, rb);
        }
    }
}
