package com.asciigraf.parser;

import com.asciigraf.grid.Cell;
import com.asciigraf.grid.Direction;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class DiagramDtos {

    public record NodeRegion(int index, int top, int left, int bottom, int right, String label) {
        public Cell topLeft() {
            return new Cell(top, left);
        }
    }

    public enum GlyphRole {
        HORIZONTAL, VERTICAL, CORNER, JUNCTION, ARROW_UP, ARROW_DOWN, ARROW_LEFT, ARROW_RIGHT, LABEL;

        public Set<Direction> openSides() {
            return switch (this) {
                case HORIZONTAL, ARROW_LEFT, ARROW_RIGHT, LABEL -> EnumSet.of(Direction.LEFT, Direction.RIGHT);
                case VERTICAL, ARROW_UP, ARROW_DOWN -> EnumSet.of(Direction.UP, Direction.DOWN);
                case CORNER, JUNCTION -> EnumSet.allOf(Direction.class);
            };
        }

        public boolean isArrowhead() {
            return switch (this) {
                case ARROW_UP, ARROW_DOWN, ARROW_LEFT, ARROW_RIGHT -> true;
                case HORIZONTAL, VERTICAL, CORNER, JUNCTION, LABEL -> false;
            };
        }
    }

    public record InlineLabel(Cell start, String text) {}

    public record ConnectorPath(int index,
                                List<Cell> cells,
                                Map<Cell, GlyphRole> roles,
                                Map<Cell, Set<Direction>> links,
                                List<InlineLabel> inlineLabels) {

        public GlyphRole role(Cell cell) {
            return roles.get(cell);
        }

        public int degree(Cell cell) {
            return links.getOrDefault(cell, Set.of()).size();
        }

        public boolean isLinked(Cell cell, Direction side) {
            return links.getOrDefault(cell, Set.of()).contains(side);
        }

        public boolean isEndpoint(Cell cell) {
            return degree(cell) <= 1;
        }

        public boolean isJunction(Cell cell) {
            return roles.get(cell) == GlyphRole.JUNCTION;
        }

        public Cell midpoint() {
            return cells.get(cells.size() / 2);
        }

        public int length() {
            return cells.size();
        }
    }

    public record Attachment(Cell cell, Direction side, int regionIndex, boolean arrowhead) {}

    public record CandidateEdge(int pathIndex, int sourceRegion, int targetRegion, boolean directed, String label, int length) {}

    public record Diagnostic(String code, String message, int row, int col) {}

    public static final String MALFORMED_REGION = "MALFORMED_REGION";
    public static final String NESTED_REGION = "NESTED_REGION";
    public static final String AMBIGUOUS_ENDPOINT = "AMBIGUOUS_ENDPOINT";
    public static final String DANGLING_CONNECTOR = "DANGLING_CONNECTOR";
}
