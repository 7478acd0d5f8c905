package com.asciigraf.config;

public record GlyphSet(String corners,
                       String horizontalBorders,
                       String verticalBorders,
                       String horizontalLines,
                       String verticalLines,
                       String junctions,
                       char arrowUp,
                       char arrowDown,
                       char arrowLeft,
                       char arrowRight,
                       char labelOpen,
                       char labelClose) {

    public static final GlyphSet DEFAULT = new GlyphSet("+", "-", "|", "-=", "|", "+", '^', 'v', '<', '>', '(', ')');

    public GlyphSet {
        if (corners == null || corners.isEmpty()) throw new IllegalArgumentException("At least one corner glyph is required");
        horizontalBorders = horizontalBorders == null ? "" : horizontalBorders;
        verticalBorders = verticalBorders == null ? "" : verticalBorders;
        horizontalLines = horizontalLines == null ? "" : horizontalLines;
        verticalLines = verticalLines == null ? "" : verticalLines;
        junctions = junctions == null ? "" : junctions;
    }

    public boolean isCorner(char c) {
        return corners.indexOf(c) >= 0;
    }

    public boolean isHorizontalBorder(char c) {
        return horizontalBorders.indexOf(c) >= 0 || isCorner(c);
    }

    public boolean isVerticalBorder(char c) {
        return verticalBorders.indexOf(c) >= 0 || isCorner(c);
    }

    public Glyph classify(char c) {
        if (junctions.indexOf(c) >= 0) return Glyph.JUNCTION;
        if (horizontalLines.indexOf(c) >= 0) return Glyph.HORIZONTAL;
        if (verticalLines.indexOf(c) >= 0) return Glyph.VERTICAL;
        if (c == arrowUp) return Glyph.ARROW_UP;
        if (c == arrowDown) return Glyph.ARROW_DOWN;
        if (c == arrowLeft) return Glyph.ARROW_LEFT;
        if (c == arrowRight) return Glyph.ARROW_RIGHT;
        return Glyph.TEXT;
    }
}
