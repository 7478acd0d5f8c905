package com.asciigraf.config;

public record DiagramOptions(GlyphSet glyphs, int labelMargin, int endpointTolerance) {
    public static final DiagramOptions DEFAULT = new DiagramOptions(GlyphSet.DEFAULT, 1, 0);

    public DiagramOptions {
        if (glyphs == null) glyphs = GlyphSet.DEFAULT;
        if (labelMargin < 0) throw new IllegalArgumentException("labelMargin must not be negative");
        if (endpointTolerance < 0) throw new IllegalArgumentException("endpointTolerance must not be negative");
    }

    public DiagramOptions withLabelMargin(int margin) {
        return new DiagramOptions(glyphs, margin, endpointTolerance);
    }

    public DiagramOptions withEndpointTolerance(int tolerance) {
        return new DiagramOptions(glyphs, labelMargin, tolerance);
    }
}
