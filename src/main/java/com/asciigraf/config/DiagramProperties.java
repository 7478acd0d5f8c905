package com.asciigraf.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "asciigraf")
public class DiagramProperties {

    private int labelMargin = DiagramOptions.DEFAULT.labelMargin();

    private int endpointTolerance = DiagramOptions.DEFAULT.endpointTolerance();

    private long maxCells = 250_000;

    private Glyphs glyphs = new Glyphs();

    public int getLabelMargin() {
        return labelMargin;
    }

    public void setLabelMargin(int labelMargin) {
        this.labelMargin = labelMargin;
    }

    public int getEndpointTolerance() {
        return endpointTolerance;
    }

    public void setEndpointTolerance(int endpointTolerance) {
        this.endpointTolerance = endpointTolerance;
    }

    public long getMaxCells() {
        return maxCells;
    }

    public void setMaxCells(long maxCells) {
        this.maxCells = maxCells;
    }

    public Glyphs getGlyphs() {
        return glyphs;
    }

    public void setGlyphs(Glyphs glyphs) {
        this.glyphs = glyphs == null ? new Glyphs() : glyphs;
    }

    public DiagramOptions toOptions() {
        return new DiagramOptions(glyphs.toGlyphSet(), labelMargin, endpointTolerance);
    }

    public static class Glyphs {
        private String corners = GlyphSet.DEFAULT.corners();
        private String horizontalBorders = GlyphSet.DEFAULT.horizontalBorders();
        private String verticalBorders = GlyphSet.DEFAULT.verticalBorders();
        private String horizontalLines = GlyphSet.DEFAULT.horizontalLines();
        private String verticalLines = GlyphSet.DEFAULT.verticalLines();
        private String junctions = GlyphSet.DEFAULT.junctions();
        private String arrowUp = String.valueOf(GlyphSet.DEFAULT.arrowUp());
        private String arrowDown = String.valueOf(GlyphSet.DEFAULT.arrowDown());
        private String arrowLeft = String.valueOf(GlyphSet.DEFAULT.arrowLeft());
        private String arrowRight = String.valueOf(GlyphSet.DEFAULT.arrowRight());
        private String labelOpen = String.valueOf(GlyphSet.DEFAULT.labelOpen());
        private String labelClose = String.valueOf(GlyphSet.DEFAULT.labelClose());

        public String getCorners() { return corners; }
        public void setCorners(String corners) { this.corners = corners; }
        public String getHorizontalBorders() { return horizontalBorders; }
        public void setHorizontalBorders(String horizontalBorders) { this.horizontalBorders = horizontalBorders; }
        public String getVerticalBorders() { return verticalBorders; }
        public void setVerticalBorders(String verticalBorders) { this.verticalBorders = verticalBorders; }
        public String getHorizontalLines() { return horizontalLines; }
        public void setHorizontalLines(String horizontalLines) { this.horizontalLines = horizontalLines; }
        public String getVerticalLines() { return verticalLines; }
        public void setVerticalLines(String verticalLines) { this.verticalLines = verticalLines; }
        public String getJunctions() { return junctions; }
        public void setJunctions(String junctions) { this.junctions = junctions; }
        public String getArrowUp() { return arrowUp; }
        public void setArrowUp(String arrowUp) { this.arrowUp = arrowUp; }
        public String getArrowDown() { return arrowDown; }
        public void setArrowDown(String arrowDown) { this.arrowDown = arrowDown; }
        public String getArrowLeft() { return arrowLeft; }
        public void setArrowLeft(String arrowLeft) { this.arrowLeft = arrowLeft; }
        public String getArrowRight() { return arrowRight; }
        public void setArrowRight(String arrowRight) { this.arrowRight = arrowRight; }
        public String getLabelOpen() { return labelOpen; }
        public void setLabelOpen(String labelOpen) { this.labelOpen = labelOpen; }
        public String getLabelClose() { return labelClose; }
        public void setLabelClose(String labelClose) { this.labelClose = labelClose; }

        GlyphSet toGlyphSet() {
            return new GlyphSet(corners, horizontalBorders, verticalBorders, horizontalLines, verticalLines, junctions,
                    single(arrowUp, "arrow-up"), single(arrowDown, "arrow-down"),
                    single(arrowLeft, "arrow-left"), single(arrowRight, "arrow-right"),
                    single(labelOpen, "label-open"), single(labelClose, "label-close"));
        }

        private static char single(String value, String name) {
            if (value == null || value.length() != 1) {
                throw new IllegalStateException("asciigraf.glyphs." + name + " must be a single character, got: " + value);
            }
            return value.charAt(0);
        }
    }
}
