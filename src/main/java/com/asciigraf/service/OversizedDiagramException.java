package com.asciigraf.service;

public class OversizedDiagramException extends RuntimeException {
    private final int width;
    private final int height;
    private final long maxCells;

    public OversizedDiagramException(int width, int height, long maxCells) {
        super("Diagram of " + width + "x" + height + " cells exceeds the limit of " + maxCells + " cells");
        this.width = width;
        this.height = height;
        this.maxCells = maxCells;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public long getMaxCells() { return maxCells; }
}
