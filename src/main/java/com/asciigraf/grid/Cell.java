package com.asciigraf.grid;

import java.util.Comparator;

public record Cell(int row, int col) implements Comparable<Cell> {
    public static final Comparator<Cell> READING_ORDER = Comparator.comparingInt(Cell::row).thenComparingInt(Cell::col);

    public Cell step(Direction direction) {
        return new Cell(row + direction.dRow(), col + direction.dCol());
    }

    @Override
    public int compareTo(Cell other) {
        return READING_ORDER.compare(this, other);
    }
}
