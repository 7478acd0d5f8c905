package com.asciigraf.grid;

public enum Direction {
    UP(-1, 0), LEFT(0, -1), RIGHT(0, 1), DOWN(1, 0);

    private final int dRow;
    private final int dCol;

    Direction(int dRow, int dCol) {
        this.dRow = dRow;
        this.dCol = dCol;
    }

    public int dRow() { return dRow; }
    public int dCol() { return dCol; }

    public boolean isHorizontal() {
        return this == LEFT || this == RIGHT;
    }

    public Direction opposite() {
        return switch (this) {
            case UP -> DOWN;
            case DOWN -> UP;
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
        };
    }
}
