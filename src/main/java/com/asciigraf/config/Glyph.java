package com.asciigraf.config;

import com.asciigraf.grid.Direction;

public enum Glyph {
    HORIZONTAL, VERTICAL, JUNCTION, ARROW_UP, ARROW_DOWN, ARROW_LEFT, ARROW_RIGHT, TEXT;

    public boolean hasHorizontalPort() {
        return switch (this) {
            case HORIZONTAL, JUNCTION, ARROW_LEFT, ARROW_RIGHT -> true;
            case VERTICAL, ARROW_UP, ARROW_DOWN, TEXT -> false;
        };
    }

    public boolean hasVerticalPort() {
        return switch (this) {
            case VERTICAL, JUNCTION, ARROW_UP, ARROW_DOWN -> true;
            case HORIZONTAL, ARROW_LEFT, ARROW_RIGHT, TEXT -> false;
        };
    }

    public boolean isArrow() {
        return pointing() != null;
    }

    public Direction pointing() {
        return switch (this) {
            case ARROW_UP -> Direction.UP;
            case ARROW_DOWN -> Direction.DOWN;
            case ARROW_LEFT -> Direction.LEFT;
            case ARROW_RIGHT -> Direction.RIGHT;
            case HORIZONTAL, VERTICAL, JUNCTION, TEXT -> null;
        };
    }
}
