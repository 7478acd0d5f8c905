package com.asciigraf.grid;

public record GridSize(int width, int height) {
    public long cellCount() {
        return (long) width * height;
    }
}
