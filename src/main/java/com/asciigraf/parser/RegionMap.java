package com.asciigraf.parser;

import com.asciigraf.grid.Cell;

import java.util.Arrays;

public final class RegionMap {
    public static final int NONE = -1;

    private final int[][] owners;

    RegionMap(int height, int width) {
        owners = new int[height][width];
        for (int[] row : owners) Arrays.fill(row, NONE);
    }

    public int ownerAt(int row, int col) {
        if (row < 0 || row >= owners.length || col < 0 || col >= owners[row].length) return NONE;
        return owners[row][col];
    }

    public int ownerAt(Cell cell) {
        return ownerAt(cell.row(), cell.col());
    }

    public boolean isClaimed(Cell cell) {
        return ownerAt(cell) != NONE;
    }

    void assign(int row, int col, int owner) {
        owners[row][col] = owner;
    }
}
