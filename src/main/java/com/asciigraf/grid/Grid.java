package com.asciigraf.grid;

public final class Grid {
    public static final char BLANK = ' ';

    private final char[][] chars;
    private final int width;

    Grid(char[][] chars, int width) {
        this.chars = chars;
        this.width = width;
    }

    public int width() { return width; }
    public int height() { return chars.length; }

    public boolean contains(Cell cell) {
        return cell.row() >= 0 && cell.row() < chars.length && cell.col() >= 0 && cell.col() < width;
    }

    public char charAt(int row, int col) {
        if (row < 0 || row >= chars.length || col < 0 || col >= width) return BLANK;
        return chars[row][col];
    }

    public char charAt(Cell cell) {
        return charAt(cell.row(), cell.col());
    }

    public boolean isBlank(Cell cell) {
        return charAt(cell) == BLANK;
    }

    public boolean isEmpty() {
        for (char[] row : chars) {
            for (char c : row) {
                if (c != BLANK) return false;
            }
        }
        return true;
    }

    public String text(int row, int fromCol, int toColExclusive) {
        StringBuilder sb = new StringBuilder();
        for (int col = fromCol; col < toColExclusive; col++) {
            sb.append(charAt(row, col));
        }
        return sb.toString();
    }
}
