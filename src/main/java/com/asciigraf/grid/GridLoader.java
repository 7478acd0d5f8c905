package com.asciigraf.grid;

import org.springframework.stereotype.Component;

import java.util.Arrays;

@Component
public class GridLoader {

    public GridSize measure(String content) {
        if (content == null) content = "";
        int width = 0;
        int height = 1;
        int current = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (!isLineBreak(c)) {
                current++;
                continue;
            }
            if (c == '\r' && i + 1 < content.length() && content.charAt(i + 1) == '\n') i++;
            width = Math.max(width, current);
            current = 0;
            height++;
        }
        return new GridSize(Math.max(width, current), height);
    }

    public Grid load(String content) {
        if (content == null) content = "";
        String[] lines = content.split("\\R", -1);

        int width = Arrays.stream(lines).mapToInt(String::length).max().orElse(0);
        char[][] chars = new char[lines.length][];
        for (int i = 0; i < lines.length; i++) {
            char[] row = chars[i] = new char[width];
            Arrays.fill(row, Grid.BLANK);
            lines[i].getChars(0, lines[i].length(), row, 0);
        }
        return new Grid(chars, width);
    }

    private static boolean isLineBreak(char c) {
        return (c >= '\n' && c <= '\r') || c == '\u0085' || c == '\u2028' || c == '\u2029';
    }
}
