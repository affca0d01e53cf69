package org.dxworks.mathframe.model;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * A rectangular grid of characters with a baseline row.
 * The baseline is the row that lines up with neighbouring boxes when they are
 * concatenated horizontally. Every row always has exactly {@code width} columns.
 * Cells hold Unicode code points, so a character outside the BMP occupies one column.
 */
public final class MathBox {

    public static final int BLANK = ' ';

    private final int width;
    private final int height;
    private final int baseline;
    private final int[][] content;

    private MathBox(int width, int height, int baseline, int[][] content) {
        this.width = width;
        this.height = height;
        this.baseline = baseline;
        this.content = content;
    }

    /**
     * Single-row box holding the given text, or the empty box when the text is empty.
     */
    public static MathBox fromText(String text) {
        if (text == null || text.isEmpty()) {
            return empty();
        }
        int[] row = text.codePoints().toArray();
        return new MathBox(row.length, 1, 0, new int[][]{row});
    }

    public static MathBox empty() {
        return new MathBox(0, 0, 0, new int[0][0]);
    }

    /**
     * Blank canvas of the given size; every cell starts out as a space.
     */
    public static MathBox blank(int width, int height, int baseline) {
        int w = Math.max(0, width);
        int h = Math.max(0, height);
        int[][] grid = new int[h][w];
        for (int[] row : grid) {
            Arrays.fill(row, BLANK);
        }
        int b = h == 0 ? 0 : Math.min(Math.max(0, baseline), h - 1);
        return new MathBox(w, h, b, grid);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getBaseline() {
        return baseline;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /** Out-of-bounds reads yield a space. */
    public int getChar(int x, int y) {
        if (x >= 0 && y >= 0 && y < height && x < width) {
            return content[y][x];
        }
        return BLANK;
    }

    /** Out-of-bounds writes are ignored. */
    public void setChar(int x, int y, int codePoint) {
        if (x >= 0 && y >= 0 && y < height && x < width) {
            content[y][x] = codePoint;
        }
    }

    /**
     * Copies every non-space character of {@code source} onto this box with its
     * top-left corner at ({@code dx}, {@code dy}).
     */
    public void paste(MathBox source, int dx, int dy) {
        for (int y = 0; y < source.height; y++) {
            for (int x = 0; x < source.width; x++) {
                int ch = source.content[y][x];
                if (ch != BLANK && ch != 0) {
                    setChar(dx + x, dy + y, ch);
                }
            }
        }
    }

    /**
     * Like {@link #paste(MathBox, int, int)} but spaces are copied too.
     */
    public void overwrite(MathBox source, int dx, int dy) {
        for (int y = 0; y < source.height; y++) {
            for (int x = 0; x < source.width; x++) {
                setChar(dx + x, dy + y, source.content[y][x]);
            }
        }
    }

    /**
     * Writes {@code text} left to right starting at ({@code dx}, {@code y}), skipping spaces.
     */
    public void drawText(String text, int dx, int y) {
        int[] codePoints = text.codePoints().toArray();
        for (int i = 0; i < codePoints.length; i++) {
            if (codePoints[i] != BLANK) {
                setChar(dx + i, y, codePoints[i]);
            }
        }
    }

    /** The untrimmed text of row {@code y}, or an empty string when out of range. */
    public String rowText(int y) {
        if (y < 0 || y >= height) {
            return "";
        }
        return new String(content[y], 0, width);
    }

    /** Rows joined with newlines, trailing whitespace (no-break spaces included) removed from each row. */
    public String render() {
        return Arrays.stream(content)
                .map(MathBox::trimRowEnd)
                .collect(Collectors.joining("\n"));
    }

    private static String trimRowEnd(int[] row) {
        int end = row.length;
        while (end > 0 && (Character.isWhitespace(row[end - 1]) || Character.isSpaceChar(row[end - 1]))) {
            end--;
        }
        return new String(row, 0, end);
    }

    @Override
    public String toString() {
        return "MathBox{" + width + "x" + height + ", baseline=" + baseline + "}";
    }
}
