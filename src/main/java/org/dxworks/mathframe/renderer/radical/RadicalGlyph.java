package org.dxworks.mathframe.renderer.radical;

import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.MathTextUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Line art for the radical sign: an overline opened by a diagonal, rising strokes,
 * the {@code _  ╱} joint and the {@code \╱} tail.
 */
final class RadicalGlyph {

    static final int MIN_HEIGHT = 3;
    /** Columns the overline extends past the radicand. */
    static final int OVERLINE_EXTRA = 4;
    /** Minimum width the whole radical adds to the radicand. */
    static final int WIDTH_PADDING = 10;

    private static final String OVERLINE_START = "⟋";
    private static final String OVERLINE = "─";
    private static final String STROKE = "╱  ";
    private static final String JOINT = "_  ╱  ";
    private static final String TAIL = " \\╱  ";

    private RadicalGlyph() {}

    /**
     * Square-root sign {@code height} rows tall (at least three) with an overline of
     * {@code length} columns.
     */
    static List<String> squareRoot(int height, int length) {
        int h = Math.max(MIN_HEIGHT, height);
        List<String> lines = new ArrayList<>(h);
        lines.add(" ".repeat(h + 1) + OVERLINE_START + OVERLINE.repeat(length));
        for (int i = 1; i < h - 2; i++) {
            lines.add(" ".repeat(h + 1 - i) + STROKE);
        }
        lines.add(JOINT);
        lines.add(TAIL);
        return lines;
    }

    /**
     * Sign used under an index for a radicand of the given size. A three-row radicand gets the
     * same four-row shape as the square root; other heights use a sign two rows taller than
     * the radicand.
     */
    static List<String> indexed(int radicandHeight, int radicandWidth) {
        String overline = OVERLINE_START + OVERLINE.repeat(radicandWidth + OVERLINE_EXTRA);
        List<String> lines = new ArrayList<>();
        if (radicandHeight == 3) {
            lines.add(" ".repeat(5) + overline);
            lines.add(" ".repeat(4) + STROKE);
            lines.add(JOINT);
            lines.add(TAIL);
            return lines;
        }

        int rows = radicandHeight + 2;
        lines.add(" ".repeat(rows - 1) + overline);
        for (int i = 1; i < rows; i++) {
            int padding = rows - 1 - i;
            if (i == rows - 1) {
                lines.add(" ".repeat(padding) + "\\╱  ");
            } else if (i == rows - 2) {
                lines.add("_" + " ".repeat(padding) + STROKE);
            } else {
                lines.add(" ".repeat(padding + 1) + STROKE);
            }
        }
        return lines;
    }

    /** Puts the index text in front of the joint row and shifts every other row to match. */
    static List<String> withIndex(List<String> lines, String indexText) {
        String shift = " ".repeat(MathTextUtils.columns(indexText) + 1);
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.stripLeading().startsWith("_")) {
                result.add(" " + indexText + line);
            } else {
                result.add(shift + line);
            }
        }
        return result;
    }

    static int width(List<String> lines) {
        int width = 0;
        for (String line : lines) {
            width = Math.max(width, MathTextUtils.columns(line));
        }
        return width;
    }

    /** Draws the sign and then the radicand, one row below the overline at {@code contentX}. */
    static MathBox compose(List<String> lines, MathBox radicand, int width, int height, int contentX) {
        MathBox result = MathBox.blank(width, height, radicand.getBaseline() + 1);
        for (int y = 0; y < lines.size(); y++) {
            result.drawText(lines.get(y), 0, y);
        }
        result.paste(radicand, contentX, 1);
        return result;
    }
}
