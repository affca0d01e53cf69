package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.model.MathBox;

import java.util.Arrays;

/**
 * Multi-row bracket glyphs built from the Unicode bracket pieces.
 */
public final class DelimiterGlyphs {

    private static final String DELIMITERS = "()[]{}";

    private DelimiterGlyphs() {}

    public static boolean isDelimiter(int codePoint) {
        return DELIMITERS.indexOf(codePoint) >= 0;
    }

    public static boolean isOpening(int codePoint) {
        return codePoint == '(' || codePoint == '[' || codePoint == '{';
    }

    public static int closingFor(int opening) {
        switch (opening) {
            case '(':
                return ')';
            case '[':
                return ']';
            case '{':
                return '}';
            default:
                return opening;
        }
    }

    /**
     * Glyph column for a delimiter spanning {@code height} rows, top to bottom.
     * A single row keeps the plain character; delimiters without pieces repeat themselves.
     */
    public static int[] column(int delimiter, int height) {
        int[] glyphs = new int[Math.max(0, height)];
        if (height <= 1) {
            if (height == 1) {
                glyphs[0] = delimiter;
            }
            return glyphs;
        }
        Pieces pieces = Pieces.of(delimiter);
        if (pieces == null) {
            Arrays.fill(glyphs, delimiter);
            return glyphs;
        }
        glyphs[0] = pieces.top;
        for (int i = 1; i < height - 1; i++) {
            glyphs[i] = (pieces.connector != 0 && i == height / 2) ? pieces.connector : pieces.middle;
        }
        glyphs[height - 1] = pieces.bottom;
        return glyphs;
    }

    /** A one-column box holding {@link #column(int, int)}, its baseline on the middle row. */
    public static MathBox columnBox(int delimiter, int height) {
        int[] glyphs = column(delimiter, height);
        MathBox box = MathBox.blank(1, glyphs.length, glyphs.length / 2);
        drawColumn(box, 0, glyphs);
        return box;
    }

    public static void drawColumn(MathBox target, int x, int[] glyphs) {
        for (int y = 0; y < glyphs.length; y++) {
            target.setChar(x, y, glyphs[y]);
        }
    }

    private enum Pieces {
        OPEN_PAREN('(', '⎛', '⎜', '⎝', 0),
        CLOSE_PAREN(')', '⎞', '⎟', '⎠', 0),
        OPEN_BRACKET('[', '⎡', '⎢', '⎣', 0),
        CLOSE_BRACKET(']', '⎤', '⎥', '⎦', 0),
        OPEN_BRACE('{', '⎧', '⎪', '⎩', '⎨'),
        CLOSE_BRACE('}', '⎫', '⎪', '⎭', '⎬');

        private final int delimiter;
        private final int top;
        private final int middle;
        private final int bottom;
        private final int connector;

        Pieces(int delimiter, int top, int middle, int bottom, int connector) {
            this.delimiter = delimiter;
            this.top = top;
            this.middle = middle;
            this.bottom = bottom;
            this.connector = connector;
        }

        static Pieces of(int delimiter) {
            for (Pieces pieces : values()) {
                if (pieces.delimiter == delimiter) {
                    return pieces;
                }
            }
            return null;
        }
    }
}
