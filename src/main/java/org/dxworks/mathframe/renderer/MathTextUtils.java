package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.model.MathBox;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Text helpers shared by the construct renderers.
 */
public final class MathTextUtils {

    /** Operators drawn large enough to carry limits above and below. */
    public static final String LARGE_OPERATORS = "∏∑∫⋃⋂⋁⋀";

    private MathTextUtils() {}

    public static boolean isLargeOperator(int codePoint) {
        return LARGE_OPERATORS.indexOf(codePoint) >= 0;
    }

    /** True when the text is exactly one large operator. */
    public static boolean isLargeOperator(String text) {
        return text.codePointCount(0, text.length()) == 1 && isLargeOperator(text.codePointAt(0));
    }

    /** Number of columns the text occupies in a box. */
    public static int columns(String text) {
        return text.codePointCount(0, text.length());
    }

    /** Encoded length; the inline-notation thresholds are expressed in this unit. */
    public static int utf8Length(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    public static boolean isAlphanumeric(int codePoint) {
        if (Character.isAlphabetic(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.DECIMAL_DIGIT_NUMBER
                || type == Character.LETTER_NUMBER
                || type == Character.OTHER_NUMBER;
    }

    /** Whitespace including no-break spaces and the other Unicode space separators. */
    public static boolean isSpace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }

    /** Like {@link String#strip()} but also removes no-break spaces. */
    public static String trim(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isSpace(text.codePointAt(start))) {
            start += Character.charCount(text.codePointAt(start));
        }
        while (end > start && isSpace(text.codePointBefore(end))) {
            end -= Character.charCount(text.codePointBefore(end));
        }
        return text.substring(start, end);
    }

    /** Whether a box is a plain single line of text sitting on its own baseline. */
    public static boolean isInline(MathBox box) {
        return box.getHeight() == 1 && box.getBaseline() == 0;
    }

    /** First row of the box with surrounding whitespace removed. */
    public static String firstRow(MathBox box) {
        return trim(box.rowText(0));
    }

    /**
     * All rows trimmed, blank rows dropped, and the rest joined without separator.
     */
    public static String flatten(MathBox box) {
        StringBuilder sb = new StringBuilder();
        for (String row : rows(box)) {
            String trimmed = trim(row);
            if (!trimmed.isEmpty()) {
                sb.append(trimmed);
            }
        }
        return trim(sb.toString());
    }

    public static List<String> rows(MathBox box) {
        List<String> rows = new ArrayList<>(box.getHeight());
        for (int y = 0; y < box.getHeight(); y++) {
            rows.add(box.rowText(y));
        }
        return rows;
    }

    public static boolean containsAny(MathBox box, String symbols) {
        for (int y = 0; y < box.getHeight(); y++) {
            for (int x = 0; x < box.getWidth(); x++) {
                if (symbols.indexOf(box.getChar(x, y)) >= 0) {
                    return true;
                }
            }
        }
        return false;
    }

    /** Left offset that centres {@code part} columns in {@code total}; odd padding goes right. */
    public static int centerOffset(int total, int part) {
        return Math.max(0, total - part) / 2;
    }
}
