package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.model.MathBox;

import java.util.ArrayList;
import java.util.List;

/**
 * Horizontal composition of boxes along a shared baseline, plus the two layout
 * heuristics applied on the way: breathing room around tall large operators and
 * promotion of plain brackets to multi-row glyphs.
 */
public final class BoxComposer {

    private static final int TALL_OPERATOR_MIN_HEIGHT = 3;
    private static final int PROMOTION_MIN_HEIGHT = 3;

    private BoxComposer() {}

    public static MathBox horizontal(MathBox... boxes) {
        return horizontal(List.of(boxes));
    }

    public static MathBox horizontal(List<MathBox> input) {
        List<MathBox> boxes = new ArrayList<>();
        for (MathBox box : input) {
            if (!box.isEmpty()) {
                boxes.add(box);
            }
        }
        if (boxes.isEmpty()) {
            return MathBox.empty();
        }
        if (boxes.size() == 1) {
            return boxes.get(0);
        }

        boxes = addOperatorSpacing(boxes);
        boxes = promoteDelimiters(boxes);

        if (boxes.stream().allMatch(b -> b.getHeight() <= 1)) {
            StringBuilder line = new StringBuilder();
            for (MathBox box : boxes) {
                line.append(box.rowText(0));
            }
            return MathBox.fromText(line.toString());
        }

        int width = 0;
        int above = 0;
        int below = 0;
        for (MathBox box : boxes) {
            width += box.getWidth();
            above = Math.max(above, box.getBaseline());
            below = Math.max(below, box.getHeight() - box.getBaseline());
        }

        MathBox result = MathBox.blank(width, above + below, above);
        int x = 0;
        for (MathBox box : boxes) {
            result.paste(box, x, above - box.getBaseline());
            x += box.getWidth();
        }
        return result;
    }

    /**
     * Surrounds every tall box that carries a large operator with single spaces,
     * except at the ends of the sequence.
     */
    static List<MathBox> addOperatorSpacing(List<MathBox> boxes) {
        List<MathBox> result = new ArrayList<>(boxes.size());
        for (int i = 0; i < boxes.size(); i++) {
            MathBox box = boxes.get(i);
            boolean spaced = needsOperatorSpacing(box);
            if (spaced && i > 0) {
                result.add(MathBox.fromText(" "));
            }
            result.add(box);
            if (spaced && i < boxes.size() - 1) {
                result.add(MathBox.fromText(" "));
            }
        }
        return result;
    }

    static boolean needsOperatorSpacing(MathBox box) {
        return box.getHeight() >= TALL_OPERATOR_MIN_HEIGHT
                && MathTextUtils.containsAny(box, MathTextUtils.LARGE_OPERATORS);
    }

    /**
     * Replaces a matched pair of single-character brackets by glyph columns as tall as the
     * tallest box between them, when that box is at least three rows high.
     */
    static List<MathBox> promoteDelimiters(List<MathBox> boxes) {
        if (boxes.size() < 3) {
            return boxes;
        }

        List<MathBox> result = new ArrayList<>(boxes.size());
        int i = 0;
        while (i < boxes.size()) {
            int open = singleDelimiter(boxes.get(i));
            if (i + 2 < boxes.size() && open != -1) {
                int close = findClosing(boxes, i, open);
                if (close != -1) {
                    List<MathBox> enclosed = boxes.subList(i + 1, close);
                    int maxHeight = 0;
                    for (MathBox box : enclosed) {
                        maxHeight = Math.max(maxHeight, box.getHeight());
                    }
                    if (maxHeight >= PROMOTION_MIN_HEIGHT) {
                        result.add(DelimiterGlyphs.columnBox(open, maxHeight));
                        result.addAll(enclosed);
                        result.add(DelimiterGlyphs.columnBox(DelimiterGlyphs.closingFor(open), maxHeight));
                        i = close + 1;
                        continue;
                    }
                }
            }
            result.add(boxes.get(i));
            i++;
        }
        return result;
    }

    private static int findClosing(List<MathBox> boxes, int openIndex, int open) {
        int expectedClose = DelimiterGlyphs.closingFor(open);
        if (!DelimiterGlyphs.isOpening(open)) {
            return -1;
        }
        int depth = 1;
        for (int j = openIndex + 1; j < boxes.size(); j++) {
            int ch = singleDelimiter(boxes.get(j));
            if (ch == expectedClose) {
                depth--;
                if (depth == 0) {
                    return j;
                }
            } else if (ch == open) {
                depth++;
            }
        }
        return -1;
    }

    /** The bracket character of a 1x1 box, or -1. */
    private static int singleDelimiter(MathBox box) {
        if (box.getWidth() == 1 && box.getHeight() == 1) {
            int ch = box.getChar(0, 0);
            if (DelimiterGlyphs.isDelimiter(ch)) {
                return ch;
            }
        }
        return -1;
    }
}
