package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.model.MathBox;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BoxComposerTest {

    @Test
    void emptyBoxesAreSkipped() {
        MathBox box = MathBox.fromText("x");
        assertSame(box, BoxComposer.horizontal(MathBox.empty(), box));
        assertTrue(BoxComposer.horizontal(List.of()).isEmpty());
    }

    @Test
    void singleRowBoxesCollapseIntoOneLine() {
        MathBox result = BoxComposer.horizontal(text("a"), text(" + "), text("b"));
        assertEquals("a + b", result.render());
        assertEquals(1, result.getHeight());
    }

    @Test
    void alignsBoxesOnTheirBaselines() {
        MathBox result = BoxComposer.horizontal(text("x = "), stacked(1, "a", "─", "b"));
        assertEquals(String.join("\n",
                "    a",
                "x = ─",
                "    b"), result.render());
        assertEquals(1, result.getBaseline());
    }

    @Test
    void promotesBracketsAroundTallContent() {
        MathBox result = BoxComposer.horizontal(text("("), stacked(1, "a", "─", "b"), text(")"));
        assertEquals(String.join("\n",
                "⎛a⎞",
                "⎜─⎟",
                "⎝b⎠"), result.render());
    }

    @Test
    void promotesBracesWithFillAndConnector() {
        MathBox result = BoxComposer.horizontal(text("{"), stacked(2, "a", "b", "c", "d"), text("}"));
        assertEquals(String.join("\n",
                "⎧a⎫",
                "⎪b⎪",
                "⎨c⎬",
                "⎩d⎭"), result.render());
    }

    @Test
    void keepsPlainBracketsAroundTwoRowContent() {
        MathBox result = BoxComposer.horizontal(text("("), stacked(0, "a", "b"), text(")"));
        assertEquals(String.join("\n",
                "(a)",
                " b"), result.render());
    }

    @Test
    void promotesOnlyTheOutermostMatchingPair() {
        MathBox result = BoxComposer.horizontal(
                text("("), text("("), stacked(1, "a", "─", "b"), text(")"), text(")"));
        assertEquals(String.join("\n",
                "⎛ a ⎞",
                "⎜(─)⎟",
                "⎝ b ⎠"), result.render());
    }

    @Test
    void shortSequencesAreNotPromoted() {
        List<MathBox> boxes = List.of(text("("), stacked(1, "a", "─", "b"));
        assertSame(boxes, BoxComposer.promoteDelimiters(boxes));
    }

    @Test
    void spacesAroundTallLargeOperators() {
        MathBox result = BoxComposer.horizontal(text("x"), stacked(1, "n", "∑", "i"), text("y"));
        assertEquals(String.join("\n",
                "  n",
                "x ∑ y",
                "  i"), result.render());
    }

    @Test
    void shortOperatorBoxesGetNoSpacing() {
        MathBox result = BoxComposer.horizontal(text("x"), stacked(0, "∑", "i"), text("y"));
        assertEquals(String.join("\n",
                "x∑y",
                " i"), result.render());
    }

    @Test
    void noSpacingBeforeLeadingOperator() {
        MathBox result = BoxComposer.horizontal(stacked(1, "n", "∑", "i"), text("y"));
        assertEquals(String.join("\n",
                "n",
                "∑ y",
                "i"), result.render());
    }

    private static MathBox text(String text) {
        return MathBox.fromText(text);
    }

    private static MathBox stacked(int baseline, String... rows) {
        int width = 0;
        for (String row : rows) {
            width = Math.max(width, MathTextUtils.columns(row));
        }
        MathBox box = MathBox.blank(width, rows.length, baseline);
        for (int y = 0; y < rows.length; y++) {
            box.drawText(rows[y], 0, y);
        }
        return box;
    }
}
