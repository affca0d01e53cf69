package org.dxworks.mathframe.renderer.script;

import org.dxworks.mathframe.MathMLConverter;
import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.InvalidStructureException;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ScriptRendererTest {

    private final MathMLConverter converter = new MathMLConverter(true, 256);
    private final MathMLConverter asciiConverter = new MathMLConverter(false, 256);

    @Test
    void subscriptUsesUnicodeGlyphs() throws MathRenderException {
        assertEquals("xᵢ", render("<msub><mi>x</mi><mi>i</mi></msub>"));
    }

    @Test
    void subscriptRowKeepsOperatorSpacing() throws MathRenderException {
        assertEquals("xᵢ ₋ ₁", render("<msub><mi>x</mi><mrow><mi>i</mi><mo>-</mo><mn>1</mn></mrow></msub>"));
    }

    @Test
    void subscriptWithoutInlineFormIsStacked() throws MathRenderException {
        MathBox box = asciiConverter.parse(
                "<msub><mi>x</mi><mrow><mi>a</mi><mo>,</mo><mi>b</mi></mrow></msub>");
        assertEquals(String.join("\n",
                "x",
                " a,b"), box.render());
        assertEquals(0, box.getBaseline());
    }

    @Test
    void compactSubscriptWhenUnicodeIsOff() throws MathRenderException {
        assertEquals("x_ij", asciiConverter.parse("<msub><mi>x</mi><mi>ij</mi></msub>").render());
    }

    @Test
    void compactSubscriptAcceptsCombiningLetters() throws MathRenderException {
        assertEquals("x_कि", render("<msub><mi>x</mi><mi>कि</mi></msub>"));
    }

    @Test
    void noBreakSpacesAroundScriptAreIgnored() throws MathRenderException {
        assertEquals("xᵢ", render("<msub><mi>x</mi><mi>&#160;i&#160;</mi></msub>"));
    }

    @Test
    void fractionSubscriptHangsBelowBase() throws MathRenderException {
        assertEquals(String.join("\n",
                "x",
                " 1",
                " ─",
                " 2"), render("<msub><mi>x</mi><mfrac><mn>1</mn><mn>2</mn></mfrac></msub>"));
    }

    @Test
    void superscriptUsesUnicodeGlyphs() throws MathRenderException {
        assertEquals("xᵃᵇᶜ", render("<msup><mi>x</mi><mi>abc</mi></msup>"));
        assertEquals("eᶻ·⁵", render("<msup><mi>e</mi><mrow><mi>z</mi><mo>*</mo><mn>5</mn></mrow></msup>"));
    }

    @Test
    void shortSuperscriptFallsBackToCaret() throws MathRenderException {
        assertEquals("x^q1", render("<msup><mi>x</mi><mi>q1</mi></msup>"));
    }

    @Test
    void longSuperscriptIsStackedAboveRight() throws MathRenderException {
        MathBox box = converter.parse("<msup><mi>e</mi><mi>xyzq</mi></msup>");
        assertEquals(String.join("\n",
                " xyzq",
                "e"), box.render());
        assertEquals(1, box.getBaseline());
    }

    @Test
    void primesStayAsWritten() throws MathRenderException {
        assertEquals("f″", render("<msup><mi>f</mi><mo>″</mo></msup>"));
    }

    @Test
    void subSuperscriptInline() throws MathRenderException {
        assertEquals("xᵢ²", render("<msubsup><mi>x</mi><mi>i</mi><mn>2</mn></msubsup>"));
    }

    @Test
    void largeOperatorStacksItsLimits() throws MathRenderException {
        MathBox box = converter.parse(
                "<msubsup><mo>∑</mo><mrow><mi>i</mi><mo>=</mo><mn>1</mn></mrow><mi>n</mi></msubsup>");
        assertEquals(String.join("\n",
                "  n",
                "  ∑",
                "i = 1"), box.render());
        assertEquals(1, box.getBaseline());
    }

    @Test
    void subSuperscriptWithoutInlineFormIsDiagonal() throws MathRenderException {
        MathBox box = converter.parse("<msubsup><mi>x</mi><mi>ab</mi><mi>q</mi></msubsup>");
        assertEquals(String.join("\n",
                " q",
                "x",
                " ab"), box.render());
        assertEquals(1, box.getBaseline());
    }

    @Test
    void rejectsWrongChildCounts() {
        InvalidStructureException sub = assertThrows(InvalidStructureException.class,
                () -> converter.parse("<msub><mi>x</mi></msub>"));
        assertEquals("Subscript needs exactly 2 children", sub.getDetail());

        InvalidStructureException sup = assertThrows(InvalidStructureException.class,
                () -> converter.parse("<msup><mi>x</mi><mi>a</mi><mi>b</mi></msup>"));
        assertEquals("Superscript needs exactly 2 children", sup.getDetail());

        InvalidStructureException subsup = assertThrows(InvalidStructureException.class,
                () -> converter.parse("<msubsup><mi>x</mi><mi>i</mi></msubsup>"));
        assertEquals("Subscript-superscript needs exactly 3 children", subsup.getDetail());
    }

    private String render(String mathml) throws MathRenderException {
        return converter.parse(mathml).render();
    }
}
