package org.dxworks.mathframe.renderer.radical;

import org.dxworks.mathframe.MathMLConverter;
import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.InvalidStructureException;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RadicalRendererTest {

    private static final String FRACTION_X_OVER_Y = "<mfrac><mi>x</mi><mi>y</mi></mfrac>";

    private final MathMLConverter converter = new MathMLConverter(true, 256);

    @Test
    void emptySquareRootIsBareSign() throws MathRenderException {
        assertEquals("√", render("<msqrt></msqrt>"));
    }

    @Test
    void singleLineSquareRoot() throws MathRenderException {
        assertEquals("√(x)", render("<msqrt><mi>x</mi></msqrt>"));
        assertEquals("√(x + 1)", render("<msqrt><mi>x</mi><mo>+</mo><mn>1</mn></msqrt>"));
    }

    @Test
    void tallSquareRootIsDrawn() throws MathRenderException {
        MathBox box = converter.parse("<msqrt>" + FRACTION_X_OVER_Y + "</msqrt>");
        assertEquals(String.join("\n",
                "     ⟋─────",
                "    ╱ x",
                "_  ╱  ─",
                " \\╱   y"), box.render());
        assertEquals(11, box.getWidth());
        assertEquals(2, box.getBaseline());
    }

    @Test
    void singleLineRootWithSuperscriptIndex() throws MathRenderException {
        assertEquals("³√(8)", render("<mroot><mn>8</mn><mn>3</mn></mroot>"));
    }

    @Test
    void bracketedIndexWithoutSuperscriptForm() throws MathRenderException {
        assertEquals("[3]√(8)",
                new MathMLConverter(false, 256).parse("<mroot><mn>8</mn><mn>3</mn></mroot>").render());
        assertEquals("[q]√(x)", render("<mroot><mi>x</mi><mi>q</mi></mroot>"));
    }

    @Test
    void tallRootCarriesIndexBeforeJoint() throws MathRenderException {
        MathBox box = converter.parse("<mroot>" + FRACTION_X_OVER_Y + "<mn>3</mn></mroot>");
        assertEquals(String.join("\n",
                "       ⟋─────",
                "      ╱ x",
                " 3_  ╱  ─",
                "   \\╱   y"), box.render());
        assertEquals(13, box.getWidth());
        assertEquals(4, box.getHeight());
        assertEquals(2, box.getBaseline());
    }

    @Test
    void twoRowRadicandGetsTallerSign() throws MathRenderException {
        MathBox box = converter.parse(
                "<mroot><mfrac linethickness=\"0pt\"><mi>k</mi><mi>n</mi></mfrac><mn>3</mn></mroot>");
        assertEquals(String.join("\n",
                "     ⟋─────",
                "     ╱ k",
                " 3_ ╱  n",
                "  \\╱"), box.render());
        assertEquals(12, box.getWidth());
        assertEquals(1, box.getBaseline());
    }

    @Test
    void rootRequiresRadicandAndIndex() {
        InvalidStructureException e = assertThrows(InvalidStructureException.class,
                () -> converter.parse("<mroot><mi>x</mi></mroot>"));
        assertEquals("Nth root needs exactly 2 children (radicand and index)", e.getDetail());
    }

    private String render(String mathml) throws MathRenderException {
        return converter.parse(mathml).render();
    }
}
