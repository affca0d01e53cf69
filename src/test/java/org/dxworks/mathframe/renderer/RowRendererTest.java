package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.MathMLConverter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class RowRendererTest {

    private final MathMLConverter converter = new MathMLConverter(true, 256);

    @Test
    void keepsLeadingAndTrailingTextAroundChildren() throws MathRenderException {
        assertEquals("leadbtail1dtail2",
                render("<mrow> lead <mi>b</mi> tail1 <mi>d</mi> tail2 </mrow>"));
    }

    @Test
    void whitespaceBetweenChildrenAddsNothing() throws MathRenderException {
        assertEquals("ab", render("<mrow>\n  <mi>a</mi>\n   <mi>b</mi>  </mrow>"));
    }

    @Test
    void noBreakSpaceAroundTextIsTrimmed() throws MathRenderException {
        assertEquals("ab", render("<mrow>&#160;<mi>a</mi>&#160;b&#160;</mrow>"));
    }

    @Test
    void fractionBeforeStackedConstructGetsGap() throws MathRenderException {
        assertEquals(String.join("\n",
                "a   n",
                "─   ∑",
                "b   i"), render("<mrow><mfrac><mi>a</mi><mi>b</mi></mfrac>"
                + "<munderover><mo>∑</mo><mi>i</mi><mi>n</mi></munderover></mrow>"));
    }

    private String render(String mathml) throws MathRenderException {
        return converter.parse(mathml).render();
    }
}
