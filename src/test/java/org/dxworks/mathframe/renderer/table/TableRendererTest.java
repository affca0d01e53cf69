package org.dxworks.mathframe.renderer.table;

import org.dxworks.mathframe.MathMLConverter;
import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TableRendererTest {

    private final MathMLConverter converter = new MathMLConverter(true, 256);

    @Test
    void cellsAreSeparatedByTwoSpaces() throws MathRenderException {
        MathBox box = converter.parse("<mtable>"
                + "<mtr><mtd><mi>a</mi></mtd><mtd><mi>b</mi></mtd></mtr>"
                + "<mtr><mtd><mi>c</mi></mtd><mtd><mi>d</mi></mtd></mtr>"
                + "</mtable>");
        assertEquals(String.join("\n",
                "a  b",
                "c  d"), box.render());
        assertEquals(1, box.getBaseline());
    }

    @Test
    void whereClauseIsSetOffByEmptyLine() throws MathRenderException {
        assertEquals(String.join("\n",
                "y   = 1",
                "",
                "where  x"), render(whereTable("where")));
    }

    @Test
    void whereClauseIgnoresCase() throws MathRenderException {
        assertEquals(String.join("\n",
                "y   = 1",
                "",
                "Where  x"), render(whereTable("Where")));
    }

    @Test
    void narrowRowsAreCentred() throws MathRenderException {
        assertEquals(String.join("\n",
                " a",
                "abc"), render("<mtable>"
                + "<mtr><mtd><mi>a</mi></mtd></mtr>"
                + "<mtr><mtd><mi>abc</mi></mtd></mtr>"
                + "</mtable>"));
    }

    @Test
    void emptyTableRendersNothing() throws MathRenderException {
        assertEquals("", render("<mtable></mtable>"));
    }

    @Test
    void cellWithOnlyTextShowsIt() throws MathRenderException {
        assertEquals("plain", render("<mtable><mtr><mtd>plain</mtd></mtr></mtable>"));
    }

    @Test
    void onlyRowChildrenAreLaidOut() throws MathRenderException {
        assertEquals("a", render("<mtable><mi>z</mi><mtr><mtd><mi>a</mi></mtd></mtr></mtable>"));
    }

    @Test
    void tableCentresOnItsMiddleRow() throws MathRenderException {
        assertEquals(String.join("\n",
                "    a",
                "A = b",
                "    c"), render("<mrow><mi>A</mi><mo>=</mo><mtable>"
                + "<mtr><mtd><mi>a</mi></mtd></mtr>"
                + "<mtr><mtd><mi>b</mi></mtd></mtr>"
                + "<mtr><mtd><mi>c</mi></mtd></mtr>"
                + "</mtable></mrow>"));
    }

    private static String whereTable(String keyword) {
        return "<mtable>"
                + "<mtr><mtd><mi>y</mi></mtd><mtd><mo>=</mo><mn>1</mn></mtd></mtr>"
                + "<mtr><mtd><mtext>" + keyword + "</mtext></mtd><mtd><mi>x</mi></mtd></mtr>"
                + "</mtable>";
    }

    private String render(String mathml) throws MathRenderException {
        return converter.parse(mathml).render();
    }
}
