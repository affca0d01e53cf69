package org.dxworks.mathframe.renderer.radical;

import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.BoxComposer;
import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.MathElements;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.dxworks.mathframe.renderer.MathTextUtils;
import org.dxworks.mathframe.renderer.RenderContext;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Square root. Single-line radicands are written {@code √(...)}; taller ones get a drawn sign.
 * Several children form an implicit row.
 */
public class SquareRootRenderer implements ConstructRenderer {

    private static final String RADICAL = "√";

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<Element> children = MathElements.childElements(element);
        if (children.isEmpty()) {
            return MathBox.fromText(RADICAL);
        }

        MathBox inner = children.size() == 1
                ? context.render(children.get(0))
                : BoxComposer.horizontal(context.renderAll(children));

        if (inner.getHeight() == 1) {
            return MathBox.fromText(RADICAL + "(" + MathTextUtils.firstRow(inner) + ")");
        }

        // one extra row for the overline
        List<String> lines = RadicalGlyph.squareRoot(inner.getHeight() + 1,
                inner.getWidth() + RadicalGlyph.OVERLINE_EXTRA);
        int width = Math.max(RadicalGlyph.width(lines), inner.getWidth() + RadicalGlyph.WIDTH_PADDING);
        int contentX = inner.getHeight() + 3;
        return RadicalGlyph.compose(lines, inner, width, lines.size(), contentX);
    }
}
