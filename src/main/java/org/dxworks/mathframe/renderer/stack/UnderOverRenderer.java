package org.dxworks.mathframe.renderer.stack;

import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.dxworks.mathframe.renderer.MathTextUtils;
import org.dxworks.mathframe.renderer.RenderContext;
import org.w3c.dom.Element;

import java.util.List;

public class UnderOverRenderer implements ConstructRenderer {

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<Element> children = RenderContext.requireChildren(element, 3, "Underover element needs exactly 3 children");
        MathBox base = context.render(children.get(0));
        MathBox under = context.render(children.get(1));
        MathBox over = context.render(children.get(2));

        int width = Math.max(base.getWidth(), Math.max(under.getWidth(), over.getWidth()));
        if (SummationCheck.isSummation(element)) {
            width = Math.max(width, SummationCheck.MIN_WIDTH);
        }
        int height = over.getHeight() + base.getHeight() + under.getHeight();

        MathBox result = MathBox.blank(width, height, over.getHeight() + base.getBaseline());
        result.overwrite(over, MathTextUtils.centerOffset(width, over.getWidth()), 0);
        result.overwrite(base, MathTextUtils.centerOffset(width, base.getWidth()), over.getHeight());
        result.overwrite(under, MathTextUtils.centerOffset(width, under.getWidth()), over.getHeight() + base.getHeight());
        return result;
    }
}
