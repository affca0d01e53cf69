package org.dxworks.mathframe.renderer.stack;

import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.dxworks.mathframe.renderer.MathTextUtils;
import org.dxworks.mathframe.renderer.RenderContext;
import org.w3c.dom.Element;

import java.util.List;

public class UnderRenderer implements ConstructRenderer {

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<Element> children = RenderContext.requireChildren(element, 2, "Under element needs exactly 2 children");
        MathBox base = context.render(children.get(0));
        MathBox under = context.render(children.get(1));

        int width = Math.max(base.getWidth(), under.getWidth());
        if (SummationCheck.isSummation(element)) {
            width = Math.max(width, SummationCheck.MIN_WIDTH);
        }

        MathBox result = MathBox.blank(width, base.getHeight() + under.getHeight(), base.getBaseline());
        result.overwrite(base, MathTextUtils.centerOffset(width, base.getWidth()), 0);
        result.overwrite(under, MathTextUtils.centerOffset(width, under.getWidth()), base.getHeight());
        return result;
    }
}
