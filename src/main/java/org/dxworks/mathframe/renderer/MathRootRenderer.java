package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.model.MathBox;
import org.w3c.dom.Element;

import java.util.List;

/**
 * The {@code <math>} root: a lone child is rendered as is, several are flattened.
 */
public class MathRootRenderer implements ConstructRenderer {

    private final FlattenRenderer flatten = new FlattenRenderer();

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<Element> children = MathElements.childElements(element);
        if (children.size() == 1) {
            return context.render(children.get(0));
        }
        return flatten.render(element, context);
    }
}
