package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.model.MathBox;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Fallback for constructs without a dedicated layout: children side by side, or the
 * element's own text when it has no element children.
 */
public class FlattenRenderer implements ConstructRenderer {

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<Element> children = MathElements.childElements(element);
        if (children.isEmpty()) {
            return MathBox.fromText(MathElements.textOrEmpty(element));
        }
        return BoxComposer.horizontal(context.renderAll(children));
    }
}
