package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.model.MathBox;
import org.w3c.dom.Element;

public interface ConstructRenderer {
    MathBox render(Element element, RenderContext context) throws MathRenderException;
}
