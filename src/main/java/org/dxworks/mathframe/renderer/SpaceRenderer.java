package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.model.MathBox;
import org.w3c.dom.Element;

/**
 * A space element is always one column wide; declared widths are ignored.
 */
public class SpaceRenderer implements ConstructRenderer {

    @Override
    public MathBox render(Element element, RenderContext context) {
        return MathBox.fromText(" ");
    }
}
