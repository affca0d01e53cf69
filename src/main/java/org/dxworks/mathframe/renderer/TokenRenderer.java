package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.model.MathBox;
import org.w3c.dom.Element;

/**
 * Identifiers, numbers and text runs: the element's own text, untouched.
 */
public class TokenRenderer implements ConstructRenderer {

    @Override
    public MathBox render(Element element, RenderContext context) {
        return MathBox.fromText(MathElements.textOrEmpty(element));
    }
}
