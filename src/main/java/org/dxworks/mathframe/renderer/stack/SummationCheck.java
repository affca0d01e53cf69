package org.dxworks.mathframe.renderer.stack;

import org.dxworks.mathframe.renderer.MathElements;
import org.w3c.dom.Element;

/**
 * A summation base is widened to two columns so its limits do not collapse into one column.
 */
final class SummationCheck {

    static final int MIN_WIDTH = 2;

    private SummationCheck() {}

    static boolean isSummation(Element element) {
        String text = MathElements.text(MathElements.firstChildElement(element));
        return text != null && text.contains("∑");
    }
}
