package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.model.MathBox;
import org.w3c.dom.Element;

import java.util.Set;

public class OperatorRenderer implements ConstructRenderer {

    private static final Set<String> FUNCTION_NAMES = Set.of("log", "ln", "sin", "cos", "tan", "exp");
    private static final Set<String> BINARY_OPERATORS = Set.of("=", "+", "-", "*", "/", "≠");

    @Override
    public MathBox render(Element element, RenderContext context) {
        String text = MathElements.textOrEmpty(element);
        String form = MathElements.attribute(element, "form", "");

        if ("prefix".equals(form) || FUNCTION_NAMES.contains(text)) {
            return MathBox.fromText(text);
        }
        if (BINARY_OPERATORS.contains(text)) {
            return MathBox.fromText(" " + text + " ");
        }
        // brackets and everything else stay as written
        return MathBox.fromText(text);
    }
}
