package org.dxworks.mathframe.renderer.stack;

import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.MathElements;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.dxworks.mathframe.renderer.MathTextUtils;
import org.dxworks.mathframe.renderer.RenderContext;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Numerator over denominator, both centred, with a rule on the baseline row.
 * {@code linethickness="0pt"} drops the rule; that form carries conditions under large operators.
 */
public class FractionRenderer implements ConstructRenderer {

    public static final int RULE = '─';
    private static final String INVISIBLE_THICKNESS = "0pt";

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<Element> children = RenderContext.requireChildren(element, 2, "Fraction needs exactly 2 children");
        MathBox numerator = context.render(children.get(0));
        MathBox denominator = context.render(children.get(1));

        if (INVISIBLE_THICKNESS.equals(MathElements.attribute(element, "linethickness"))) {
            return stackWithoutRule(numerator, denominator);
        }
        return stackWithRule(numerator, denominator);
    }

    static MathBox stackWithRule(MathBox numerator, MathBox denominator) {
        int width = Math.max(numerator.getWidth(), denominator.getWidth());
        int baseline = numerator.getHeight();
        MathBox result = MathBox.blank(width, numerator.getHeight() + 1 + denominator.getHeight(), baseline);

        result.overwrite(numerator, MathTextUtils.centerOffset(width, numerator.getWidth()), 0);
        for (int x = 0; x < width; x++) {
            result.setChar(x, baseline, RULE);
        }
        result.overwrite(denominator, MathTextUtils.centerOffset(width, denominator.getWidth()), baseline + 1);
        return result;
    }

    static MathBox stackWithoutRule(MathBox numerator, MathBox denominator) {
        int width = Math.max(numerator.getWidth(), denominator.getWidth());
        int height = numerator.getHeight() + denominator.getHeight();
        MathBox result = MathBox.blank(width, height, numerator.getHeight() - 1);

        result.overwrite(numerator, MathTextUtils.centerOffset(width, numerator.getWidth()), 0);
        result.overwrite(denominator, MathTextUtils.centerOffset(width, denominator.getWidth()), numerator.getHeight());
        return result;
    }
}
