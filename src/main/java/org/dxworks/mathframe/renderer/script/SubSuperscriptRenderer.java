package org.dxworks.mathframe.renderer.script;

import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.dxworks.mathframe.renderer.MathTextUtils;
import org.dxworks.mathframe.renderer.RenderContext;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Optional;

/**
 * Base with both a subscript and a superscript. A large operator base stacks its limits
 * above and below; anything else tries the inline forms and then a diagonal layout.
 */
public class SubSuperscriptRenderer implements ConstructRenderer {

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<Element> children = RenderContext.requireChildren(element, 3, "Subscript-superscript needs exactly 3 children");
        MathBox base = context.render(children.get(0));
        MathBox subscript = context.render(children.get(1));
        MathBox superscript = context.render(children.get(2));

        boolean inlineBase = MathTextUtils.isInline(base);
        if (inlineBase && MathTextUtils.isLargeOperator(MathTextUtils.firstRow(base))) {
            return stackLimits(base, subscript, superscript);
        }

        if (inlineBase) {
            String subscriptText = ScriptNotation.subscriptText(subscript, ScriptNotation.SUBSUP_FLATTEN_LIMIT);
            String superscriptText = ScriptNotation.superscriptText(superscript);
            if (!subscriptText.isEmpty() && !superscriptText.isEmpty()) {
                Optional<String> sub = UnicodeScripts.trySubscript(subscriptText, context.isUseUnicode());
                Optional<String> sup = UnicodeScripts.trySuperscript(superscriptText, context.isUseUnicode());
                if (sub.isPresent() && sup.isPresent()) {
                    return MathBox.fromText(MathTextUtils.firstRow(base) + sub.get() + sup.get());
                }
            }
        }

        return diagonal(base, subscript, superscript);
    }

    /** Superscript, operator and subscript on top of each other, each centred. */
    static MathBox stackLimits(MathBox base, MathBox subscript, MathBox superscript) {
        int width = Math.max(base.getWidth(), Math.max(subscript.getWidth(), superscript.getWidth()));
        int height = superscript.getHeight() + base.getHeight() + subscript.getHeight();
        int baseline = superscript.getHeight() + base.getBaseline();
        MathBox result = MathBox.blank(width, height, baseline);
        result.overwrite(superscript, MathTextUtils.centerOffset(width, superscript.getWidth()), 0);
        result.overwrite(base, MathTextUtils.centerOffset(width, base.getWidth()), superscript.getHeight());
        result.overwrite(subscript, MathTextUtils.centerOffset(width, subscript.getWidth()),
                superscript.getHeight() + base.getHeight());
        return result;
    }

    /** Base in the middle band, superscript up and subscript down to its right. */
    static MathBox diagonal(MathBox base, MathBox subscript, MathBox superscript) {
        int width = base.getWidth() + Math.max(subscript.getWidth(), superscript.getWidth());
        int height = superscript.getHeight() + base.getHeight() + subscript.getHeight();
        int baseline = superscript.getHeight() + base.getBaseline();
        MathBox result = MathBox.blank(width, height, baseline);
        result.overwrite(base, 0, superscript.getHeight());
        result.overwrite(superscript, base.getWidth(), 0);
        result.overwrite(subscript, base.getWidth(), superscript.getHeight() + base.getHeight());
        return result;
    }
}
