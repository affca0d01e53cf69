package org.dxworks.mathframe.renderer.script;

import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.dxworks.mathframe.renderer.MathTextUtils;
import org.dxworks.mathframe.renderer.RenderContext;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Optional;

public class SubscriptRenderer implements ConstructRenderer {

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<Element> children = RenderContext.requireChildren(element, 2, "Subscript needs exactly 2 children");
        MathBox base = context.render(children.get(0));
        MathBox subscript = context.render(children.get(1));

        if (MathTextUtils.isInline(base)) {
            String subscriptText = ScriptNotation.subscriptText(subscript, ScriptNotation.SUBSCRIPT_FLATTEN_LIMIT);
            if (!subscriptText.isEmpty()) {
                Optional<MathBox> inline = ScriptNotation.inlineSubscript(base, subscriptText, context.isUseUnicode());
                if (inline.isPresent()) {
                    return inline.get();
                }
            }
        }

        return stack(base, subscript);
    }

    /** Subscript hangs below the base's baseline, to the right of it. */
    static MathBox stack(MathBox base, MathBox subscript) {
        int width = base.getWidth() + subscript.getWidth();
        int height = Math.max(base.getHeight(), base.getBaseline() + 1 + subscript.getHeight());
        MathBox result = MathBox.blank(width, height, base.getBaseline());
        result.overwrite(base, 0, 0);
        result.overwrite(subscript, base.getWidth(), base.getBaseline() + 1);
        return result;
    }
}
