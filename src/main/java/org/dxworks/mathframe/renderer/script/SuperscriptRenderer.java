package org.dxworks.mathframe.renderer.script;

import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.dxworks.mathframe.renderer.MathTextUtils;
import org.dxworks.mathframe.renderer.RenderContext;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Optional;

public class SuperscriptRenderer implements ConstructRenderer {

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<Element> children = RenderContext.requireChildren(element, 2, "Superscript needs exactly 2 children");
        MathBox base = context.render(children.get(0));
        MathBox superscript = context.render(children.get(1));

        if (MathTextUtils.isInline(base) && MathTextUtils.isInline(superscript)) {
            String superscriptText = ScriptNotation.superscriptText(superscript);
            Optional<MathBox> inline = ScriptNotation.inlineSuperscript(base, superscriptText, context.isUseUnicode());
            if (inline.isPresent()) {
                return inline.get();
            }
        }

        return stack(base, superscript);
    }

    /** Superscript rows sit above the base, starting where the base ends. */
    static MathBox stack(MathBox base, MathBox superscript) {
        int width = base.getWidth() + superscript.getWidth();
        int height = superscript.getHeight() + base.getHeight();
        int baseline = superscript.getHeight() + base.getBaseline();
        MathBox result = MathBox.blank(width, height, baseline);
        result.overwrite(superscript, base.getWidth(), 0);
        result.overwrite(base, 0, superscript.getHeight());
        return result;
    }
}
