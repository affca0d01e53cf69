package org.dxworks.mathframe.renderer.radical;

import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.dxworks.mathframe.renderer.MathTextUtils;
import org.dxworks.mathframe.renderer.RenderContext;
import org.dxworks.mathframe.renderer.script.UnicodeScripts;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Optional;

/**
 * Root with an explicit index. Inline as {@code ³√(x)} or {@code [3]√(x)}; otherwise the
 * drawn radical with the index written in front of its joint.
 */
public class NthRootRenderer implements ConstructRenderer {

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<Element> children = RenderContext.requireChildren(element, 2,
                "Nth root needs exactly 2 children (radicand and index)");
        MathBox radicand = context.render(children.get(0));
        MathBox index = context.render(children.get(1));

        if (radicand.getHeight() == 1 && index.getHeight() == 1) {
            String radicandText = MathTextUtils.firstRow(radicand);
            String indexText = MathTextUtils.firstRow(index);
            Optional<String> superscript = UnicodeScripts.trySuperscript(indexText, context.isUseUnicode());
            if (superscript.isPresent()) {
                return MathBox.fromText(superscript.get() + "√(" + radicandText + ")");
            }
            return MathBox.fromText("[" + indexText + "]√(" + radicandText + ")");
        }

        String indexText = MathTextUtils.trim(String.join("", MathTextUtils.rows(index)));
        int indexWidth = MathTextUtils.columns(indexText);

        List<String> lines = RadicalGlyph.withIndex(
                RadicalGlyph.indexed(radicand.getHeight(), radicand.getWidth()), indexText);

        int width = Math.max(RadicalGlyph.width(lines), radicand.getWidth() + RadicalGlyph.WIDTH_PADDING + indexWidth);
        int height = Math.max(lines.size(), 1 + radicand.getHeight());
        int contentX = radicand.getHeight() == 3
                ? 7 + indexWidth
                : radicand.getHeight() + 4 + indexWidth;
        return RadicalGlyph.compose(lines, radicand, width, height, contentX);
    }
}
