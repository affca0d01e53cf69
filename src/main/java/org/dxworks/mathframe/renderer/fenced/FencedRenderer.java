package org.dxworks.mathframe.renderer.fenced;

import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.BoxComposer;
import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.DelimiterGlyphs;
import org.dxworks.mathframe.renderer.MathElements;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.dxworks.mathframe.renderer.RenderContext;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Content between an opening and a closing delimiter, children joined by the separator.
 * Multi-row content gets glyph columns for parentheses and brackets; an opening brace
 * becomes a left-only brace column as used for case definitions.
 */
public class FencedRenderer implements ConstructRenderer {

    static final String DEFAULT_OPEN = "(";
    static final String DEFAULT_CLOSE = ")";
    static final String DEFAULT_SEPARATORS = ",";

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        String open = MathElements.attribute(element, "open", DEFAULT_OPEN);
        String close = MathElements.attribute(element, "close", DEFAULT_CLOSE);
        String separators = MathElements.attribute(element, "separators", DEFAULT_SEPARATORS);

        MathBox content = renderContent(element, separators, context);

        if ("{".equals(open) && content.getHeight() > 1) {
            return brace(content);
        }
        if (content.getHeight() == 1) {
            return MathBox.fromText(open + content.rowText(0) + close);
        }
        if (content.isEmpty()) {
            return MathBox.fromText(open + close);
        }
        return delimited(content, open, close);
    }

    private static MathBox renderContent(Element element, String separators, RenderContext context)
            throws MathRenderException {
        List<Element> children = MathElements.childElements(element);
        List<MathBox> boxes = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            MathBox box = context.render(children.get(i));
            if (box.getWidth() > 0) {
                boxes.add(box);
                if (i < children.size() - 1 && !separators.isEmpty()) {
                    boxes.add(MathBox.fromText(separators));
                }
            }
        }
        return BoxComposer.horizontal(boxes);
    }

    private static MathBox brace(MathBox content) {
        int height = content.getHeight();
        MathBox result = MathBox.blank(content.getWidth() + 2, height, content.getBaseline());
        DelimiterGlyphs.drawColumn(result, 0, DelimiterGlyphs.column('{', height));
        result.paste(content, 1, 0);
        return result;
    }

    private static MathBox delimited(MathBox content, String open, String close) {
        int height = content.getHeight();
        int width = content.getWidth() + 2;
        MathBox result = MathBox.blank(width, height, content.getBaseline());
        if ("(".equals(open) || "[".equals(open)) {
            DelimiterGlyphs.drawColumn(result, 0, DelimiterGlyphs.column(open.charAt(0), height));
        }
        result.paste(content, 1, 0);
        if (")".equals(close) || "]".equals(close)) {
            DelimiterGlyphs.drawColumn(result, width - 1, DelimiterGlyphs.column(close.charAt(0), height));
        }
        return result;
    }
}
