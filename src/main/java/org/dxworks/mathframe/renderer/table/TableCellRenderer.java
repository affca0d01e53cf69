package org.dxworks.mathframe.renderer.table;

import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.BoxComposer;
import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.MathElements;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.dxworks.mathframe.renderer.RenderContext;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/** Cell content in a row; a cell without rendered children shows its own text. */
public class TableCellRenderer implements ConstructRenderer {

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<MathBox> boxes = new ArrayList<>();
        for (Element child : MathElements.childElements(element)) {
            MathBox box = context.render(child);
            if (box.getWidth() > 0) {
                boxes.add(box);
            }
        }
        if (!boxes.isEmpty()) {
            return BoxComposer.horizontal(boxes);
        }
        return MathBox.fromText(MathElements.text(element));
    }
}
