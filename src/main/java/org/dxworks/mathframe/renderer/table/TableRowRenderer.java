package org.dxworks.mathframe.renderer.table;

import org.dxworks.mathframe.MathTag;
import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.BoxComposer;
import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.MathElements;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.dxworks.mathframe.renderer.RenderContext;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

public class TableRowRenderer implements ConstructRenderer {

    private static final String CELL_GAP = "  ";

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<Element> cells = MathElements.childElements(element, MathTag.MTD);
        if (cells.isEmpty()) {
            return MathBox.empty();
        }

        List<MathBox> boxes = new ArrayList<>(cells.size() * 2);
        for (int i = 0; i < cells.size(); i++) {
            boxes.add(context.render(cells.get(i)));
            if (i < cells.size() - 1) {
                boxes.add(MathBox.fromText(CELL_GAP));
            }
        }
        return BoxComposer.horizontal(boxes);
    }
}
