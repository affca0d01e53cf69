package org.dxworks.mathframe.renderer.table;

import org.dxworks.mathframe.MathTag;
import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.MathElements;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.dxworks.mathframe.renderer.MathTextUtils;
import org.dxworks.mathframe.renderer.RenderContext;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.List;
import java.util.Locale;

/**
 * Table: rows stacked top to bottom, each centred on the widest one.
 * When the second row reads as a "where" clause it is set off by an empty line.
 */
public class TableRenderer implements ConstructRenderer {

    private static final String WHERE = "where";

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<Element> rowElements = MathElements.childElements(element, MathTag.MTR);
        if (rowElements.isEmpty()) {
            return MathBox.empty();
        }
        List<MathBox> rows = context.renderAll(rowElements);

        int width = 0;
        int height = 0;
        for (MathBox row : rows) {
            width = Math.max(width, row.getWidth());
            height += row.getHeight();
        }
        boolean whereClause = rows.size() >= 2 && isWhereClause(rowElements.get(1));
        if (whereClause) {
            height++;
        }

        MathBox result = MathBox.blank(width, height, height / 2);
        int y = 0;
        for (int i = 0; i < rows.size(); i++) {
            if (whereClause && i == 1) {
                y++;
            }
            MathBox row = rows.get(i);
            result.overwrite(row, MathTextUtils.centerOffset(width, row.getWidth()), y);
            y += row.getHeight();
        }
        return result;
    }

    /** Only text sitting directly in a cell, or leading a cell's child element, counts. */
    static boolean isWhereClause(Element row) {
        for (Element cell : MathElements.childElements(row, MathTag.MTD)) {
            for (Node node : MathElements.childNodes(cell)) {
                String text = MathElements.text(node);
                if (text != null && text.toLowerCase(Locale.ROOT).contains(WHERE)) {
                    return true;
                }
            }
        }
        return false;
    }
}
