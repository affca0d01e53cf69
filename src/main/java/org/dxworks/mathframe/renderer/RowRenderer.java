package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.MathTag;
import org.dxworks.mathframe.model.MathBox;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A horizontal row of siblings. Loose text around the children is kept as its own
 * boxes, and a fraction followed by a stacked construct gets a two-column gap so their
 * rows do not run into each other.
 */
public class RowRenderer implements ConstructRenderer {

    private static final Set<String> STACKED_AFTER_FRACTION = Set.of("msubsup", "munderover", "munder", "mover");
    private static final String FRACTION_GAP = "  ";

    @Override
    public MathBox render(Element element, RenderContext context) throws MathRenderException {
        List<MathBox> boxes = new ArrayList<>();
        addTrimmedText(boxes, MathElements.text(element));

        String previousTag = null;
        for (Element child : MathElements.childElements(element)) {
            String childTag = MathElements.localName(child);
            if (MathTag.MFRAC.getName().equals(previousTag) && STACKED_AFTER_FRACTION.contains(childTag)) {
                boxes.add(MathBox.fromText(FRACTION_GAP));
            }

            MathBox childBox = context.render(child);
            if (childBox.getWidth() > 0) {
                boxes.add(childBox);
            }
            addTrimmedText(boxes, MathElements.tail(child));

            previousTag = childTag;
        }

        return BoxComposer.horizontal(boxes);
    }

    private static void addTrimmedText(List<MathBox> boxes, String text) {
        if (text == null) {
            return;
        }
        String trimmed = MathTextUtils.trim(text);
        if (!trimmed.isEmpty()) {
            boxes.add(MathBox.fromText(trimmed));
        }
    }
}
