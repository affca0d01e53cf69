package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.MathTag;
import org.dxworks.mathframe.model.MathBox;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Per-conversion dispatcher. Picks the renderer for each element's construct, falls back to
 * horizontal flattening for unknown tags and guards the nesting depth.
 * One instance serves a single conversion and is not shared between threads.
 */
public final class RenderContext {

    private final Map<MathTag, ConstructRenderer> renderers;
    private final ConstructRenderer fallback;
    private final boolean useUnicode;
    private final int maxNestingDepth;
    private int depth;

    public RenderContext(Map<MathTag, ConstructRenderer> renderers,
                         ConstructRenderer fallback,
                         boolean useUnicode,
                         int maxNestingDepth) {
        this.renderers = renderers;
        this.fallback = fallback;
        this.useUnicode = useUnicode;
        this.maxNestingDepth = maxNestingDepth;
    }

    public boolean isUseUnicode() {
        return useUnicode;
    }

    public MathBox render(Element element) throws MathRenderException {
        if (depth >= maxNestingDepth) {
            throw new InvalidStructureException("Nesting depth exceeds maximum of " + maxNestingDepth);
        }
        ConstructRenderer renderer = renderers.getOrDefault(MathElements.tagOf(element), fallback);
        depth++;
        try {
            return renderer.render(element, this);
        } finally {
            depth--;
        }
    }

    public List<MathBox> renderAll(List<Element> elements) throws MathRenderException {
        List<MathBox> boxes = new ArrayList<>(elements.size());
        for (Element element : elements) {
            boxes.add(render(element));
        }
        return boxes;
    }

    /** Renders the element children of {@code parent} and joins them on a common baseline. */
    public MathBox renderChildrenHorizontally(Element parent) throws MathRenderException {
        return BoxComposer.horizontal(renderAll(MathElements.childElements(parent)));
    }

    /** Element children of {@code element}, failing unless there are exactly {@code count}. */
    public static List<Element> requireChildren(Element element, int count, String description)
            throws InvalidStructureException {
        List<Element> children = MathElements.childElements(element);
        if (children.size() != count) {
            throw new InvalidStructureException(description);
        }
        return children;
    }
}
