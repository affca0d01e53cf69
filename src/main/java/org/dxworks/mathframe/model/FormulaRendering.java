package org.dxworks.mathframe.model;

import java.util.List;

/** One rendered fragment: its grid as text lines, or the reason it could not be rendered. */
public class FormulaRendering {
    public int index;
    public Integer width;
    public Integer height;
    public Integer baseline;
    public List<String> lines;
    public String error;

    public static FormulaRendering of(int index, MathBox box) {
        FormulaRendering rendering = new FormulaRendering();
        rendering.index = index;
        rendering.width = box.getWidth();
        rendering.height = box.getHeight();
        rendering.baseline = box.getBaseline();
        rendering.lines = box.render().isEmpty() ? List.of() : List.of(box.render().split("\n", -1));
        return rendering;
    }

    public static FormulaRendering failed(int index, String error) {
        FormulaRendering rendering = new FormulaRendering();
        rendering.index = index;
        rendering.error = error;
        return rendering;
    }
}
