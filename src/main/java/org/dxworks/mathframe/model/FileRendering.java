package org.dxworks.mathframe.model;

import java.util.ArrayList;
import java.util.List;

public class FileRendering {
    public String filePath;
    public List<FormulaRendering> formulas = new ArrayList<>();
}
