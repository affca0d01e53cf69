package org.dxworks.mathframe.renderer;

public enum ErrorKind {
    XML_PARSE("XML parsing error"),
    INVALID_STRUCTURE("Invalid MathML structure");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
