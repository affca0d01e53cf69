package org.dxworks.mathframe.renderer;

public class InvalidStructureException extends MathRenderException {

    public InvalidStructureException(String detail) {
        super(ErrorKind.INVALID_STRUCTURE, detail, null);
    }
}
