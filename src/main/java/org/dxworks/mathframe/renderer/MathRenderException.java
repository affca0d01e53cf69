package org.dxworks.mathframe.renderer;

/**
 * Terminal failure of a conversion. Either the markup could not be parsed or a construct
 * received the wrong number of children; there is no partial output in both cases.
 */
public abstract class MathRenderException extends Exception {

    private final ErrorKind kind;
    private final String detail;

    protected MathRenderException(ErrorKind kind, String detail, Throwable cause) {
        super(kind.getLabel() + ": " + detail, cause);
        this.kind = kind;
        this.detail = detail;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** The description without the kind prefix. */
    public String getDetail() {
        return detail;
    }
}
