package org.dxworks.mathframe.renderer;

public class XmlParseException extends MathRenderException {

    public XmlParseException(String detail, Throwable cause) {
        super(ErrorKind.XML_PARSE, detail, cause);
    }
}
