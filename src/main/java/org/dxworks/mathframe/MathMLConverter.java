package org.dxworks.mathframe;

import org.dxworks.mathframe.model.MathBox;
import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.MathRenderException;
import org.dxworks.mathframe.renderer.RenderContext;
import org.dxworks.mathframe.renderer.XmlParseException;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.Map;
import java.util.Optional;

/**
 * Converts MathML into monospaced text. Instances hold no per-conversion state and can be
 * shared between threads.
 */
public class MathMLConverter {

    public static final String MATHML_NAMESPACE = "http://www.w3.org/1998/Math/MathML";

    private static final Map<MathTag, ConstructRenderer> RENDERERS = RendererRegistry.buildRenderers();

    private final boolean useUnicode;
    private final int maxNestingDepth;

    public MathMLConverter(boolean useUnicode, int maxNestingDepth) {
        this.useUnicode = useUnicode;
        this.maxNestingDepth = maxNestingDepth > 0 ? maxNestingDepth : MathframeConfig.DEFAULT_MAX_NESTING_DEPTH;
    }

    public static MathMLConverter from(MathframeConfig config) {
        return new MathMLConverter(config.isUseUnicode(), config.getMaxNestingDepth());
    }

    /**
     * Renders the first math fragment found in {@code text}. Text without a fragment is
     * returned unchanged.
     */
    public static String convert(String text, boolean useUnicode) throws MathRenderException {
        return new MathMLConverter(useUnicode, MathframeConfig.DEFAULT_MAX_NESTING_DEPTH).toAscii(text);
    }

    public String toAscii(String text) throws MathRenderException {
        Optional<String> fragment = MathFragments.findFirst(text);
        if (fragment.isEmpty()) {
            return text;
        }
        return parse(fragment.get()).render();
    }

    /**
     * Parses a MathML fragment and lays it out. Markup that does not start with a
     * {@code <math} element is wrapped in one first.
     */
    public MathBox parse(String mathml) throws MathRenderException {
        String markup = mathml.strip();
        if (!markup.startsWith("<math")) {
            markup = "<math xmlns=\"" + MATHML_NAMESPACE + "\">" + markup + "</math>";
        }

        Document document = parseDocument(markup);
        RenderContext context = new RenderContext(RENDERERS, RendererRegistry.fallback(), useUnicode, maxNestingDepth);
        return context.render(document.getDocumentElement());
    }

    public boolean isUseUnicode() {
        return useUnicode;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    private static Document parseDocument(String markup) throws XmlParseException {
        try {
            DocumentBuilder builder = newDocumentBuilder();
            Document document = builder.parse(new InputSource(new StringReader(markup)));
            document.getDocumentElement().normalize();
            return document;
        } catch (SAXException e) {
            throw new XmlParseException(e.getMessage(), e);
        } catch (ParserConfigurationException | IOException e) {
            throw new XmlParseException(String.valueOf(e.getMessage()), e);
        }
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setCoalescing(true);
        factory.setExpandEntityReferences(false);
        factory.setXIncludeAware(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        // No DTDs: external entities cannot be declared at all
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new RethrowingErrorHandler());
        return builder;
    }

    /** Keeps the parser from printing to stderr; errors surface as exceptions instead. */
    private static class RethrowingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            // recoverable, parsing continues
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
