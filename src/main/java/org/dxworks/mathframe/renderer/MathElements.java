package org.dxworks.mathframe.renderer;

import org.dxworks.mathframe.MathTag;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only navigation over DOM elements: tag, attributes, direct text, tail text and
 * element children.
 */
public final class MathElements {

    private MathElements() {}

    public static String localName(Element element) {
        String local = element.getLocalName();
        return local != null ? local : element.getTagName();
    }

    public static MathTag tagOf(Element element) {
        return MathTag.fromName(localName(element));
    }

    /** Attribute value, or {@code null} when the attribute is absent. */
    public static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    public static String attribute(Element element, String name, String defaultValue) {
        String value = attribute(element, name);
        return value != null ? value : defaultValue;
    }

    public static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element child) {
                result.add(child);
            }
        }
        return result;
    }

    public static List<Element> childElements(Element parent, MathTag tag) {
        List<Element> result = new ArrayList<>();
        for (Element child : childElements(parent)) {
            if (tagOf(child) == tag) {
                result.add(child);
            }
        }
        return result;
    }

    public static List<Node> childNodes(Element parent) {
        List<Node> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add(nodes.item(i));
        }
        return result;
    }

    public static Element firstChildElement(Element parent) {
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element child) {
                return child;
            }
        }
        return null;
    }

    /**
     * The text directly inside a node: a text node's own data, or for an element the
     * text that precedes its first child node. {@code null} when there is none.
     */
    public static String text(Node node) {
        if (node == null) {
            return null;
        }
        if (isText(node)) {
            return node.getNodeValue();
        }
        Node first = node.getFirstChild();
        return isText(first) ? first.getNodeValue() : null;
    }

    public static String textOrEmpty(Node node) {
        String text = text(node);
        return text != null ? text : "";
    }

    /** Text that follows the element inside its parent, up to the next sibling node. */
    public static String tail(Element element) {
        Node next = element.getNextSibling();
        return isText(next) ? next.getNodeValue() : null;
    }

    private static boolean isText(Node node) {
        return node != null
                && (node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE);
    }
}
