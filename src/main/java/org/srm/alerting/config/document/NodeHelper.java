package org.srm.alerting.config.document;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Small DOM utilities for ordered child access, text extraction and top-level insertion/removal.
 */
public class NodeHelper {
    static final String INDENT = "    ";

    /**
     * Local name of an element, falling back to the tag name for documents parsed without namespaces.
     */
    public static String localName(Element element) {
        String name = element.getLocalName();
        return name != null ? name : element.getTagName();
    }

    public static Category categoryOf(Element element) {
        return Category.fromTag(localName(element));
    }

    /**
     * Concatenates the direct text and CDATA children of an element, ignoring nested elements.
     */
    public static String textOf(Element element) {
        StringBuilder text = new StringBuilder();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(child.getNodeValue());
            }
        }
        return text.toString();
    }

    /**
     * Text of a reference element, trimmed; empty if the element only holds whitespace.
     */
    public static String referenceTarget(Element reference) {
        return textOf(reference).trim();
    }

    public static List<Element> childElements(Element parent) {
        List<Element> elements = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i).getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) children.item(i));
            }
        }
        return elements;
    }

    public static List<Element> childElementsNamed(Element parent, String tag) {
        List<Element> elements = new ArrayList<>();
        for (Element child : childElements(parent)) {
            if (tag.equals(localName(child))) {
                elements.add(child);
            }
        }
        return elements;
    }

    public static Element firstChildNamed(Element parent, String tag) {
        for (Element child : childElements(parent)) {
            if (tag.equals(localName(child))) {
                return child;
            }
        }
        return null;
    }

    /**
     * Text of the first child element with the given tag, or an empty string if there is none.
     */
    public static String firstChildText(Element parent, String tag) {
        Element child = firstChildNamed(parent, tag);
        return child != null ? textOf(child) : "";
    }

    public static Element createElement(AlertingDocument document, String tag) {
        return document.dom().createElementNS(document.namespace(), tag);
    }

    public static Element createTextElement(AlertingDocument document, String tag, String text) {
        Element element = createElement(document, tag);
        element.appendChild(document.dom().createTextNode(text));
        return element;
    }

    /**
     * Appends a child element to a node, indented like the node's existing children.
     */
    public static void appendIndented(Element parent, Element child) {
        Document doc = parent.getOwnerDocument();
        parent.appendChild(doc.createTextNode(INDENT));
        parent.appendChild(child);
        parent.appendChild(doc.createTextNode("\n" + INDENT));
    }

    /**
     * Inserts a top-level node before {@code refChild}, or at the end of the root when it is null.
     */
    public static void insertTopLevel(Element root, Element node, Node refChild) {
        Document doc = root.getOwnerDocument();
        if (refChild == null) {
            root.appendChild(doc.createTextNode(INDENT));
            root.appendChild(node);
            root.appendChild(doc.createTextNode("\n"));
        } else {
            root.insertBefore(node, refChild);
            root.insertBefore(doc.createTextNode("\n" + INDENT), refChild);
        }
    }

    /**
     * Removes a node together with the whitespace-only text node directly in front of it, if present.
     */
    public static void removeWithLeadingWhitespace(Element node) {
        Node parent = node.getParentNode();
        if (parent == null) {
            return;
        }
        Node previous = node.getPreviousSibling();
        parent.removeChild(node);
        if (previous != null && previous.getNodeType() == Node.TEXT_NODE
                && previous.getNodeValue().trim().isEmpty()) {
            parent.removeChild(previous);
        }
    }
}
