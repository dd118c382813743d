package dev.feedcraft.util;

import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Namespace-agnostic view over a DOM tree.
 *
 * <p>
 * Element and attribute names are compared by local name only: everything up to and including the
 * first {@code :} is ignored and no namespace URI is ever resolved. {@code <media:title>} therefore
 * matches {@code title}, whatever the prefix is bound to. These are the only DOM operations the
 * parser uses.
 */
public final class XmlUtil {

    private XmlUtil() {
        // Utility class
    }

    /**
     * Strip a namespace prefix from a qualified name.
     *
     * @param qualifiedName name as written in the document, e.g. {@code atom:link}
     * @return the part after the first colon, or the name itself when it has no prefix
     */
    public static String localName(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        return colon < 0 ? qualifiedName : qualifiedName.substring(colon + 1);
    }

    /**
     * First immediate child element with the given local name. Does not descend further.
     */
    public static Element firstChild(Element parent, String localName) {
        if (parent == null) {
            return null;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (isElementNamed(node, localName)) {
                return (Element) node;
            }
        }
        return null;
    }

    /**
     * All immediate child elements with the given local name, in document order.
     */
    public static List<Element> children(Element parent, String localName) {
        List<Element> matches = new ArrayList<>();
        if (parent == null) {
            return matches;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (isElementNamed(node, localName)) {
                matches.add((Element) node);
            }
        }
        return matches;
    }

    /**
     * Depth-first, document-order search for the first element with the given local name,
     * starting with {@code root} itself.
     */
    public static Element findFirst(Node root, String localName) {
        if (root == null) {
            return null;
        }
        // explicit stack, nesting depth comes from the input
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (isElementNamed(node, localName)) {
                return (Element) node;
            }
            NodeList nodes = node.getChildNodes();
            for (int i = nodes.getLength() - 1; i >= 0; i--) {
                Node child = nodes.item(i);
                if (child.getNodeType() == Node.ELEMENT_NODE) {
                    pending.push(child);
                }
            }
        }
        return null;
    }

    /**
     * Trimmed text of an element: the single text or CDATA child when that is all the element
     * holds, otherwise the concatenated text of all descendants.
     *
     * @return the text, or {@code null} for a null element or one whose trimmed text is empty
     */
    public static String text(Element element) {
        if (element == null) {
            return null;
        }
        NodeList nodes = element.getChildNodes();
        String raw;
        if (nodes.getLength() == 1 && isCharacterData(nodes.item(0))) {
            raw = nodes.item(0).getNodeValue();
        } else {
            raw = element.getTextContent();
        }
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Trimmed attribute value. An exact name match wins; otherwise a single attribute whose local
     * name matches is used. Several prefixed candidates are ambiguous and yield {@code null}.
     *
     * @return the value, or {@code null} when absent or ambiguous
     */
    public static String attribute(Element element, String name) {
        if (element == null) {
            return null;
        }
        if (element.hasAttribute(name)) {
            return element.getAttribute(name).trim();
        }
        NamedNodeMap attributes = element.getAttributes();
        String found = null;
        int matches = 0;
        for (int i = 0; i < attributes.getLength(); i++) {
            Node attribute = attributes.item(i);
            String attributeName = attribute.getNodeName();
            if (attributeName.startsWith("xmlns")) {
                continue;
            }
            if (localName(attributeName).equals(name)) {
                found = attribute.getNodeValue();
                matches++;
            }
        }
        if (matches != 1 || found == null) {
            return null;
        }
        return found.trim();
    }

    private static boolean isElementNamed(Node node, String localName) {
        return node.getNodeType() == Node.ELEMENT_NODE && localName(node.getNodeName()).equals(localName);
    }

    private static boolean isCharacterData(Node node) {
        short type = node.getNodeType();
        return type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE;
    }
}
