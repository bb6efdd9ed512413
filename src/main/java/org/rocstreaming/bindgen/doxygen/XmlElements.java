package org.rocstreaming.bindgen.doxygen;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Minimal navigation helpers over DOM elements, covering the subset of path expressions the
 * Doxygen reader needs ({@code a/b/c} child paths and descendant search).
 */
final class XmlElements {

    private XmlElements() {
    }

    /**
     * Returns the direct child elements with the given tag, in document order.
     */
    static List<Element> children(Element parent, String tag) {
        List<Element> result = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && ((Element) node).getTagName().equals(tag)) {
                result.add((Element) node);
            }
        }
        return result;
    }

    /**
     * Returns all direct child elements, in document order.
     */
    static List<Element> children(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    /**
     * Resolves a slash-separated child path, returning every match in document order.
     *
     * <p>For example {@code all(compound, "sectiondef/memberdef")} returns the {@code memberdef}
     * children of every {@code sectiondef} child of {@code compound}.
     */
    static List<Element> all(Element parent, String path) {
        List<Element> current = List.of(parent);
        for (String step : path.split("/")) {
            List<Element> next = new ArrayList<>();
            for (Element element : current) {
                next.addAll(children(element, step));
            }
            current = next;
        }
        return current;
    }

    /**
     * Resolves a slash-separated child path, returning the first match.
     */
    static Optional<Element> first(Element parent, String path) {
        List<Element> matches = all(parent, path);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    /**
     * Returns every descendant element with the given tag, in document order.
     */
    static List<Element> descendants(Element parent, String tag) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getElementsByTagName(tag);
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    /**
     * Returns the trimmed text content of the first element at the given path, or empty if the
     * path does not exist or holds only whitespace.
     */
    static Optional<String> text(Element parent, String path) {
        return first(parent, path)
                .map(Element::getTextContent)
                .map(String::strip)
                .filter(s -> !s.isEmpty());
    }

    /**
     * Returns the text that precedes the first child element.
     */
    static String leadingText(Element element) {
        StringBuilder text = new StringBuilder();
        for (Node node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                break;
            }
            if (isText(node)) {
                text.append(node.getNodeValue());
            }
        }
        return text.toString();
    }

    static boolean isText(Node node) {
        return node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE;
    }
}
