package org.rocstreaming.bindgen.doxygen;

import org.rocstreaming.bindgen.model.DocBlock;
import org.rocstreaming.bindgen.model.DocComment;
import org.rocstreaming.bindgen.model.DocItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts Doxygen description markup into a {@link DocComment}.
 *
 * <p><b>Element mapping:</b>
 * <table border="1">
 *   <caption>Doxygen element to DocItem</caption>
 *   <tr><th>Element</th><th>Item</th></tr>
 *   <tr><td>{@code para}</td><td>its own text as {@code TEXT}</td></tr>
 *   <tr><td>{@code ref}</td><td>{@code REF}</td></tr>
 *   <tr><td>{@code computeroutput}</td><td>{@code CODE}</td></tr>
 *   <tr><td>{@code bold}</td><td>{@code BOLD}</td></tr>
 *   <tr><td>{@code emphasis}</td><td>{@code EMPHASIS}</td></tr>
 *   <tr><td>{@code simplesect kind="see"}</td><td>{@code SEE}</td></tr>
 *   <tr><td>{@code itemizedlist}</td><td>{@code LIST}, one block per {@code listitem}</td></tr>
 * </table>
 *
 * <p>Children of every element except {@code itemizedlist} are processed recursively, and
 * non-blank text following a child element (its "tail") becomes a separate {@code TEXT} item.
 * Unknown elements are reported as warnings; their own text is dropped but their children and
 * tails are kept.
 */
final class DocCommentParser {

    private static final Logger log = LoggerFactory.getLogger(DocCommentParser.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DocCommentParser() {
    }

    /**
     * Parses the brief and detailed descriptions of a definition element.
     *
     * <p>The brief block comes from {@code briefdescription/para} and is always present, empty
     * when the element has no brief description. Each {@code detaileddescription/para} adds one
     * more block.
     *
     * @param element a {@code memberdef}, {@code enumvalue} or {@code compounddef} element
     * @return the parsed comment
     */
    static DocComment parse(Element element) {
        List<DocBlock> blocks = new ArrayList<>();

        blocks.add(XmlElements.first(element, "briefdescription/para")
                .map(para -> new DocBlock(parseElement(para)))
                .orElse(DocBlock.empty()));

        for (Element para : XmlElements.all(element, "detaileddescription/para")) {
            blocks.add(new DocBlock(parseElement(para)));
        }

        return new DocComment(blocks);
    }

    /**
     * Parses one markup element into a flat sequence of items.
     *
     * @param element the element to parse
     * @return items in source order
     */
    static List<DocItem> parseElement(Element element) {
        List<DocItem> items = new ArrayList<>();
        String tag = element.getTagName();
        String text = normalize(XmlElements.leadingText(element));
        boolean parseChildren = true;

        switch (tag) {
            case "para" -> {
                if (text != null) {
                    items.add(DocItem.text(text));
                }
            }
            case "ref" -> {
                if (text != null) {
                    items.add(DocItem.ref(text));
                }
            }
            case "computeroutput" -> {
                if (text != null) {
                    items.add(DocItem.code(text));
                }
            }
            case "bold" -> {
                if (text != null) {
                    items.add(DocItem.bold(text));
                }
            }
            case "emphasis" -> {
                if (text != null) {
                    items.add(DocItem.emphasis(text));
                }
            }
            case "simplesect" -> {
                String kind = element.getAttribute("kind");
                if ("see".equals(kind)) {
                    items.add(DocItem.see());
                } else {
                    log.warn("Unknown simplesect kind = {}, its content is kept as plain text", kind);
                }
            }
            case "itemizedlist" -> {
                items.add(DocItem.list(parseListItems(element)));
                parseChildren = false;
            }
            default -> log.warn("Unknown tag = {}, its text is dropped", tag);
        }

        if (parseChildren) {
            parseChildren(element, items);
        }
        return items;
    }

    private static List<DocBlock> parseListItems(Element list) {
        List<DocBlock> entries = new ArrayList<>();
        for (Element listItem : XmlElements.children(list, "listitem")) {
            List<DocItem> entryItems = new ArrayList<>();
            for (Element child : XmlElements.children(listItem)) {
                entryItems.addAll(parseElement(child));
            }
            entries.add(new DocBlock(entryItems));
        }
        return entries;
    }

    private static void parseChildren(Element element, List<DocItem> items) {
        Element previous = null;
        StringBuilder tail = new StringBuilder();

        for (Node node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                Element child = (Element) node;
                if (previous != null) {
                    addTail(tail, items);
                }
                tail.setLength(0);
                items.addAll(parseElement(child));
                previous = child;
            } else if (previous != null && XmlElements.isText(node)) {
                tail.append(node.getNodeValue());
            }
        }

        if (previous != null) {
            addTail(tail, items);
        }
    }

    private static void addTail(StringBuilder tail, List<DocItem> items) {
        String text = normalize(tail.toString());
        if (text != null) {
            items.add(DocItem.text(text));
        }
    }

    /**
     * Strips the text and collapses internal whitespace runs, returning {@code null} for blank text.
     */
    private static String normalize(String text) {
        if (text == null) {
            return null;
        }
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            return null;
        }
        return WHITESPACE.matcher(stripped).replaceAll(" ");
    }
}
