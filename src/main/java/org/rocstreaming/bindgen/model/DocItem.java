package org.rocstreaming.bindgen.model;

import java.util.List;
import java.util.Objects;

/**
 * A single formatting unit of a documentation comment.
 *
 * <p>Items are a closed set of variants tagged by {@link Kind}. Most variants carry a literal
 * string; {@link Kind#LIST} carries one child {@link DocBlock} per list entry and
 * {@link Kind#SEE} carries nothing.
 *
 * <p><b>Variants:</b>
 * <table border="1">
 *   <caption>DocItem kinds</caption>
 *   <tr><th>Kind</th><th>Payload</th><th>Doxygen element</th></tr>
 *   <tr><td>{@code TEXT}</td><td>text</td><td>{@code para} text, tail text</td></tr>
 *   <tr><td>{@code REF}</td><td>token</td><td>{@code ref}</td></tr>
 *   <tr><td>{@code CODE}</td><td>token</td><td>{@code computeroutput}</td></tr>
 *   <tr><td>{@code BOLD}</td><td>text</td><td>{@code bold}</td></tr>
 *   <tr><td>{@code EMPHASIS}</td><td>text</td><td>{@code emphasis}</td></tr>
 *   <tr><td>{@code LIST}</td><td>child blocks</td><td>{@code itemizedlist}</td></tr>
 *   <tr><td>{@code SEE}</td><td>-</td><td>{@code simplesect kind="see"}</td></tr>
 * </table>
 *
 * <p>{@code REF} and {@code CODE} items are the ones looked up in the symbol index: their
 * {@link #text()} is the raw reference token.
 *
 * @param kind        the variant tag
 * @param text        literal text or reference token, {@code null} for {@code LIST} and {@code SEE}
 * @param childBlocks list entries for {@code LIST}, empty otherwise
 */
public record DocItem(Kind kind, String text, List<DocBlock> childBlocks) {

    /**
     * Item variants.
     */
    public enum Kind {
        TEXT,
        REF,
        CODE,
        BOLD,
        EMPHASIS,
        LIST,
        SEE
    }

    public DocItem {
        Objects.requireNonNull(kind, "kind must not be null");
        childBlocks = childBlocks == null ? List.of() : List.copyOf(childBlocks);
    }

    public static DocItem text(String text) {
        return new DocItem(Kind.TEXT, text, null);
    }

    public static DocItem ref(String token) {
        return new DocItem(Kind.REF, token, null);
    }

    public static DocItem code(String token) {
        return new DocItem(Kind.CODE, token, null);
    }

    public static DocItem bold(String text) {
        return new DocItem(Kind.BOLD, text, null);
    }

    public static DocItem emphasis(String text) {
        return new DocItem(Kind.EMPHASIS, text, null);
    }

    public static DocItem list(List<DocBlock> entries) {
        return new DocItem(Kind.LIST, null, entries);
    }

    public static DocItem see() {
        return new DocItem(Kind.SEE, null, null);
    }

    /**
     * Checks whether this item carries a token that should be resolved against the symbol index.
     *
     * @return {@code true} for {@code REF} and {@code CODE} items
     */
    public boolean isReference() {
        return kind == Kind.REF || kind == Kind.CODE;
    }
}
