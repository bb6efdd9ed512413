package org.rocstreaming.bindgen.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reflows one paragraph of comment text to a fixed width without ever splitting an atom.
 *
 * <p>An <em>atom</em> is a run of non-whitespace characters, where an inline Javadoc tag such
 * as {@code {@link Interface#AUDIO_SOURCE}} counts as non-whitespace as a whole. Qualified call
 * references like {@code Sender.Write()} contain no whitespace and are atoms by construction.
 *
 * <p><b>Rules:</b>
 * <ul>
 *   <li>Lines are filled greedily; atoms are separated by a single space</li>
 *   <li>The width includes the indent strings</li>
 *   <li>An atom that does not fit even on an empty line is placed alone on its own line,
 *       exceeding the width</li>
 *   <li>Whitespace before the first atom is kept after the initial indent</li>
 *   <li>Text without atoms produces no lines</li>
 * </ul>
 */
public final class CommentWrapper {

    private static final Pattern ATOM = Pattern.compile("(?:\\{@[a-zA-Z]+\\s+[^}]*\\}|\\S)+");
    private static final Pattern LEADING_WHITESPACE = Pattern.compile("^[ \\t]*");

    private CommentWrapper() {
    }

    /**
     * Wraps text using the same indent for every line.
     */
    public static List<String> wrap(String text, int width, String indent) {
        return wrap(text, width, indent, indent);
    }

    /**
     * Wraps text into lines of at most {@code width} characters.
     *
     * @param text             paragraph text, without line breaks
     * @param width            maximum line length, indent included
     * @param initialIndent    prefix of the first line
     * @param subsequentIndent prefix of the other lines
     * @return wrapped lines, without line terminators
     */
    public static List<String> wrap(String text, int width, String initialIndent, String subsequentIndent) {
        List<String> atoms = atoms(text);
        List<String> lines = new ArrayList<>();
        if (atoms.isEmpty()) {
            return lines;
        }

        Matcher leading = LEADING_WHITESPACE.matcher(text);
        String leadingWhitespace = leading.find() ? leading.group().replace('\t', ' ') : "";

        StringBuilder line = new StringBuilder(initialIndent).append(leadingWhitespace).append(atoms.get(0));
        for (String atom : atoms.subList(1, atoms.size())) {
            if (line.length() + 1 + atom.length() <= width) {
                line.append(' ').append(atom);
            } else {
                lines.add(line.toString());
                line = new StringBuilder(subsequentIndent).append(atom);
            }
        }
        lines.add(line.toString());

        return lines;
    }

    /**
     * Splits text into atoms, in order.
     */
    public static List<String> atoms(String text) {
        List<String> atoms = new ArrayList<>();
        Matcher matcher = ATOM.matcher(text);
        while (matcher.find()) {
            atoms.add(matcher.group());
        }
        return atoms;
    }

    /**
     * Joins rendered items of one block with single spaces and pulls punctuation back onto
     * the preceding item ({@code "foo ,"} becomes {@code "foo,"}).
     */
    public static String joinItems(List<String> rendered) {
        return String.join(" ", rendered)
                .replace(" ,", ",")
                .replace(" .", ".");
    }
}
