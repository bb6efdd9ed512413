package org.rocstreaming.bindgen.generator.java;

import com.squareup.javapoet.CodeBlock;
import org.rocstreaming.bindgen.generator.BaseGenerator;
import org.rocstreaming.bindgen.generator.CaseConversion;
import org.rocstreaming.bindgen.generator.CommentWrapper;
import org.rocstreaming.bindgen.generator.NameTranslator;
import org.rocstreaming.bindgen.model.ApiRoot;
import org.rocstreaming.bindgen.model.DocBlock;
import org.rocstreaming.bindgen.model.DocComment;
import org.rocstreaming.bindgen.model.DocItem;
import org.rocstreaming.bindgen.model.DocRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders a {@link DocComment} as Javadoc content.
 *
 * <p>The result holds the comment body only; JavaPoet adds the comment delimiters and line
 * prefixes. Lines are wrapped so that each emitted line, prefix and indentation included, fits
 * in {@link BaseGenerator#COMMENT_WIDTH} columns.
 *
 * <p><b>Items:</b>
 * <ul>
 *   <li>{@code TEXT} as is, {@code BOLD} as {@code <b>..</b>}, {@code EMPHASIS} as {@code <em>..</em>}</li>
 *   <li>{@code LIST} as a {@code <ul>} element with one {@code <li>} line per entry</li>
 *   <li>{@code SEE} as {@code @see}</li>
 *   <li>{@code REF} and {@code CODE} as {@code {@link ...}} when the reference has a Java
 *       target, otherwise as {@code {@code ...}}</li>
 * </ul>
 */
final class JavadocRenderer {

    private static final Logger log = LoggerFactory.getLogger(JavadocRenderer.class);

    /**
     * Length of the {@code " * "} line prefix.
     */
    private static final int LINE_PREFIX_LENGTH = 3;

    private final ApiRoot apiRoot;
    private final NameTranslator names;

    JavadocRenderer(ApiRoot apiRoot, NameTranslator names) {
        this.apiRoot = apiRoot;
        this.names = names;
    }

    /**
     * Renders a comment as a JavaPoet Javadoc block.
     *
     * @param doc    the comment
     * @param indent indentation of the commented element, in columns
     */
    CodeBlock render(DocComment doc, int indent) {
        return toCodeBlock(lines(doc, indent));
    }

    /**
     * Wraps verbatim Javadoc lines into a JavaPoet block.
     */
    static CodeBlock toCodeBlock(List<String> lines) {
        CodeBlock.Builder builder = CodeBlock.builder();
        for (String line : lines) {
            builder.add("$L\n", line);
        }
        return builder.build();
    }

    /**
     * Renders a comment into wrapped Javadoc lines, without markers.
     */
    List<String> lines(DocComment doc, int indent) {
        int width = BaseGenerator.COMMENT_WIDTH - indent - LINE_PREFIX_LENGTH;
        List<String> lines = new ArrayList<>();

        for (int i = 0; i < doc.blocks().size(); i++) {
            if (i != 0) {
                lines.add("<p>");
            }
            String text = renderBlock(doc.blocks().get(i));
            for (String paragraph : text.split("\n")) {
                lines.addAll(CommentWrapper.wrap(paragraph, width, ""));
            }
        }
        return lines;
    }

    String renderBlock(DocBlock block) {
        List<String> result = new ArrayList<>();
        for (DocItem item : block.items()) {
            switch (item.kind()) {
                case TEXT -> result.add(item.text());
                case BOLD -> result.add("<b>" + item.text() + "</b>");
                case EMPHASIS -> result.add("<em>" + item.text() + "</em>");
                case REF, CODE -> result.add(renderRef(item.text()));
                case SEE -> result.add("@see");
                case LIST -> result.add(renderList(item.childBlocks()));
                default -> log.warn("Unknown doc item kind = {}, it is skipped", item.kind());
            }
        }
        return CommentWrapper.joinItems(result);
    }

    private String renderList(List<DocBlock> entries) {
        StringBuilder ul = new StringBuilder("<ul>\n");
        for (DocBlock entry : entries) {
            ul.append("<li>").append(renderBlock(entry)).append("</li>\n");
        }
        return ul.append("</ul>\n").toString();
    }

    /**
     * Renders a reference token as an inline tag.
     *
     * <p>Enum values link to the constant ({@code {@link Interface#AUDIO_SOURCE}}), methods to
     * the method ({@code {@link RocSender#write()}}) and {@code open} methods to the
     * constructor. Struct fields have no linkable target and render as {@code {@code name}}, as
     * do unresolved tokens.
     */
    String renderRef(String token) {
        Optional<DocRef> ref = apiRoot.docRef(token);
        if (ref.isEmpty()) {
            return code(token);
        }

        DocRef docRef = ref.get();
        return switch (docRef.kind()) {
            case ENUM, STRUCT, CLASS, TYPEDEF -> link(names.typeName(docRef.name()));
            case ENUM_VALUE -> link(names.typeName(docRef.owner()) + "#" + docRef.member());
            case STRUCT_FIELD -> code(CaseConversion.toCamelCase(docRef.name()));
            case CLASS_METHOD -> link(methodTarget(docRef));
            default -> {
                log.warn("Unknown doc ref kind = {}, it is rendered as code", docRef.kind());
                yield code(token);
            }
        };
    }

    private String methodTarget(DocRef docRef) {
        String className = names.typeName(docRef.owner());
        if ("open".equals(docRef.member())) {
            return className + "#" + className + "()";
        }
        return className + "#" + CaseConversion.toCamelCase(docRef.member()) + "()";
    }

    /**
     * Returns the Java constant name of an enum value: the value name without the enum prefix.
     */
    String enumValueName(String enumName, String valueName) {
        return CaseConversion.removePrefix(valueName, apiRoot.enumPrefix(enumName));
    }

    private static String link(String target) {
        return "{@link " + target + "}";
    }

    private static String code(String text) {
        return "{@code " + text + "}";
    }
}
