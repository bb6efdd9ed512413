package org.rocstreaming.bindgen.generator.go;

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
import java.util.Locale;
import java.util.Optional;

/**
 * Renders a {@link DocComment} as Go {@code //} comment lines.
 *
 * <p>Go doc comments have no markup: bold and emphasis lose their formatting and references
 * render as the plain Go identifier. Blocks are separated by an empty {@code //} line, list
 * entries become {@code " - "} bullets whose continuation lines are indented under the entry
 * text.
 */
final class GoCommentRenderer {

    private static final Logger log = LoggerFactory.getLogger(GoCommentRenderer.class);

    private static final String LINE_PREFIX = "// ";
    private static final String BULLET = " - ";

    private final ApiRoot apiRoot;
    private final NameTranslator names;

    GoCommentRenderer(ApiRoot apiRoot, NameTranslator names) {
        this.apiRoot = apiRoot;
        this.names = names;
    }

    /**
     * Renders a comment, one string per line, each terminated by {@code \n}.
     *
     * @param doc    the comment
     * @param indent prefix of every line, e.g. {@code "\t"} for struct fields
     */
    String render(DocComment doc, String indent) {
        String linePrefix = indent + LINE_PREFIX;
        StringBuilder sb = new StringBuilder();

        for (int i = 0; i < doc.blocks().size(); i++) {
            if (i != 0) {
                sb.append(linePrefix.stripTrailing()).append('\n');
            }
            String text = renderBlock(doc.blocks().get(i));
            for (String paragraph : text.split("\n")) {
                String subsequentPrefix = paragraph.startsWith(BULLET)
                        ? linePrefix + " ".repeat(BULLET.length())
                        : linePrefix;
                paragraph = paragraph.replace("( ", "(").replace(" )", ")");
                for (String line : CommentWrapper.wrap(paragraph, BaseGenerator.COMMENT_WIDTH,
                        linePrefix, subsequentPrefix)) {
                    sb.append(line).append('\n');
                }
            }
        }
        return sb.toString();
    }

    String renderBlock(DocBlock block) {
        List<String> result = new ArrayList<>();
        for (DocItem item : block.items()) {
            switch (item.kind()) {
                case TEXT, BOLD, EMPHASIS -> result.add(item.text());
                case REF, CODE -> result.add(renderRef(item.text()));
                case SEE -> result.add("See");
                case LIST -> result.add(renderList(item.childBlocks()));
                default -> log.warn("Unknown doc item kind = {}, it is skipped", item.kind());
            }
        }
        return CommentWrapper.joinItems(result);
    }

    private String renderList(List<DocBlock> entries) {
        StringBuilder ul = new StringBuilder("\n");
        for (DocBlock entry : entries) {
            ul.append(BULLET).append(renderBlock(entry)).append('\n');
        }
        return ul.append('\n').toString();
    }

    /**
     * Renders a reference token as a Go identifier.
     * <ul>
     *   <li>{@code roc_interface} → {@code Interface}</li>
     *   <li>{@code ROC_INTERFACE_AUDIO_SOURCE} → {@code InterfaceAudioSource}</li>
     *   <li>{@code packet_length} → {@code PacketLength}</li>
     *   <li>{@code roc_sender_write} → {@code Sender.Write()}</li>
     *   <li>{@code roc_sender_open} → {@code OpenSender()}</li>
     * </ul>
     * Unresolved tokens are returned unchanged.
     */
    String renderRef(String token) {
        Optional<DocRef> ref = apiRoot.docRef(token);
        if (ref.isEmpty()) {
            return token;
        }

        DocRef docRef = ref.get();
        return switch (docRef.kind()) {
            case ENUM, STRUCT, CLASS, TYPEDEF -> names.typeName(docRef.name());
            case ENUM_VALUE -> enumValueName(docRef.name());
            case STRUCT_FIELD -> CaseConversion.toPascalCase(docRef.name());
            case CLASS_METHOD -> methodName(docRef);
            default -> {
                log.warn("Unknown doc ref kind = {}, it is rendered as is", docRef.kind());
                yield token;
            }
        };
    }

    private String methodName(DocRef docRef) {
        String className = names.typeName(docRef.owner());
        if ("open".equals(docRef.member())) {
            return "Open" + className + "()";
        }
        return className + "." + CaseConversion.toPascalCase(docRef.member()) + "()";
    }

    /**
     * Returns the Go constant name of an enum value, e.g. {@code InterfaceAudioSource}.
     */
    static String enumValueName(String valueName) {
        return CaseConversion.toPascalCase(CaseConversion.stripNamespace(valueName.toLowerCase(Locale.ROOT)));
    }
}
