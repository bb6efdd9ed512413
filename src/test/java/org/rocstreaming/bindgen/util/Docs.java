package org.rocstreaming.bindgen.util;

import org.rocstreaming.bindgen.model.DocBlock;
import org.rocstreaming.bindgen.model.DocComment;
import org.rocstreaming.bindgen.model.DocItem;

/**
 * Shorthands for building documentation trees in tests.
 */
public final class Docs {

    private Docs() {
    }

    /**
     * A comment with a single plain-text brief.
     */
    public static DocComment brief(String text) {
        return DocComment.of(DocBlock.of(DocItem.text(text)));
    }

    /**
     * A comment with a plain-text brief followed by detail blocks.
     */
    public static DocComment comment(String brief, DocBlock... details) {
        DocBlock[] blocks = new DocBlock[details.length + 1];
        blocks[0] = DocBlock.of(DocItem.text(brief));
        System.arraycopy(details, 0, blocks, 1, details.length);
        return DocComment.of(blocks);
    }
}
