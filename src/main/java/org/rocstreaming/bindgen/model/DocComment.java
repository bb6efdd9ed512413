package org.rocstreaming.bindgen.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Documentation attached to a definition: an ordered list of paragraphs.
 *
 * <p>The first block is always the brief description. It is always present, possibly with
 * no items, so renderers can emit it standalone. The remaining blocks are the detailed
 * description in source order.
 *
 * @param blocks the paragraphs, never empty
 */
public record DocComment(List<DocBlock> blocks) {

    public DocComment {
        List<DocBlock> copy = new ArrayList<>();
        if (blocks != null) {
            copy.addAll(blocks);
        }
        if (copy.isEmpty()) {
            copy.add(DocBlock.empty());
        }
        blocks = List.copyOf(copy);
    }

    public static DocComment of(DocBlock... blocks) {
        return new DocComment(List.of(blocks));
    }

    public static DocComment empty() {
        return new DocComment(List.of());
    }

    /**
     * Returns the brief description block.
     */
    public DocBlock brief() {
        return blocks.get(0);
    }

    /**
     * Returns the detailed description blocks, possibly empty.
     */
    public List<DocBlock> details() {
        return blocks.subList(1, blocks.size());
    }
}
