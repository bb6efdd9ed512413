package org.rocstreaming.bindgen.model;

import java.util.List;

/**
 * A sequence of successive {@link DocItem}s: one paragraph, or one entry of a list.
 *
 * @param items the items in source order
 */
public record DocBlock(List<DocItem> items) {

    private static final DocBlock EMPTY = new DocBlock(List.of());

    public DocBlock {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static DocBlock of(DocItem... items) {
        return new DocBlock(List.of(items));
    }

    public static DocBlock empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
