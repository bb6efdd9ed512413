package org.rocstreaming.bindgen.model;

import java.util.Objects;

/**
 * A free function operating on a class handle, e.g. {@code roc_sender_write}.
 *
 * @param name the full C function name
 * @param doc  documentation of the function
 */
public record ClassMethod(String name, DocComment doc) implements Documented {

    public ClassMethod {
        Objects.requireNonNull(name, "name must not be null");
        doc = doc == null ? DocComment.empty() : doc;
    }
}
