package org.rocstreaming.bindgen.model;

import java.util.List;
import java.util.Objects;

/**
 * An opaque handle type together with the functions declared next to it in its header,
 * e.g. {@code roc_sender} and {@code roc_sender_open}, {@code roc_sender_write}, ...
 *
 * @param name    the C typedef name
 * @param methods the functions in declaration order
 * @param doc     documentation of the typedef
 */
public record ClassDefinition(String name, List<ClassMethod> methods, DocComment doc) implements Documented {

    public ClassDefinition {
        Objects.requireNonNull(name, "name must not be null");
        methods = methods == null ? List.of() : List.copyOf(methods);
        doc = doc == null ? DocComment.empty() : doc;
    }
}
