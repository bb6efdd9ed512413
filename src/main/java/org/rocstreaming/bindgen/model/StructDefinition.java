package org.rocstreaming.bindgen.model;

import java.util.List;
import java.util.Objects;

/**
 * A struct of the C API, e.g. {@code roc_sender_config}.
 *
 * @param name   the C struct name
 * @param fields the fields in declaration order
 * @param doc    documentation of the struct
 */
public record StructDefinition(String name, List<StructField> fields, DocComment doc) implements Documented {

    public StructDefinition {
        Objects.requireNonNull(name, "name must not be null");
        fields = fields == null ? List.of() : List.copyOf(fields);
        doc = doc == null ? DocComment.empty() : doc;
    }
}
