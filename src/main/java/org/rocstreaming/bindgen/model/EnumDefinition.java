package org.rocstreaming.bindgen.model;

import java.util.List;
import java.util.Objects;

/**
 * An enum of the C API, e.g. {@code roc_interface}.
 *
 * @param name   the C enum name
 * @param values the constants in declaration order
 * @param doc    documentation of the enum
 */
public record EnumDefinition(String name, List<EnumValue> values, DocComment doc) implements Documented {

    public EnumDefinition {
        Objects.requireNonNull(name, "name must not be null");
        values = values == null ? List.of() : List.copyOf(values);
        doc = doc == null ? DocComment.empty() : doc;
    }
}
