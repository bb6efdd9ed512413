package org.rocstreaming.bindgen.model;

import java.util.Objects;

/**
 * One constant of an enum.
 *
 * @param name  the C constant name, e.g. {@code ROC_INTERFACE_AUDIO_SOURCE}
 * @param value the initializer literal as written in the header (radix and formatting preserved)
 * @param doc   documentation of the constant
 */
public record EnumValue(String name, String value, DocComment doc) implements Documented {

    public EnumValue {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        doc = doc == null ? DocComment.empty() : doc;
    }
}
