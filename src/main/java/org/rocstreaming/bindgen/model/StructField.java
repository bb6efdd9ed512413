package org.rocstreaming.bindgen.model;

import java.util.Objects;

/**
 * One field of a struct.
 *
 * @param name the C field name, e.g. {@code packet_length}
 * @param type the declared type token, e.g. {@code unsigned long long} or {@code roc_clock_source}
 * @param doc  documentation of the field
 */
public record StructField(String name, String type, DocComment doc) implements Documented {

    public StructField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        doc = doc == null ? DocComment.empty() : doc;
    }
}
