package org.rocstreaming.bindgen.model;

import java.util.Objects;

/**
 * A reference token from a documentation comment, resolved to what it points at.
 *
 * <p>For example {@code roc_sender_write()} resolves to a {@link Kind#CLASS_METHOD} reference
 * with owner {@code roc_sender} and member {@code write}, and {@code ROC_INTERFACE_AUDIO_SOURCE}
 * resolves to an {@link Kind#ENUM_VALUE} reference with owner {@code roc_interface} and member
 * {@code AUDIO_SOURCE}. Renderers derive their target-specific names from these parts.
 *
 * @param kind   the reference variant
 * @param name   the raw token as it appeared in the documentation
 * @param owner  owning enum or class name for {@code ENUM_VALUE} and {@code CLASS_METHOD}, otherwise {@code null}
 * @param member value suffix or method suffix for {@code ENUM_VALUE} and {@code CLASS_METHOD}, otherwise {@code null}
 */
public record DocRef(Kind kind, String name, String owner, String member) {

    /**
     * Reference variants.
     */
    public enum Kind {
        ENUM,
        ENUM_VALUE,
        STRUCT,
        STRUCT_FIELD,
        CLASS,
        CLASS_METHOD,
        TYPEDEF
    }

    public DocRef {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    public static DocRef ofEnum(String name) {
        return new DocRef(Kind.ENUM, name, null, null);
    }

    public static DocRef ofEnumValue(String name, String enumName, String valueName) {
        return new DocRef(Kind.ENUM_VALUE, name, enumName, valueName);
    }

    public static DocRef ofStruct(String name) {
        return new DocRef(Kind.STRUCT, name, null, null);
    }

    public static DocRef ofStructField(String name) {
        return new DocRef(Kind.STRUCT_FIELD, name, null, null);
    }

    public static DocRef ofClass(String name) {
        return new DocRef(Kind.CLASS, name, null, null);
    }

    public static DocRef ofClassMethod(String name, String className, String methodName) {
        return new DocRef(Kind.CLASS_METHOD, name, className, methodName);
    }

    public static DocRef ofTypedef(String name) {
        return new DocRef(Kind.TYPEDEF, name, null, null);
    }
}
