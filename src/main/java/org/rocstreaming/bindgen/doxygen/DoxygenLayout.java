package org.rocstreaming.bindgen.doxygen;

import java.util.List;
import java.util.Objects;

/**
 * Names of the Doxygen XML files holding the public API, relative to the XML directory.
 *
 * <p>List order is declaration order: it decides the order in which structs and classes are
 * generated.
 *
 * @param enumsFile   header file whose enum sections hold every enum
 * @param structFiles one compound file per struct
 * @param classFiles  one header file per class (an opaque typedef plus its functions)
 */
public record DoxygenLayout(String enumsFile, List<String> structFiles, List<String> classFiles) {

    /**
     * Layout of the roc-toolkit public API documentation.
     */
    public static final DoxygenLayout ROC_TOOLKIT = new DoxygenLayout(
            "config_8h.xml",
            List.of(
                    "structroc__context__config.xml",
                    "structroc__receiver__config.xml",
                    "structroc__sender__config.xml",
                    "structroc__interface__config.xml",
                    "structroc__media__encoding.xml"),
            List.of(
                    "context_8h.xml",
                    "receiver_8h.xml",
                    "sender_8h.xml",
                    "endpoint_8h.xml"));

    public DoxygenLayout {
        Objects.requireNonNull(enumsFile, "enumsFile must not be null");
        structFiles = List.copyOf(structFiles);
        classFiles = List.copyOf(classFiles);
    }
}
