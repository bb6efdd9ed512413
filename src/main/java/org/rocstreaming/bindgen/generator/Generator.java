package org.rocstreaming.bindgen.generator;

import org.rocstreaming.bindgen.model.ClassDefinition;
import org.rocstreaming.bindgen.model.EnumDefinition;
import org.rocstreaming.bindgen.model.StructDefinition;

import java.util.List;

/**
 * Renders API definitions into the source files of one target ecosystem.
 *
 * <p>Each operation turns one definition into one file. Implementations are pure functions of
 * the definition and the shared {@link org.rocstreaming.bindgen.model.ApiRoot}; they never
 * write anything themselves.
 *
 * @see BaseGenerator
 */
public interface Generator {

    /**
     * Returns the short target name used on the command line, e.g. {@code "java"}.
     */
    String target();

    GeneratedFile generateEnum(EnumDefinition enumDefinition);

    GeneratedFile generateStruct(StructDefinition structDefinition);

    /**
     * Renders a class.
     *
     * <p>Targets that cannot translate method signatures yet may return a scaffold and log a
     * warning instead of failing.
     */
    GeneratedFile generateClass(ClassDefinition classDefinition);

    /**
     * Renders every definition of the API: enums, then structs, then classes, each kind in
     * declaration order.
     *
     * @return the files in generation order
     */
    List<GeneratedFile> generateFiles();
}
