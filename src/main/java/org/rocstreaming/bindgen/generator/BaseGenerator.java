package org.rocstreaming.bindgen.generator;

import org.rocstreaming.bindgen.model.ApiRoot;
import org.rocstreaming.bindgen.model.ClassDefinition;
import org.rocstreaming.bindgen.model.EnumDefinition;
import org.rocstreaming.bindgen.model.StructDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base of every target generator: fixes the traversal order and the provenance banner.
 *
 * <p>Definitions are visited in the {@link ApiRoot}'s declaration order, never sorted, so that
 * regenerating unchanged input gives byte-identical, diff-friendly files.
 */
public abstract class BaseGenerator implements Generator {

    /**
     * Maximum width of a reflowed comment line, including indentation and comment markers.
     */
    public static final int COMMENT_WIDTH = 80;

    protected final ApiRoot apiRoot;

    protected BaseGenerator(ApiRoot apiRoot) {
        this.apiRoot = Objects.requireNonNull(apiRoot, "apiRoot must not be null");
    }

    @Override
    public List<GeneratedFile> generateFiles() {
        List<GeneratedFile> files = new ArrayList<>();

        for (EnumDefinition enumDefinition : apiRoot.enumDefinitions().values()) {
            files.add(generateEnum(enumDefinition));
        }
        for (StructDefinition structDefinition : apiRoot.structDefinitions().values()) {
            files.add(generateStruct(structDefinition));
        }
        for (ClassDefinition classDefinition : apiRoot.classDefinitions().values()) {
            files.add(generateClass(classDefinition));
        }

        return files;
    }

    /**
     * Returns the lines of the banner placed at the top of every generated file, without
     * comment markers.
     */
    protected List<String> autogenComment() {
        return List.of(
                "Code generated by bindgen from roc-streaming/bindgen",
                "roc-toolkit git tag: " + apiRoot.gitInfo().tag() + ", commit: " + apiRoot.gitInfo().commit());
    }
}
