package org.rocstreaming.bindgen.index;

import org.rocstreaming.bindgen.model.ApiRoot;
import org.rocstreaming.bindgen.model.ClassDefinition;
import org.rocstreaming.bindgen.model.ClassMethod;
import org.rocstreaming.bindgen.model.EnumDefinition;
import org.rocstreaming.bindgen.model.EnumValue;
import org.rocstreaming.bindgen.model.GitInfo;
import org.rocstreaming.bindgen.model.StructDefinition;
import org.rocstreaming.bindgen.model.StructField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds the immutable {@link ApiRoot} from the extracted definitions.
 *
 * <p><b>Steps:</b>
 * <ol>
 *   <li>Key the definitions by name, keeping declaration order</li>
 *   <li>Compute enum value prefixes ({@link EnumPrefixes})</li>
 *   <li>Map every struct field name to the structs declaring it</li>
 *   <li>Visit every documentation tree with a {@link SymbolIndex}</li>
 * </ol>
 */
public final class ApiRootAssembler {

    private static final Logger log = LoggerFactory.getLogger(ApiRootAssembler.class);

    private ApiRootAssembler() {
    }

    /**
     * Assembles the API root.
     *
     * @param gitInfo roc-toolkit revision
     * @param enums   enums in declaration order
     * @param structs structs in declaration order
     * @param classes classes in declaration order
     * @return the read-only aggregate with its reference index
     * @throws IllegalArgumentException if two definitions of the same kind share a name
     */
    public static ApiRoot assemble(GitInfo gitInfo,
                                   List<EnumDefinition> enums,
                                   List<StructDefinition> structs,
                                   List<ClassDefinition> classes) {
        Map<String, EnumDefinition> enumDefinitions = byName(enums, EnumDefinition::name, "enum");
        Map<String, StructDefinition> structDefinitions = byName(structs, StructDefinition::name, "struct");
        Map<String, ClassDefinition> classDefinitions = byName(classes, ClassDefinition::name, "class");

        Map<String, String> enumPrefixes = EnumPrefixes.build(enumDefinitions.values());
        Map<String, Set<String>> structFields = buildStructFields(structDefinitions);

        ReferenceResolver resolver = new ReferenceResolver(
                enumDefinitions.keySet(), structDefinitions.keySet(), classDefinitions.keySet(),
                enumPrefixes, structFields.keySet());
        SymbolIndex index = new SymbolIndex(resolver);

        for (EnumDefinition enumDefinition : enumDefinitions.values()) {
            index.visit(enumDefinition);
            for (EnumValue value : enumDefinition.values()) {
                index.visit(value);
            }
        }
        for (StructDefinition structDefinition : structDefinitions.values()) {
            index.visit(structDefinition);
            for (StructField field : structDefinition.fields()) {
                index.visit(field);
            }
        }
        for (ClassDefinition classDefinition : classDefinitions.values()) {
            index.visit(classDefinition);
            for (ClassMethod method : classDefinition.methods()) {
                index.visit(method);
            }
        }

        log.debug("Indexed {} references ({} unresolved)",
                index.resolved().size(), index.unresolved().size());

        return new ApiRoot(gitInfo,
                enumDefinitions, structDefinitions, classDefinitions,
                enumPrefixes, structFields,
                index.resolved(), index.unresolved());
    }

    private static Map<String, Set<String>> buildStructFields(Map<String, StructDefinition> structs) {
        Map<String, Set<String>> structFields = new LinkedHashMap<>();
        for (StructDefinition struct : structs.values()) {
            for (StructField field : struct.fields()) {
                structFields.computeIfAbsent(field.name(), name -> new LinkedHashSet<>()).add(struct.name());
            }
        }
        return structFields;
    }

    private static <T> Map<String, T> byName(List<T> definitions, Function<T, String> name, String kind) {
        Map<String, T> map = new LinkedHashMap<>();
        for (T definition : definitions) {
            if (map.putIfAbsent(name.apply(definition), definition) != null) {
                throw new IllegalArgumentException("Duplicate " + kind + " definition: " + name.apply(definition));
            }
        }
        return map;
    }
}
