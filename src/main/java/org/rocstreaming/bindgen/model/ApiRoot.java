package org.rocstreaming.bindgen.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything extracted from the C API, plus the indexes built over it.
 *
 * <p>Definition maps iterate in declaration order; generated file order depends on it.
 * All maps and sets are unmodifiable: the aggregate is read-only once assembled and is shared
 * by every generator.
 *
 * @param gitInfo           roc-toolkit revision
 * @param enumDefinitions   enum name to definition, declaration order
 * @param structDefinitions struct name to definition, declaration order
 * @param classDefinitions  class name to definition, declaration order
 * @param enumPrefixes      enum name to the prefix of its value names, e.g. {@code ROC_INTERFACE_}
 * @param structFields      struct field name to the names of the structs declaring it
 * @param docRefs           reference token to its resolved reference
 * @param unresolvedRefs    reference tokens that matched no classification rule
 * @see org.rocstreaming.bindgen.index.SymbolIndex
 */
public record ApiRoot(GitInfo gitInfo,
                      Map<String, EnumDefinition> enumDefinitions,
                      Map<String, StructDefinition> structDefinitions,
                      Map<String, ClassDefinition> classDefinitions,
                      Map<String, String> enumPrefixes,
                      Map<String, Set<String>> structFields,
                      Map<String, DocRef> docRefs,
                      Set<String> unresolvedRefs) {

    public ApiRoot {
        Objects.requireNonNull(gitInfo, "gitInfo must not be null");
        enumDefinitions = ordered(enumDefinitions);
        structDefinitions = ordered(structDefinitions);
        classDefinitions = ordered(classDefinitions);
        enumPrefixes = ordered(enumPrefixes);
        Map<String, Set<String>> fields = new LinkedHashMap<>();
        structFields.forEach((field, structs) ->
                fields.put(field, Collections.unmodifiableSet(new LinkedHashSet<>(structs))));
        structFields = Collections.unmodifiableMap(fields);
        docRefs = ordered(docRefs);
        unresolvedRefs = Collections.unmodifiableSet(new LinkedHashSet<>(unresolvedRefs));
    }

    /**
     * Looks up the resolved reference for a documentation token.
     *
     * @param token the raw text of a {@code REF} or {@code CODE} item
     * @return the reference, or empty if the token is unresolved
     */
    public Optional<DocRef> docRef(String token) {
        return Optional.ofNullable(docRefs.get(token));
    }

    /**
     * Returns the value prefix registered for an enum.
     *
     * @param enumName the C enum name
     * @return the prefix, e.g. {@code ROC_INTERFACE_}
     * @throws IllegalArgumentException if the enum is unknown
     */
    public String enumPrefix(String enumName) {
        String prefix = enumPrefixes.get(enumName);
        if (prefix == null) {
            throw new IllegalArgumentException("Unknown enum: " + enumName);
        }
        return prefix;
    }

    private static <K, V> Map<K, V> ordered(Map<K, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
