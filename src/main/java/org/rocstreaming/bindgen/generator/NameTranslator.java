package org.rocstreaming.bindgen.generator;

import java.util.Map;

/**
 * Translates C API type names into target type names.
 *
 * <p>The mechanical rule strips the {@code roc_} namespace and converts the rest to PascalCase
 * ({@code roc_media_encoding} → {@code MediaEncoding}). Names listed in the override table
 * bypass the rule.
 */
public final class NameTranslator {

    private final Map<String, String> overrides;

    public NameTranslator(Map<String, String> overrides) {
        this.overrides = Map.copyOf(overrides);
    }

    /**
     * Returns a translator that always applies the mechanical rule.
     */
    public static NameTranslator mechanical() {
        return new NameTranslator(Map.of());
    }

    /**
     * Returns the target name of an enum, struct, class or typedef.
     *
     * @param rocName the C API name, e.g. {@code roc_sender_config}
     * @return the override, or the PascalCase name without namespace
     */
    public String typeName(String rocName) {
        String override = overrides.get(rocName);
        if (override != null) {
            return override;
        }
        return CaseConversion.toPascalCase(CaseConversion.stripNamespace(rocName));
    }
}
