package org.rocstreaming.bindgen.index;

import org.rocstreaming.bindgen.model.EnumDefinition;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the prefix shared by the value names of each enum.
 *
 * <p>The regular prefix is the upper-cased enum name followed by an underscore
 * ({@code roc_interface} → {@code ROC_INTERFACE_}). Enums whose values do not follow that rule
 * are declared in {@link #ODD_PREFIXES}, which always wins.
 */
public final class EnumPrefixes {

    /**
     * Enums whose value names do not start with the upper-cased enum name.
     */
    public static final Map<String, String> ODD_PREFIXES = Map.of(
            "roc_protocol", "ROC_PROTO_"
    );

    private EnumPrefixes() {
    }

    /**
     * Computes the value prefix of every enum.
     *
     * @param enums the enums in declaration order
     * @return enum name to prefix, declaration order
     */
    public static Map<String, String> build(Collection<EnumDefinition> enums) {
        Map<String, String> prefixes = new LinkedHashMap<>();
        for (EnumDefinition enumDefinition : enums) {
            prefixes.put(enumDefinition.name(), prefixOf(enumDefinition.name()));
        }
        return prefixes;
    }

    /**
     * Returns the value prefix for a single enum name.
     */
    public static String prefixOf(String enumName) {
        String odd = ODD_PREFIXES.get(enumName);
        if (odd != null) {
            return odd;
        }
        return enumName.toUpperCase(Locale.ROOT) + "_";
    }
}
