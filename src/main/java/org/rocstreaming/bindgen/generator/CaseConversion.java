package org.rocstreaming.bindgen.generator;

import java.util.Locale;

/**
 * Identifier conversions from the C API convention ({@code roc_lower_snake_case}).
 *
 * <p>Segments are the underscore-delimited parts of a name. Conversions only change the case of
 * a segment's characters; they never drop or reorder them.
 */
public final class CaseConversion {

    /**
     * Namespace prefix of every C API type and function.
     */
    public static final String NAMESPACE = "roc_";

    private CaseConversion() {
    }

    /**
     * Converts to PascalCase: each segment gets an upper-case first letter and a lower-case rest.
     * <ul>
     *   <li>{@code "media_encoding"} → {@code "MediaEncoding"}</li>
     *   <li>{@code "INTERFACE_AUDIO_SOURCE"} → {@code "InterfaceAudioSource"}</li>
     * </ul>
     */
    public static String toPascalCase(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (String segment : name.split("_", -1)) {
            sb.append(capitalize(segment));
        }
        return sb.toString();
    }

    /**
     * Converts to camelCase: PascalCase with a lower-case first letter.
     * <ul>
     *   <li>{@code "packet_length"} → {@code "packetLength"}</li>
     * </ul>
     */
    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal.isEmpty()) {
            return pascal;
        }
        return Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
    }

    /**
     * Removes the {@value #NAMESPACE} prefix, if present.
     */
    public static String stripNamespace(String name) {
        return removePrefix(name, NAMESPACE);
    }

    /**
     * Removes a prefix, if present.
     */
    public static String removePrefix(String name, String prefix) {
        return name.startsWith(prefix) ? name.substring(prefix.length()) : name;
    }

    /**
     * Removes a suffix, if present.
     */
    public static String removeSuffix(String name, String suffix) {
        return name.endsWith(suffix) ? name.substring(0, name.length() - suffix.length()) : name;
    }

    private static String capitalize(String segment) {
        if (segment.isEmpty()) {
            return segment;
        }
        return segment.substring(0, 1).toUpperCase(Locale.ROOT) + segment.substring(1).toLowerCase(Locale.ROOT);
    }
}
