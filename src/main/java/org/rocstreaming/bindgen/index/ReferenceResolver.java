package org.rocstreaming.bindgen.index;

import org.rocstreaming.bindgen.model.DocRef;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a raw reference token from a documentation comment.
 *
 * <p>Several kinds of C names share naming conventions, so the rules are tried in a fixed
 * order and the first match wins:
 * <ol>
 *   <li>exact enum, struct or class name ({@code roc_interface})</li>
 *   <li>enum value ({@code ROC_INTERFACE_AUDIO_SOURCE}): the token has the {@code ROC_} shape and
 *       a registered enum prefix is a proper prefix of it; the longest matching prefix wins</li>
 *   <li>struct field name ({@code packet_length})</li>
 *   <li>class method ({@code roc_sender_write()}): {@code roc_<class>_<method>} with an optional
 *       {@code ()}, where {@code roc_<class>} is a known class</li>
 *   <li>any other namespaced type name ({@code roc_slot})</li>
 * </ol>
 * Tokens matching none of the rules are unresolved. That is an ordinary outcome for prose
 * words that look like identifiers, never an error.
 *
 * <p>The enum value rule only applies to upper-case {@code ROC_} tokens and struct field names
 * are always lower-case, so step 2 is kept separate from step 3.
 *
 * <p>Resolution is stateless; memoization lives in {@link SymbolIndex}.
 */
public final class ReferenceResolver {

    static final String ENUM_VALUE_SENTINEL = "ROC_";

    private static final Pattern CLASS_METHOD = Pattern.compile("^(roc_[a-z]+)_([a-z_]+)(\\(\\))?$");
    private static final Pattern TYPEDEF = Pattern.compile("^roc_[a-z_]+$");

    private final Set<String> enumNames;
    private final Set<String> structNames;
    private final Set<String> classNames;
    private final Map<String, String> enumPrefixes;
    private final Set<String> structFieldNames;

    /**
     * Creates a resolver over the names known in the API.
     *
     * @param enumNames        enum names
     * @param structNames      struct names
     * @param classNames       class names
     * @param enumPrefixes     enum name to value prefix
     * @param structFieldNames names of all struct fields
     */
    public ReferenceResolver(Set<String> enumNames, Set<String> structNames, Set<String> classNames,
                             Map<String, String> enumPrefixes, Set<String> structFieldNames) {
        this.enumNames = Set.copyOf(enumNames);
        this.structNames = Set.copyOf(structNames);
        this.classNames = Set.copyOf(classNames);
        this.enumPrefixes = Map.copyOf(enumPrefixes);
        this.structFieldNames = Set.copyOf(structFieldNames);
    }

    /**
     * Classifies a token.
     *
     * @param token the raw text of a reference or inline code item
     * @return the resolved reference, or empty if no rule matched
     */
    public Optional<DocRef> resolve(String token) {
        Objects.requireNonNull(token, "token must not be null");

        // enum/struct/class name (e.g. "roc_interface")
        if (enumNames.contains(token)) {
            return Optional.of(DocRef.ofEnum(token));
        }
        if (structNames.contains(token)) {
            return Optional.of(DocRef.ofStruct(token));
        }
        if (classNames.contains(token)) {
            return Optional.of(DocRef.ofClass(token));
        }

        // enum value (e.g. "ROC_INTERFACE_AUDIO_SOURCE")
        if (token.startsWith(ENUM_VALUE_SENTINEL)) {
            Optional<DocRef> enumValue = resolveEnumValue(token);
            if (enumValue.isPresent()) {
                return enumValue;
            }
        }

        // struct field (e.g. "packet_length")
        if (structFieldNames.contains(token)) {
            return Optional.of(DocRef.ofStructField(token));
        }

        // class method (e.g. "roc_sender_write()")
        Matcher method = CLASS_METHOD.matcher(token);
        if (method.matches() && classNames.contains(method.group(1))) {
            return Optional.of(DocRef.ofClassMethod(token, method.group(1), method.group(2)));
        }

        // another type name (e.g. "roc_slot")
        if (TYPEDEF.matcher(token).matches()) {
            return Optional.of(DocRef.ofTypedef(token));
        }

        return Optional.empty();
    }

    private Optional<DocRef> resolveEnumValue(String token) {
        String bestEnum = null;
        String bestPrefix = null;
        for (Map.Entry<String, String> entry : enumPrefixes.entrySet()) {
            String prefix = entry.getValue();
            if (token.length() > prefix.length() && token.startsWith(prefix)
                    && (bestPrefix == null || prefix.length() > bestPrefix.length()
                    || (prefix.length() == bestPrefix.length() && entry.getKey().compareTo(bestEnum) < 0))) {
                bestEnum = entry.getKey();
                bestPrefix = prefix;
            }
        }
        if (bestPrefix == null) {
            return Optional.empty();
        }
        return Optional.of(DocRef.ofEnumValue(token, bestEnum, token.substring(bestPrefix.length())));
    }
}
