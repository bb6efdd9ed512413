package org.rocstreaming.bindgen.generator.java;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.TypeName;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Naming, typing and comment tables of the roc-java bindings.
 *
 * <p>All tables are immutable. Override tables win over the mechanical rules.
 */
final class JavaConventions {

    /**
     * Package of every generated type.
     */
    static final String PACKAGE = "org.rocstreaming.roctoolkit";

    /**
     * Source root of generated files, relative to the output directory.
     */
    static final String SOURCE_ROOT = "src/main/java/";

    /**
     * Source root of class scaffolds, relative to the output directory. Hand-written classes
     * under {@link #SOURCE_ROOT} are never overwritten.
     */
    static final String SCAFFOLD_ROOT = "scaffold/";

    /**
     * C API names whose Java name is not the mechanical translation.
     */
    static final Map<String, String> NAME_OVERRIDES = Map.of(
            "roc_context", "RocContext",
            "roc_sender", "RocSender",
            "roc_receiver", "RocReceiver",
            "roc_context_config", "RocContextConfig",
            "roc_sender_config", "RocSenderConfig",
            "roc_receiver_config", "RocReceiverConfig");

    /**
     * C primitive types to Java types.
     */
    static final Map<String, TypeName> TYPE_MAP = Map.of(
            "unsigned int", TypeName.INT,
            "int", TypeName.INT,
            "unsigned long", TypeName.LONG,
            "long", TypeName.LONG,
            "unsigned long long", TypeName.LONG,
            "long long", TypeName.LONG,
            "char", ClassName.get(String.class));

    /**
     * Field types keyed by the camelCase field name.
     */
    static final Map<String, TypeName> TYPE_OVERRIDES = Map.of(
            "packetLength", ClassName.get(Duration.class),
            "targetLatency", ClassName.get(Duration.class),
            "latencyTolerance", ClassName.get(Duration.class),
            "noPlaybackTimeout", ClassName.get(Duration.class),
            "choppyPlaybackTimeout", ClassName.get(Duration.class),
            "reuseAddress", TypeName.BOOLEAN);

    /**
     * Javadoc lines replacing the generated comment of a type, keyed by Java type name.
     */
    static final Map<String, List<String>> COMMENT_OVERRIDES = Map.of(
            "RocContextConfig", List.of(
                    "Context configuration.",
                    "<p>",
                    "RocContextConfig object can be instantiated with {@link RocContextConfig#builder()}.",
                    "",
                    "@see RocContext"),
            "RocSenderConfig", List.of(
                    "Sender configuration.",
                    "<p>",
                    "RocSenderConfig object can be instantiated with {@link RocSenderConfig#builder()}.",
                    "",
                    "@see RocSender"),
            "RocReceiverConfig", List.of(
                    "Receiver configuration.",
                    "<p>",
                    "RocReceiverConfig object can be instantiated with {@link RocReceiverConfig#builder()}.",
                    "",
                    "@see RocReceiver"),
            "InterfaceConfig", List.of(
                    "Interface configuration.",
                    "<p>",
                    "Sender and receiver can have multiple slots ( {@link Slot} ), and each slot",
                    "can be bound or connected to multiple interfaces ( {@link Interface} ).",
                    "<p>",
                    "Each such interface has its own configuration, defined by this class.",
                    "<p>",
                    "See {@link RocSender#configure}, {@link RocReceiver#configure}."));

    // ==================== Lombok ====================

    static final ClassName LOMBOK_GETTER = ClassName.get("lombok", "Getter");
    static final ClassName LOMBOK_BUILDER = ClassName.get("lombok", "Builder");
    static final ClassName LOMBOK_TO_STRING = ClassName.get("lombok", "ToString");
    static final ClassName LOMBOK_EQUALS_AND_HASH_CODE = ClassName.get("lombok", "EqualsAndHashCode");

    /**
     * Name of the builder class Lombok generates inside each config class.
     */
    static final String BUILDER_CLASS_NAME = "Builder";

    /**
     * Suffix of the hand-written builder subclass that validates fields before building.
     */
    static final String VALIDATOR_SUFFIX = "Validator";

    private JavaConventions() {
    }
}
