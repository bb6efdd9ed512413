package org.rocstreaming.bindgen.generator.go;

import java.util.List;
import java.util.Map;

/**
 * Typing and comment tables of the roc-go bindings.
 */
final class GoConventions {

    /**
     * Go package of every generated file.
     */
    static final String PACKAGE = "roc";

    /**
     * Directory of generated files, relative to the output directory.
     */
    static final String SOURCE_DIR = "roc/";

    /**
     * Suffix of class scaffold file names, e.g. {@code sender_DUMMY.go}.
     */
    static final String SCAFFOLD_SUFFIX = "_DUMMY";

    /**
     * C primitive types to Go types.
     */
    static final Map<String, String> TYPE_MAP = Map.of(
            "unsigned int", "uint32",
            "int", "int32",
            "unsigned long", "uint32",
            "long", "int32",
            "unsigned long long", "uint64",
            "long long", "int64",
            "char", "string");

    /**
     * Field types keyed by the PascalCase field name.
     */
    static final Map<String, String> TYPE_OVERRIDES = Map.of(
            "PacketLength", "time.Duration",
            "PacketInterleaving", "bool",
            "TargetLatency", "time.Duration",
            "LatencyTolerance", "time.Duration",
            "NoPlaybackTimeout", "time.Duration",
            "ChoppyPlaybackTimeout", "time.Duration",
            "ReuseAddress", "bool");

    /**
     * Comment lines replacing the generated comment of a type, keyed by Go type name.
     */
    static final Map<String, List<String>> COMMENT_OVERRIDES = Map.of(
            "ContextConfig", List.of(
                    "// Context configuration.",
                    "// You can zero-initialize this struct to get a default config.",
                    "// See also Context."),
            "SenderConfig", List.of(
                    "// Sender configuration.",
                    "// You can zero-initialize this struct to get a default config.",
                    "// See also Sender."),
            "ReceiverConfig", List.of(
                    "// Receiver configuration.",
                    "// You can zero-initialize this struct to get a default config.",
                    "// See also Receiver."));

    private GoConventions() {
    }
}
