package org.rocstreaming.bindgen.generator.go;

import org.rocstreaming.bindgen.generator.BaseGenerator;
import org.rocstreaming.bindgen.generator.CaseConversion;
import org.rocstreaming.bindgen.generator.GeneratedFile;
import org.rocstreaming.bindgen.generator.NameTranslator;
import org.rocstreaming.bindgen.model.ApiRoot;
import org.rocstreaming.bindgen.model.ClassDefinition;
import org.rocstreaming.bindgen.model.ClassMethod;
import org.rocstreaming.bindgen.model.DocComment;
import org.rocstreaming.bindgen.model.EnumDefinition;
import org.rocstreaming.bindgen.model.EnumValue;
import org.rocstreaming.bindgen.model.StructDefinition;
import org.rocstreaming.bindgen.model.StructField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Generates the roc-go sources of the C API.
 *
 * <p>Every file lands in {@code roc/} and belongs to package {@code roc}. Files are named after
 * the C name without namespace: {@code roc_interface} becomes {@code roc/interface.go}, and the
 * class scaffold of {@code roc_sender} becomes {@code roc/sender_DUMMY.go}.
 *
 * <p>Example of a generated enum:
 * <pre>{@code
 * // Interface type.
 * //
 * //go:generate stringer -type Interface -trimprefix Interface -output interface_string.go
 * type Interface int
 *
 * const (
 * 	// Interface for audio stream source data.
 * 	InterfaceAudioSource Interface = 11
 * )
 * }</pre>
 *
 * @see GoCommentRenderer
 */
public final class GoGenerator extends BaseGenerator {

    private static final Logger log = LoggerFactory.getLogger(GoGenerator.class);

    private static final String FIELD_INDENT = "\t";

    private final NameTranslator names;
    private final GoCommentRenderer comments;

    public GoGenerator(ApiRoot apiRoot) {
        super(apiRoot);
        this.names = NameTranslator.mechanical();
        this.comments = new GoCommentRenderer(apiRoot, names);
    }

    @Override
    public String target() {
        return "go";
    }

    // ==================== Enums ====================

    @Override
    public GeneratedFile generateEnum(EnumDefinition enumDefinition) {
        String goName = CaseConversion.stripNamespace(enumDefinition.name());
        String typeName = names.typeName(enumDefinition.name());
        log.debug("Generating enum {} from {}", typeName, enumDefinition.name());

        StringBuilder sb = fileHeader();
        sb.append(typeComment(typeName, enumDefinition.doc()));
        sb.append("//\n");
        sb.append("//go:generate stringer -type ").append(typeName)
                .append(" -trimprefix ").append(stringerPrefix(enumDefinition.name()))
                .append(" -output ").append(goName).append("_string.go\n");
        sb.append("type ").append(typeName).append(" int\n\n");
        sb.append("const (\n");

        List<EnumValue> values = enumDefinition.values();
        for (int i = 0; i < values.size(); i++) {
            EnumValue value = values.get(i);
            if (i != 0) {
                sb.append('\n');
            }
            sb.append(comments.render(value.doc(), FIELD_INDENT));
            sb.append(FIELD_INDENT).append(GoCommentRenderer.enumValueName(value.name()))
                    .append(' ').append(typeName)
                    .append(" = ").append(value.value()).append('\n');
        }

        sb.append(")\n");
        return sourceFile(goName, sb);
    }

    /**
     * Returns the prefix that {@code stringer} trims from constant names: the enum value prefix
     * in PascalCase, e.g. {@code ROC_PROTO_} becomes {@code Proto}.
     */
    private String stringerPrefix(String enumName) {
        String prefix = apiRoot.enumPrefix(enumName).toLowerCase(Locale.ROOT);
        prefix = CaseConversion.removeSuffix(CaseConversion.stripNamespace(prefix), "_");
        return CaseConversion.toPascalCase(prefix);
    }

    // ==================== Structs ====================

    @Override
    public GeneratedFile generateStruct(StructDefinition structDefinition) {
        String goName = CaseConversion.stripNamespace(structDefinition.name());
        String typeName = names.typeName(structDefinition.name());
        log.debug("Generating struct {} from {}", typeName, structDefinition.name());

        List<StructField> fields = structDefinition.fields();
        SortedSet<String> imports = new TreeSet<>();
        for (StructField field : fields) {
            if (fieldType(field).startsWith("time.")) {
                imports.add("time");
            }
        }

        StringBuilder sb = fileHeader();
        if (!imports.isEmpty()) {
            sb.append("import (\n");
            for (String imp : imports) {
                sb.append(FIELD_INDENT).append('"').append(imp).append("\"\n");
            }
            sb.append(")\n\n");
        }

        sb.append(typeComment(typeName, structDefinition.doc()));
        sb.append("type ").append(typeName).append(" struct {\n");

        for (int i = 0; i < fields.size(); i++) {
            StructField field = fields.get(i);
            if (i != 0) {
                sb.append('\n');
            }
            sb.append(comments.render(field.doc(), FIELD_INDENT));
            sb.append(FIELD_INDENT).append(fieldName(field))
                    .append(' ').append(fieldType(field)).append('\n');
        }

        sb.append("}\n");
        return sourceFile(goName, sb);
    }

    static String fieldName(StructField field) {
        return CaseConversion.toPascalCase(CaseConversion.stripNamespace(field.name().toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns the Go type of a struct field.
     *
     * <p>Resolution order: field override keyed by the PascalCase field name, then API types
     * ({@code roc_*}) translated like type names, then the C primitive table. Other types are
     * emitted verbatim.
     */
    String fieldType(StructField field) {
        String override = GoConventions.TYPE_OVERRIDES.get(fieldName(field));
        if (override != null) {
            return override;
        }
        if (field.type().startsWith(CaseConversion.NAMESPACE)) {
            return names.typeName(field.type());
        }
        return GoConventions.TYPE_MAP.getOrDefault(field.type(), field.type());
    }

    // ==================== Classes ====================

    /**
     * Generates a scaffold of a class: an empty struct and one function stub per C function,
     * with {@code open} renamed to {@code Open<Type>}.
     */
    @Override
    public GeneratedFile generateClass(ClassDefinition classDefinition) {
        String goName = CaseConversion.stripNamespace(classDefinition.name());
        String typeName = names.typeName(classDefinition.name());
        log.warn("Class generation is not fully supported yet, writing scaffold for {}", classDefinition.name());

        StringBuilder sb = fileHeader();
        sb.append(typeComment(typeName, classDefinition.doc()));
        sb.append("//\n");
        sb.append("type ").append(typeName).append(" struct {\n");
        sb.append("}\n\n");

        String methodPrefix = classDefinition.name() + "_";
        for (ClassMethod method : classDefinition.methods()) {
            String methodName = CaseConversion.toPascalCase(
                    CaseConversion.removePrefix(method.name(), methodPrefix));
            if ("Open".equals(methodName)) {
                methodName += typeName;
            }
            sb.append(comments.render(method.doc(), ""));
            sb.append("func ").append(methodName).append("() {\n");
            sb.append("// TODO: implement; fix signature\n");
            sb.append("}\n\n");
        }

        return sourceFile(goName + GoConventions.SCAFFOLD_SUFFIX, sb);
    }

    // ==================== Helpers ====================

    private StringBuilder fileHeader() {
        StringBuilder sb = new StringBuilder();
        for (String line : autogenComment()) {
            sb.append("// ").append(line).append('\n');
        }
        sb.append('\n');
        sb.append("package ").append(GoConventions.PACKAGE).append("\n\n");
        return sb;
    }

    private String typeComment(String typeName, DocComment doc) {
        List<String> override = GoConventions.COMMENT_OVERRIDES.get(typeName);
        if (override != null) {
            return String.join("\n", override) + "\n";
        }
        return comments.render(doc, "");
    }

    private static GeneratedFile sourceFile(String fileName, StringBuilder content) {
        return new GeneratedFile(GoConventions.SOURCE_DIR + fileName + ".go", content.toString());
    }
}
