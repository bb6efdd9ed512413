package org.rocstreaming.bindgen.generator.java;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
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

import javax.lang.model.element.Modifier;
import java.util.List;

/**
 * Generates the roc-java sources of the C API.
 *
 * <p><b>Output:</b>
 * <table border="1">
 *   <caption>Generated Java files</caption>
 *   <tr><th>Definition</th><th>File</th><th>Content</th></tr>
 *   <tr>
 *     <td>Enum {@code roc_interface}</td>
 *     <td>{@code src/main/java/org/rocstreaming/roctoolkit/Interface.java}</td>
 *     <td>Java enum; each constant carries the C value in its {@code value} field</td>
 *   </tr>
 *   <tr>
 *     <td>Struct {@code roc_sender_config}</td>
 *     <td>{@code src/main/java/org/rocstreaming/roctoolkit/RocSenderConfig.java}</td>
 *     <td>Lombok value class with a builder created by {@code RocSenderConfigValidator}</td>
 *   </tr>
 *   <tr>
 *     <td>Class {@code roc_sender}</td>
 *     <td>{@code scaffold/org/rocstreaming/roctoolkit/RocSender.java}</td>
 *     <td>Scaffold with one stub per function, to be completed by hand</td>
 *   </tr>
 * </table>
 *
 * <p>Example of a generated enum:
 * <pre>{@code
 * package org.rocstreaming.roctoolkit;
 *
 * public enum Interface {
 *     AUDIO_SOURCE(11),
 *
 *     AUDIO_REPAIR(12);
 *
 *     final int value;
 *
 *     Interface(int value) {
 *         this.value = value;
 *     }
 * }
 * }</pre>
 *
 * @see JavadocRenderer
 */
public final class JavaGenerator extends BaseGenerator {

    private static final Logger log = LoggerFactory.getLogger(JavaGenerator.class);

    private static final String INDENT = "    ";

    private final NameTranslator names;
    private final JavadocRenderer javadoc;

    public JavaGenerator(ApiRoot apiRoot) {
        super(apiRoot);
        this.names = new NameTranslator(JavaConventions.NAME_OVERRIDES);
        this.javadoc = new JavadocRenderer(apiRoot, names);
    }

    @Override
    public String target() {
        return "java";
    }

    // ==================== Enums ====================

    @Override
    public GeneratedFile generateEnum(EnumDefinition enumDefinition) {
        String javaName = names.typeName(enumDefinition.name());
        log.debug("Generating enum {} from {}", javaName, enumDefinition.name());

        TypeSpec.Builder enumBuilder = TypeSpec.enumBuilder(javaName)
                .addModifiers(Modifier.PUBLIC)
                .addJavadoc(typeComment(javaName, enumDefinition.doc()));

        for (EnumValue value : enumDefinition.values()) {
            String constantName = javadoc.enumValueName(enumDefinition.name(), value.name());
            enumBuilder.addEnumConstant(constantName, TypeSpec.anonymousClassBuilder("$L", value.value())
                    .addJavadoc(javadoc.render(value.doc(), INDENT.length()))
                    .build());
        }

        enumBuilder.addField(FieldSpec.builder(TypeName.INT, "value", Modifier.FINAL).build());
        enumBuilder.addMethod(MethodSpec.constructorBuilder()
                .addParameter(TypeName.INT, "value")
                .addStatement("this.value = value")
                .build());

        return sourceFile(JavaConventions.SOURCE_ROOT, javaName, enumBuilder.build());
    }

    // ==================== Structs ====================

    @Override
    public GeneratedFile generateStruct(StructDefinition structDefinition) {
        String javaName = names.typeName(structDefinition.name());
        log.debug("Generating struct {} from {}", javaName, structDefinition.name());

        ClassName className = ClassName.get(JavaConventions.PACKAGE, javaName);
        ClassName builderName = className.nestedClass(JavaConventions.BUILDER_CLASS_NAME);
        ClassName validatorName = ClassName.get(JavaConventions.PACKAGE,
                javaName + JavaConventions.VALIDATOR_SUFFIX);

        TypeSpec.Builder classBuilder = TypeSpec.classBuilder(javaName)
                .addModifiers(Modifier.PUBLIC)
                .addJavadoc(typeComment(javaName, structDefinition.doc()))
                .addAnnotation(JavaConventions.LOMBOK_GETTER)
                .addAnnotation(AnnotationSpec.builder(JavaConventions.LOMBOK_BUILDER)
                        .addMember("builderClassName", "$S", JavaConventions.BUILDER_CLASS_NAME)
                        .addMember("toBuilder", "$L", true)
                        .build())
                .addAnnotation(JavaConventions.LOMBOK_TO_STRING)
                .addAnnotation(JavaConventions.LOMBOK_EQUALS_AND_HASH_CODE);

        for (StructField field : structDefinition.fields()) {
            classBuilder.addField(FieldSpec.builder(fieldType(field), fieldName(field), Modifier.PRIVATE)
                    .addJavadoc(javadoc.render(field.doc(), INDENT.length()))
                    .build());
        }

        classBuilder.addMethod(MethodSpec.methodBuilder("builder")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(builderName)
                .addStatement("return new $T()", validatorName)
                .build());

        return sourceFile(JavaConventions.SOURCE_ROOT, javaName, classBuilder.build());
    }

    /**
     * Returns the Java type of a struct field.
     *
     * <p>Resolution order:
     * <ol>
     *   <li>Field override, keyed by the camelCase field name</li>
     *   <li>API type ({@code roc_*}), translated like a type name</li>
     *   <li>C primitive type table</li>
     * </ol>
     * Any other type is reported and emitted as {@code Object}.
     */
    TypeName fieldType(StructField field) {
        TypeName override = JavaConventions.TYPE_OVERRIDES.get(fieldName(field));
        if (override != null) {
            return override;
        }
        if (field.type().startsWith(CaseConversion.NAMESPACE)) {
            return ClassName.get(JavaConventions.PACKAGE, names.typeName(field.type()));
        }
        TypeName primitive = JavaConventions.TYPE_MAP.get(field.type());
        if (primitive != null) {
            return primitive;
        }
        log.warn("Unknown type = {} of field {}, it is emitted as Object", field.type(), field.name());
        return TypeName.OBJECT;
    }

    static String fieldName(StructField field) {
        return CaseConversion.toCamelCase(field.name());
    }

    // ==================== Classes ====================

    /**
     * Generates a scaffold of a class.
     *
     * <p>Method signatures are not translated yet, so every function becomes a stub throwing
     * {@link UnsupportedOperationException}, and {@code open} becomes the constructor. The
     * scaffold is written under {@value JavaConventions#SCAFFOLD_ROOT} and must be merged into
     * the hand-written class manually.
     */
    @Override
    public GeneratedFile generateClass(ClassDefinition classDefinition) {
        String javaName = names.typeName(classDefinition.name());
        log.warn("Class generation is not fully supported yet, writing scaffold for {}", classDefinition.name());

        TypeSpec.Builder classBuilder = TypeSpec.classBuilder(javaName)
                .addModifiers(Modifier.PUBLIC)
                .addJavadoc(typeComment(javaName, classDefinition.doc()));

        String methodPrefix = classDefinition.name() + "_";
        for (ClassMethod method : classDefinition.methods()) {
            String suffix = CaseConversion.removePrefix(method.name(), methodPrefix);
            MethodSpec.Builder methodBuilder = "open".equals(suffix)
                    ? MethodSpec.constructorBuilder()
                    : MethodSpec.methodBuilder(CaseConversion.toCamelCase(suffix));
            classBuilder.addMethod(methodBuilder
                    .addModifiers(Modifier.PUBLIC)
                    .addJavadoc(javadoc.render(method.doc(), INDENT.length()))
                    .addStatement("throw new $T($S)", UnsupportedOperationException.class,
                            "TODO: implement; fix signature")
                    .build());
        }

        return sourceFile(JavaConventions.SCAFFOLD_ROOT, javaName, classBuilder.build());
    }

    // ==================== Helpers ====================

    private CodeBlock typeComment(String javaName, DocComment doc) {
        List<String> override = JavaConventions.COMMENT_OVERRIDES.get(javaName);
        if (override != null) {
            return JavadocRenderer.toCodeBlock(override);
        }
        return javadoc.render(doc, 0);
    }

    private GeneratedFile sourceFile(String root, String javaName, TypeSpec typeSpec) {
        JavaFile javaFile = JavaFile.builder(JavaConventions.PACKAGE, typeSpec)
                .addFileComment("$L", String.join("\n", autogenComment()))
                .skipJavaLangImports(true)
                .indent(INDENT)
                .build();

        String path = root + JavaConventions.PACKAGE.replace('.', '/') + "/" + javaName + ".java";
        return new GeneratedFile(path, javaFile.toString());
    }
}
