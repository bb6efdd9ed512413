package org.rocstreaming.bindgen.doxygen;

import org.rocstreaming.bindgen.BindgenException;
import org.rocstreaming.bindgen.index.ApiRootAssembler;
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
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the definitions of the roc-toolkit C API from Doxygen XML output.
 *
 * <p><b>Sources:</b>
 * <ul>
 *   <li><b>Enums</b>: {@code sectiondef[kind=enum]/memberdef[kind=enum]} of the enums file;
 *       each {@code enumvalue} gives a name and an initializer with its {@code "= "} removed</li>
 *   <li><b>Structs</b>: one compound file per struct; fields are
 *       {@code sectiondef/memberdef[kind=variable]}</li>
 *   <li><b>Classes</b>: one header file per class; the class is the first typedef, its methods
 *       are the functions of the header</li>
 * </ul>
 *
 * <p>Any missing or malformed file aborts the run with a {@link BindgenException}.
 *
 * @see DocCommentParser
 * @see ApiRootAssembler
 */
public final class DoxygenParser {

    private static final Logger log = LoggerFactory.getLogger(DoxygenParser.class);

    private final Path doxygenDir;
    private final DoxygenLayout layout;
    private final DocumentBuilderFactory documentBuilderFactory;

    public DoxygenParser(Path doxygenDir) {
        this(doxygenDir, DoxygenLayout.ROC_TOOLKIT);
    }

    public DoxygenParser(Path doxygenDir, DoxygenLayout layout) {
        this.doxygenDir = Objects.requireNonNull(doxygenDir, "doxygenDir must not be null");
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
        this.documentBuilderFactory = DocumentBuilderFactory.newInstance();
        this.documentBuilderFactory.setCoalescing(true);
        this.documentBuilderFactory.setNamespaceAware(false);
    }

    /**
     * Parses every definition and assembles the indexed API root.
     *
     * @param gitInfo roc-toolkit revision to record in the root
     * @return the API root
     * @throws BindgenException if an input file is missing or malformed
     */
    public ApiRoot parse(GitInfo gitInfo) throws BindgenException {
        List<EnumDefinition> enums = parseEnums();
        List<StructDefinition> structs = parseStructs();
        List<ClassDefinition> classes = parseClasses();

        try {
            return ApiRootAssembler.assemble(gitInfo, enums, structs, classes);
        } catch (IllegalArgumentException e) {
            throw new BindgenException("Inconsistent API definitions in " + doxygenDir + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses all enums of the enums file, in declaration order.
     */
    public List<EnumDefinition> parseEnums() throws BindgenException {
        Path file = doxygenDir.resolve(layout.enumsFile());
        Element root = load(file);
        List<EnumDefinition> enums = new ArrayList<>();

        for (Element section : XmlElements.descendants(root, "sectiondef")) {
            if (!"enum".equals(section.getAttribute("kind"))) {
                continue;
            }
            for (Element memberDef : XmlElements.children(section, "memberdef")) {
                if (!"enum".equals(memberDef.getAttribute("kind"))) {
                    continue;
                }
                String name = requireText(memberDef, "name", file);
                List<EnumValue> values = new ArrayList<>();

                for (Element enumValue : XmlElements.children(memberDef, "enumvalue")) {
                    String valueName = requireText(enumValue, "name", file);
                    String initializer = requireText(enumValue, "initializer", file);
                    values.add(new EnumValue(valueName, stripInitializer(initializer),
                            DocCommentParser.parse(enumValue)));
                }

                log.debug("Found enum in docs: {}", name);
                enums.add(new EnumDefinition(name, values, DocCommentParser.parse(memberDef)));
            }
        }
        return enums;
    }

    /**
     * Parses every struct file of the layout, in layout order.
     */
    public List<StructDefinition> parseStructs() throws BindgenException {
        List<StructDefinition> structs = new ArrayList<>();

        for (String fileName : layout.structFiles()) {
            Path file = doxygenDir.resolve(fileName);
            Element compound = requireCompound(load(file), file);
            String name = requireText(compound, "compoundname", file);
            List<StructField> fields = new ArrayList<>();

            for (Element memberDef : XmlElements.all(compound, "sectiondef/memberdef")) {
                if (!"variable".equals(memberDef.getAttribute("kind"))) {
                    continue;
                }
                String fieldName = requireText(memberDef, "name", file);
                Element type = XmlElements.first(memberDef, "type")
                        .orElseThrow(() -> new BindgenException(
                                "Missing type of field " + fieldName + " in " + file));
                fields.add(new StructField(fieldName, parseFieldType(type), DocCommentParser.parse(memberDef)));
            }

            log.debug("Found struct in docs: {}", name);
            structs.add(new StructDefinition(name, fields, DocCommentParser.parse(compound)));
        }
        return structs;
    }

    /**
     * Parses every class file of the layout, in layout order.
     */
    public List<ClassDefinition> parseClasses() throws BindgenException {
        List<ClassDefinition> classes = new ArrayList<>();

        for (String fileName : layout.classFiles()) {
            Path file = doxygenDir.resolve(fileName);
            Element compound = requireCompound(load(file), file);
            List<Element> memberDefs = XmlElements.all(compound, "sectiondef/memberdef");

            Element typedef = memberDefs.stream()
                    .filter(m -> "typedef".equals(m.getAttribute("kind")))
                    .findFirst()
                    .orElseThrow(() -> new BindgenException("Missing typedef in " + file));
            String name = requireText(typedef, "name", file);
            List<ClassMethod> methods = new ArrayList<>();

            for (Element memberDef : memberDefs) {
                if ("function".equals(memberDef.getAttribute("kind"))) {
                    methods.add(new ClassMethod(requireText(memberDef, "name", file),
                            DocCommentParser.parse(memberDef)));
                }
            }

            log.debug("Found class in docs: {}", name);
            classes.add(new ClassDefinition(name, methods, DocCommentParser.parse(typedef)));
        }
        return classes;
    }

    /**
     * Returns the field type: the referenced API type when the type is a link
     * ({@code <type><ref>roc_clock_source</ref></type>}), otherwise the plain type text
     * ({@code <type>unsigned int</type>}).
     */
    static String parseFieldType(Element type) {
        return XmlElements.text(type, "ref")
                .orElseGet(() -> type.getTextContent().strip());
    }

    private static String stripInitializer(String initializer) {
        return initializer.startsWith("= ") ? initializer.substring(2).strip() : initializer;
    }

    private Element load(Path file) throws BindgenException {
        log.info("Parsing {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            DocumentBuilder builder = documentBuilderFactory.newDocumentBuilder();
            return builder.parse(in).getDocumentElement();
        } catch (NoSuchFileException e) {
            throw new BindgenException("File not found: " + file, e);
        } catch (SAXException e) {
            throw new BindgenException("Error parsing XML file: " + file, e);
        } catch (IOException e) {
            throw new BindgenException("Error reading XML file: " + file, e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    private static Element requireCompound(Element root, Path file) throws BindgenException {
        List<Element> compounds = XmlElements.descendants(root, "compounddef");
        if (compounds.isEmpty()) {
            throw new BindgenException("Missing compounddef in " + file);
        }
        return compounds.get(0);
    }

    private static String requireText(Element parent, String path, Path file) throws BindgenException {
        return XmlElements.text(parent, path)
                .orElseThrow(() -> new BindgenException(
                        "Missing <" + path + "> in <" + parent.getTagName() + "> of " + file));
    }
}
