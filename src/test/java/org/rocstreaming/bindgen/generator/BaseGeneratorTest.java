package org.rocstreaming.bindgen.generator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rocstreaming.bindgen.index.ApiRootAssembler;
import org.rocstreaming.bindgen.model.ApiRoot;
import org.rocstreaming.bindgen.model.ClassDefinition;
import org.rocstreaming.bindgen.model.EnumDefinition;
import org.rocstreaming.bindgen.model.StructDefinition;
import org.rocstreaming.bindgen.util.Docs;
import org.rocstreaming.bindgen.util.Fixtures;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BaseGenerator")
class BaseGeneratorTest {

    /**
     * Generator that names each file after the definition it renders.
     */
    static class NamingGenerator extends BaseGenerator {

        NamingGenerator(ApiRoot apiRoot) {
            super(apiRoot);
        }

        @Override
        public String target() {
            return "naming";
        }

        @Override
        public GeneratedFile generateEnum(EnumDefinition enumDefinition) {
            return new GeneratedFile("enum/" + enumDefinition.name(), String.join("\n", autogenComment()));
        }

        @Override
        public GeneratedFile generateStruct(StructDefinition structDefinition) {
            return new GeneratedFile("struct/" + structDefinition.name(), "");
        }

        @Override
        public GeneratedFile generateClass(ClassDefinition classDefinition) {
            return new GeneratedFile("class/" + classDefinition.name(), "");
        }
    }

    @Test
    @DisplayName("Enums, structs and classes are generated in declaration order")
    void order() {
        ApiRoot root = ApiRootAssembler.assemble(Fixtures.GIT_INFO,
                List.of(new EnumDefinition("roc_protocol", List.of(), Docs.brief("Protocol.")),
                        new EnumDefinition("roc_interface", List.of(), Docs.brief("Interface."))),
                List.of(new StructDefinition("roc_sender_config", List.of(), Docs.brief("Sender config."))),
                List.of(new ClassDefinition("roc_sender", List.of(), Docs.brief("Sender.")),
                        new ClassDefinition("roc_context", List.of(), Docs.brief("Context."))));

        List<GeneratedFile> files = new NamingGenerator(root).generateFiles();

        assertThat(files).extracting(GeneratedFile::relativePath).containsExactly(
                "enum/roc_protocol",
                "enum/roc_interface",
                "struct/roc_sender_config",
                "class/roc_sender",
                "class/roc_context");
    }

    @Test
    @DisplayName("Banner names the toolkit revision")
    void banner() {
        ApiRoot root = ApiRootAssembler.assemble(Fixtures.GIT_INFO,
                List.of(new EnumDefinition("roc_protocol", List.of(), Docs.brief("Protocol."))),
                List.of(), List.of());

        assertThat(new NamingGenerator(root).generateFiles().get(0).content()).isEqualTo(
                "Code generated by bindgen from roc-streaming/bindgen\n"
                        + "roc-toolkit git tag: v0.4.0, commit: 1a2b3c4");
    }
}
