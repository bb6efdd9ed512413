package org.rocstreaming.bindgen.generator.java;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.rocstreaming.bindgen.generator.NameTranslator;
import org.rocstreaming.bindgen.model.DocBlock;
import org.rocstreaming.bindgen.model.DocComment;
import org.rocstreaming.bindgen.model.DocItem;
import org.rocstreaming.bindgen.util.SampleApi;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JavadocRenderer")
class JavadocRendererTest {

    private final JavadocRenderer renderer = new JavadocRenderer(
            SampleApi.apiRoot(), new NameTranslator(JavaConventions.NAME_OVERRIDES));

    @Nested
    @DisplayName("References")
    class References {

        @Test
        @DisplayName("Types link to the Java type")
        void types() {
            assertThat(renderer.renderRef("roc_protocol")).isEqualTo("{@link Protocol}");
            assertThat(renderer.renderRef("roc_sender_config")).isEqualTo("{@link RocSenderConfig}");
        }

        @Test
        @DisplayName("Enum values link to the constant")
        void enumValues() {
            assertThat(renderer.renderRef("ROC_PROTO_RTP")).isEqualTo("{@link Protocol#RTP}");
            assertThat(renderer.renderRef("ROC_FEC_ENCODING_DISABLE")).isEqualTo("{@link FecEncoding#DISABLE}");
        }

        @Test
        @DisplayName("Struct fields render as code")
        void structFields() {
            assertThat(renderer.renderRef("outgoing_address")).isEqualTo("{@code outgoingAddress}");
        }

        @Test
        @DisplayName("Methods link to the method, open links to the constructor")
        void methods() {
            assertThat(renderer.renderRef("roc_sender_write()")).isEqualTo("{@link RocSender#write()}");
            assertThat(renderer.renderRef("roc_sender_open()")).isEqualTo("{@link RocSender#RocSender()}");
        }

        @Test
        @DisplayName("Unresolved tokens render as code")
        void unresolved() {
            assertThat(renderer.renderRef("SO_REUSEADDR")).isEqualTo("{@code SO_REUSEADDR}");
            assertThat(renderer.renderRef("never_seen")).isEqualTo("{@code never_seen}");
        }
    }

    @Nested
    @DisplayName("Lines")
    class Lines {

        @Test
        @DisplayName("Blocks are separated by paragraph tags")
        void blocks() {
            DocComment doc = DocComment.of(
                    DocBlock.of(DocItem.text("Sender peer.")),
                    DocBlock.of(DocItem.bold("Life cycle")),
                    DocBlock.of(DocItem.text("Call"), DocItem.ref("roc_sender_write()"),
                            DocItem.text("after"), DocItem.ref("roc_sender_open()"), DocItem.text(".")));

            assertThat(renderer.lines(doc, 0)).containsExactly(
                    "Sender peer.",
                    "<p>",
                    "<b>Life cycle</b>",
                    "<p>",
                    "Call {@link RocSender#write()} after {@link RocSender#RocSender()}.");
        }

        @Test
        @DisplayName("Lists become one line per entry")
        void lists() {
            assertThat(renderer.lines(SampleApi.INTERFACE_CONFIG.fields().get(1).doc(), 4)).containsExactly(
                    "Socket address reuse flag.",
                    "<p>",
                    "Address reuse is enabled when: <ul>",
                    "<li>{@code outgoingAddress} is set</li>",
                    "<li>{@code SO_REUSEADDR} is supported</li>",
                    "</ul>");
        }

        @Test
        @DisplayName("See blocks and emphasis keep their markup")
        void seeAndEmphasis() {
            DocComment doc = DocComment.of(
                    DocBlock.of(DocItem.text("Sets the"), DocItem.emphasis("first"), DocItem.text("slot.")),
                    DocBlock.of(DocItem.see(), DocItem.ref("roc_sender_config")));

            assertThat(renderer.lines(doc, 0)).containsExactly(
                    "Sets the <em>first</em> slot.",
                    "<p>",
                    "@see {@link RocSenderConfig}");
        }

        @Test
        @DisplayName("Long text is wrapped to the comment width")
        void wrapping() {
            String text = String.join(" ", Collections.nCopies(40, "word"));
            List<String> lines = renderer.lines(DocComment.of(DocBlock.of(DocItem.text(text))), 4);

            assertThat(lines).hasSizeGreaterThan(1);
            assertThat(lines).allSatisfy(line -> assertThat(4 + " * ".length() + line.length())
                    .isLessThanOrEqualTo(80));
            assertThat(String.join(" ", lines)).isEqualTo(text);
        }

        @Test
        @DisplayName("Empty comment has no lines")
        void empty() {
            assertThat(renderer.lines(DocComment.empty(), 0)).isEmpty();
            assertThat(renderer.render(DocComment.empty(), 0).isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("Enum constant names drop the value prefix")
    void enumValueName() {
        assertThat(renderer.enumValueName("roc_protocol", "ROC_PROTO_RTP")).isEqualTo("RTP");
        assertThat(renderer.enumValueName("roc_interface", "ROC_INTERFACE_AUDIO_SOURCE")).isEqualTo("AUDIO_SOURCE");
    }
}
