package org.rocstreaming.bindgen.generator.go;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rocstreaming.bindgen.generator.NameTranslator;
import org.rocstreaming.bindgen.model.DocBlock;
import org.rocstreaming.bindgen.model.DocComment;
import org.rocstreaming.bindgen.model.DocItem;
import org.rocstreaming.bindgen.util.SampleApi;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GoCommentRenderer")
class GoCommentRendererTest {

    private final GoCommentRenderer renderer = new GoCommentRenderer(
            SampleApi.apiRoot(), NameTranslator.mechanical());

    @Test
    @DisplayName("References render as Go identifiers")
    void references() {
        assertThat(renderer.renderRef("roc_sender_config")).isEqualTo("SenderConfig");
        assertThat(renderer.renderRef("ROC_PROTO_RTP")).isEqualTo("ProtoRtp");
        assertThat(renderer.renderRef("ROC_FEC_ENCODING_DISABLE")).isEqualTo("FecEncodingDisable");
        assertThat(renderer.renderRef("outgoing_address")).isEqualTo("OutgoingAddress");
        assertThat(renderer.renderRef("roc_sender_write()")).isEqualTo("Sender.Write()");
        assertThat(renderer.renderRef("roc_sender_open()")).isEqualTo("OpenSender()");
    }

    @Test
    @DisplayName("Unresolved tokens are kept as is")
    void unresolved() {
        assertThat(renderer.renderRef("SO_REUSEADDR")).isEqualTo("SO_REUSEADDR");
    }

    @Test
    @DisplayName("Blocks are separated by an empty comment line")
    void blocks() {
        DocComment doc = DocComment.of(
                DocBlock.of(DocItem.text("Sender peer.")),
                DocBlock.of(DocItem.bold("Life cycle")),
                DocBlock.of(DocItem.see(), DocItem.ref("roc_sender_config")));

        assertThat(renderer.render(doc, "")).isEqualTo(
                "// Sender peer.\n"
                        + "//\n"
                        + "// Life cycle\n"
                        + "//\n"
                        + "// See SenderConfig\n");
    }

    @Test
    @DisplayName("Parentheses lose their inner spaces")
    void parentheses() {
        assertThat(renderer.render(SampleApi.PROTOCOL.doc(), "")).isEqualTo(
                "// Network protocol.\n"
                        + "//\n"
                        + "// Used as URI scheme, see protocol (Protocol).\n");
    }

    @Test
    @DisplayName("List entries are bullets with aligned continuation lines")
    void bullets() {
        DocComment doc = DocComment.of(DocBlock.of(
                DocItem.text("Words:"),
                DocItem.list(List.of(DocBlock.of(DocItem.text(
                        "first second third fourth fifth sixth seventh eighth ninth tenth eleventh twelfth"))))));

        assertThat(renderer.render(doc, "\t")).isEqualTo(
                "\t// Words:\n"
                        + "\t//  - first second third fourth fifth sixth seventh eighth ninth tenth eleventh\n"
                        + "\t//    twelfth\n");
    }

    @Test
    @DisplayName("Empty comment renders nothing")
    void empty() {
        assertThat(renderer.render(DocComment.empty(), "\t")).isEmpty();
    }

    @Test
    @DisplayName("Enum value names drop the namespace")
    void enumValueName() {
        assertThat(GoCommentRenderer.enumValueName("ROC_INTERFACE_AUDIO_SOURCE")).isEqualTo("InterfaceAudioSource");
        assertThat(GoCommentRenderer.enumValueName("ROC_PROTO_RTP_RS8M_SOURCE")).isEqualTo("ProtoRtpRs8mSource");
    }
}
