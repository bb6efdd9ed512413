package org.rocstreaming.bindgen.doxygen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.rocstreaming.bindgen.model.DocBlock;
import org.rocstreaming.bindgen.model.DocComment;
import org.rocstreaming.bindgen.model.DocItem;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocCommentParser")
class DocCommentParserTest {

    private static Element element(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setCoalescing(true);
            return factory.newDocumentBuilder()
                    .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)))
                    .getDocumentElement();
        } catch (Exception e) {
            throw new IllegalStateException("Invalid test XML", e);
        }
    }

    @Nested
    @DisplayName("Inline markup")
    class InlineMarkup {

        @Test
        @DisplayName("Para text, reference and tail text become separate items")
        void referenceWithTail() {
            List<DocItem> items = DocCommentParser.parseElement(element(
                    "<para>Allowed protocols: <ref refid=\"x\">ROC_PROTO_RTCP</ref>. </para>"));

            assertThat(items).containsExactly(
                    DocItem.text("Allowed protocols:"),
                    DocItem.ref("ROC_PROTO_RTCP"),
                    DocItem.text("."));
        }

        @Test
        @DisplayName("Each markup element maps to its item kind")
        void markupKinds() {
            List<DocItem> items = DocCommentParser.parseElement(element(
                    "<para>Use <computeroutput>packet_length</computeroutput> with "
                            + "<bold>care</bold> and <emphasis>caution</emphasis></para>"));

            assertThat(items).containsExactly(
                    DocItem.text("Use"),
                    DocItem.code("packet_length"),
                    DocItem.text("with"),
                    DocItem.bold("care"),
                    DocItem.text("and"),
                    DocItem.emphasis("caution"));
        }

        @Test
        @DisplayName("Nested elements are flattened in source order")
        void nestedElements() {
            List<DocItem> items = DocCommentParser.parseElement(element(
                    "<para>A <bold>B <ref>roc_sender</ref> C</bold> D</para>"));

            assertThat(items).containsExactly(
                    DocItem.text("A"),
                    DocItem.bold("B"),
                    DocItem.ref("roc_sender"),
                    DocItem.text("C"),
                    DocItem.text("D"));
        }

        @Test
        @DisplayName("Whitespace runs collapse and whitespace-only tails are dropped")
        void whitespace() {
            List<DocItem> items = DocCommentParser.parseElement(element(
                    "<para>  two\n   lines <ref>roc_context</ref>\n  </para>"));

            assertThat(items).containsExactly(
                    DocItem.text("two lines"),
                    DocItem.ref("roc_context"));
        }

        @Test
        @DisplayName("See section becomes a SEE marker followed by its content")
        void seeSection() {
            List<DocItem> items = DocCommentParser.parseElement(element(
                    "<para><simplesect kind=\"see\"><para><ref>roc_receiver</ref> </para></simplesect></para>"));

            assertThat(items).containsExactly(
                    DocItem.see(),
                    DocItem.ref("roc_receiver"));
        }
    }

    @Nested
    @DisplayName("Unknown markup")
    class UnknownMarkup {

        @Test
        @DisplayName("Unknown element drops its own text but keeps its tail")
        void unknownElement() {
            List<DocItem> items = DocCommentParser.parseElement(element(
                    "<para>See <ulink url=\"https://roc-streaming.org\">website</ulink> for details</para>"));

            assertThat(items).containsExactly(
                    DocItem.text("See"),
                    DocItem.text("for details"));
        }

        @Test
        @DisplayName("Unknown element keeps its children")
        void unknownElementChildren() {
            List<DocItem> items = DocCommentParser.parseElement(element(
                    "<para><parameterlist><parameteritem><parameterdescription>"
                            + "<para>should point to <ref>roc_context</ref></para>"
                            + "</parameterdescription></parameteritem></parameterlist></para>"));

            assertThat(items).containsExactly(
                    DocItem.text("should point to"),
                    DocItem.ref("roc_context"));
        }

        @Test
        @DisplayName("Unknown simplesect kind keeps its content without a marker")
        void unknownSimplesect() {
            List<DocItem> items = DocCommentParser.parseElement(element(
                    "<para><simplesect kind=\"return\"><para>Returns zero on success.</para></simplesect></para>"));

            assertThat(items).containsExactly(DocItem.text("Returns zero on success."));
        }
    }

    @Nested
    @DisplayName("Lists")
    class Lists {

        @Test
        @DisplayName("Each list item becomes one child block")
        void listItems() {
            List<DocItem> items = DocCommentParser.parseElement(element("""
                    <para>Address reuse is enabled when: <itemizedlist>
                    <listitem><para><computeroutput>outgoing_address</computeroutput> is set </para></listitem>
                    <listitem><para><computeroutput>multicast_group</computeroutput> is set </para></listitem>
                    </itemizedlist>
                    </para>
                    """));

            assertThat(items).containsExactly(
                    DocItem.text("Address reuse is enabled when:"),
                    DocItem.list(List.of(
                            DocBlock.of(DocItem.code("outgoing_address"), DocItem.text("is set")),
                            DocBlock.of(DocItem.code("multicast_group"), DocItem.text("is set")))));
        }

        @Test
        @DisplayName("Nested lists stay nested")
        void nestedList() {
            List<DocItem> items = DocCommentParser.parseElement(element(
                    "<itemizedlist><listitem><para>outer<itemizedlist>"
                            + "<listitem><para>inner</para></listitem>"
                            + "</itemizedlist></para></listitem></itemizedlist>"));

            assertThat(items).hasSize(1);
            DocItem outer = items.get(0);
            assertThat(outer.kind()).isEqualTo(DocItem.Kind.LIST);
            assertThat(outer.childBlocks()).containsExactly(DocBlock.of(
                    DocItem.text("outer"),
                    DocItem.list(List.of(DocBlock.of(DocItem.text("inner"))))));
        }
    }

    @Nested
    @DisplayName("Comments")
    class Comments {

        @Test
        @DisplayName("Brief comes first, then one block per detailed paragraph")
        void briefAndDetails() {
            DocComment doc = DocCommentParser.parse(element("""
                    <memberdef kind="function">
                      <name>roc_context_close</name>
                      <briefdescription><para>Close the context. </para></briefdescription>
                      <detaileddescription>
                        <para>Stops any started background threads.</para>
                        <para>The user should ensure that nobody uses the context.</para>
                      </detaileddescription>
                    </memberdef>
                    """));

            assertThat(doc.blocks()).containsExactly(
                    DocBlock.of(DocItem.text("Close the context.")),
                    DocBlock.of(DocItem.text("Stops any started background threads.")),
                    DocBlock.of(DocItem.text("The user should ensure that nobody uses the context.")));
        }

        @Test
        @DisplayName("Missing brief still yields an empty first block")
        void missingBrief() {
            DocComment doc = DocCommentParser.parse(element("""
                    <enumvalue>
                      <name>ROC_INTERFACE_AUDIO_REPAIR</name>
                      <briefdescription>
                      </briefdescription>
                      <detaileddescription>
                        <para>Repair data.</para>
                      </detaileddescription>
                    </enumvalue>
                    """));

            assertThat(doc.brief().isEmpty()).isTrue();
            assertThat(doc.details()).containsExactly(DocBlock.of(DocItem.text("Repair data.")));
        }

        @Test
        @DisplayName("Element without descriptions yields a single empty block")
        void noDescriptions() {
            DocComment doc = DocCommentParser.parse(element("<memberdef><name>x</name></memberdef>"));

            assertThat(doc).isEqualTo(DocComment.empty());
        }
    }
}
