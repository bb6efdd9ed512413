package org.rocstreaming.bindgen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rocstreaming.bindgen.model.GitInfo;
import org.rocstreaming.bindgen.util.SampleApi;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BindgenOptions")
class BindgenOptionsTest {

    private static final Path TOOLKIT = Path.of("roc-toolkit");

    @Test
    @DisplayName("Doxygen directory defaults to the toolkit build directory")
    void defaultDoxygenDir() {
        BindgenOptions options = new BindgenOptions(Target.ALL, TOOLKIT, null,
                Path.of("roc-java"), Path.of("roc-go"), null, null);

        assertThat(options.doxygenDir()).isEqualTo(TOOLKIT.resolve("build/docs/public_api/xml"));
        assertThat(options.gitInfo()).isEmpty();
    }

    @Test
    @DisplayName("Explicit revision skips git")
    void explicitRevision() {
        BindgenOptions options = new BindgenOptions(Target.JAVA, TOOLKIT, Path.of("xml"),
                Path.of("roc-java"), Path.of("roc-go"), "v0.4.0", "1a2b3c4");

        assertThat(options.doxygenDir()).isEqualTo(Path.of("xml"));
        assertThat(options.gitInfo()).contains(new GitInfo("v0.4.0", "1a2b3c4"));
    }

    @Test
    @DisplayName("Tag and commit come together")
    void partialRevision() {
        assertThatThrownBy(() -> new BindgenOptions(Target.GO, TOOLKIT, null,
                Path.of("roc-java"), Path.of("roc-go"), "v0.4.0", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Target selection")
    void targets() {
        assertThat(Target.ALL.includes(Target.JAVA)).isTrue();
        assertThat(Target.ALL.includes(Target.GO)).isTrue();
        assertThat(Target.GO.includes(Target.JAVA)).isFalse();
    }

    @Test
    @DisplayName("Each single target has its generator")
    void generators() {
        assertThat(Bindgen.generator(Target.JAVA, SampleApi.apiRoot()).target()).isEqualTo("java");
        assertThat(Bindgen.generator(Target.GO, SampleApi.apiRoot()).target()).isEqualTo("go");
        assertThatThrownBy(() -> Bindgen.generator(Target.ALL, SampleApi.apiRoot()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
