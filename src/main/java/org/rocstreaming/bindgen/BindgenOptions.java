package org.rocstreaming.bindgen;

import org.rocstreaming.bindgen.model.GitInfo;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved configuration of one generator run.
 *
 * @param target        ecosystems to generate
 * @param toolkitDir    roc-toolkit checkout, queried for its git revision
 * @param doxygenDir    Doxygen XML directory of the toolkit's public API
 * @param javaOutputDir roc-java checkout
 * @param goOutputDir   roc-go checkout
 * @param gitTag        toolkit tag to use instead of querying git, or {@code null}
 * @param gitCommit     toolkit commit to use instead of querying git, or {@code null}
 */
public record BindgenOptions(Target target,
                             Path toolkitDir,
                             Path doxygenDir,
                             Path javaOutputDir,
                             Path goOutputDir,
                             String gitTag,
                             String gitCommit) {

    /**
     * Doxygen XML location relative to the toolkit directory.
     */
    public static final String DEFAULT_DOXYGEN_SUBDIR = "build/docs/public_api/xml";

    public BindgenOptions {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(toolkitDir, "toolkitDir must not be null");
        Objects.requireNonNull(javaOutputDir, "javaOutputDir must not be null");
        Objects.requireNonNull(goOutputDir, "goOutputDir must not be null");
        if (doxygenDir == null) {
            doxygenDir = toolkitDir.resolve(DEFAULT_DOXYGEN_SUBDIR);
        }
        if ((gitTag == null) != (gitCommit == null)) {
            throw new IllegalArgumentException("gitTag and gitCommit must be given together");
        }
    }

    /**
     * Returns the revision given explicitly, if any.
     */
    public Optional<GitInfo> gitInfo() {
        return gitTag == null ? Optional.empty() : Optional.of(new GitInfo(gitTag, gitCommit));
    }
}
