package org.rocstreaming.bindgen.doxygen;

import org.rocstreaming.bindgen.BindgenException;
import org.rocstreaming.bindgen.model.GitInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads the roc-toolkit revision from its git checkout.
 *
 * <p>Runs {@code git describe --tags} and {@code git rev-parse --short HEAD} in the toolkit
 * directory. Only standard output becomes the revision; anything git prints on standard error
 * is logged. Without this metadata the generated file banners cannot be written, so any
 * failure is fatal.
 */
public final class GitInfoReader {

    private static final Logger log = LoggerFactory.getLogger(GitInfoReader.class);

    private final Path toolkitDir;

    public GitInfoReader(Path toolkitDir) {
        this.toolkitDir = Objects.requireNonNull(toolkitDir, "toolkitDir must not be null");
    }

    /**
     * Reads the current tag and short commit hash.
     *
     * @return the revision
     * @throws BindgenException if git fails or the directory is not a git checkout
     */
    public GitInfo read() throws BindgenException {
        String tag = run(List.of("git", "describe", "--tags"));
        String commit = run(List.of("git", "rev-parse", "--short", "HEAD"));

        log.debug("Detected git tag {}, commit {}", tag, commit);
        return new GitInfo(tag, commit);
    }

    private String run(List<String> command) throws BindgenException {
        ProcessBuilder builder = new ProcessBuilder(command).directory(toolkitDir.toFile());
        try {
            Process process = builder.start();
            String output;
            String errors;
            try (InputStream out = process.getInputStream(); InputStream err = process.getErrorStream()) {
                output = new String(out.readAllBytes(), StandardCharsets.US_ASCII).strip();
                errors = new String(err.readAllBytes(), StandardCharsets.UTF_8).strip();
            }
            int exitCode = process.waitFor();
            if (exitCode != 0 || output.isEmpty()) {
                throw new BindgenException("Command '" + String.join(" ", command) + "' failed in "
                        + toolkitDir + " (exit code " + exitCode + "): " + errors);
            }
            // git reports non-fatal conditions such as renamed tags on stderr
            errors.lines().forEach(line -> log.warn("{}: {}", String.join(" ", command), line));
            return output;
        } catch (IOException e) {
            throw new BindgenException("Can't run '" + String.join(" ", command) + "' in " + toolkitDir, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BindgenException("Interrupted while running '" + String.join(" ", command) + "'", e);
        }
    }
}
