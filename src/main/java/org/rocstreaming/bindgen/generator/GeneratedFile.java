package org.rocstreaming.bindgen.generator;

import java.util.Objects;

/**
 * One rendered source file, ready to be written.
 *
 * @param relativePath path relative to the target's output directory, {@code /}-separated
 *                     (e.g. {@code "roc/interface.go"})
 * @param content      complete file content
 */
public record GeneratedFile(String relativePath, String content) {

    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
