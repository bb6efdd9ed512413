package org.rocstreaming.bindgen.generator;

import org.rocstreaming.bindgen.BindgenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes generated files beneath a target's output directory.
 *
 * <p>The output directory itself must already exist, usually as a checkout of the binding
 * repository. Intermediate directories below it are created as needed; existing files are
 * overwritten.
 */
public final class GeneratedFileWriter {

    private static final Logger log = LoggerFactory.getLogger(GeneratedFileWriter.class);

    private final Path outputDir;

    public GeneratedFileWriter(Path outputDir) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir must not be null");
    }

    /**
     * Fails if the output directory does not exist.
     *
     * @throws BindgenException if the directory is missing or is not a directory
     */
    public void checkOutputDir() throws BindgenException {
        if (!Files.isDirectory(outputDir)) {
            throw new BindgenException("Output directory doesn't exist: " + outputDir);
        }
    }

    /**
     * Writes every file, in order.
     *
     * @param files files to write
     * @throws BindgenException if the output directory is missing or a file can't be written
     */
    public void write(List<GeneratedFile> files) throws BindgenException {
        checkOutputDir();
        for (GeneratedFile file : files) {
            write(file);
        }
    }

    private void write(GeneratedFile file) throws BindgenException {
        Path path = outputDir.resolve(file.relativePath());
        log.debug("Writing {}", path);
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, file.content(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BindgenException("Can't write file: " + path, e);
        }
    }
}
