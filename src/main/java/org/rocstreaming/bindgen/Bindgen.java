package org.rocstreaming.bindgen;

import org.rocstreaming.bindgen.doxygen.DoxygenParser;
import org.rocstreaming.bindgen.doxygen.GitInfoReader;
import org.rocstreaming.bindgen.generator.GeneratedFile;
import org.rocstreaming.bindgen.generator.GeneratedFileWriter;
import org.rocstreaming.bindgen.generator.Generator;
import org.rocstreaming.bindgen.generator.go.GoGenerator;
import org.rocstreaming.bindgen.generator.java.JavaGenerator;
import org.rocstreaming.bindgen.model.ApiRoot;
import org.rocstreaming.bindgen.model.GitInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the whole pipeline: reads the API once, then generates and writes every selected target.
 *
 * <p><b>Phases:</b>
 * <ol>
 *   <li>Check that every selected output directory exists</li>
 *   <li>Determine the toolkit revision (options or git)</li>
 *   <li>Parse the Doxygen XML and build the symbol index</li>
 *   <li>For each target, render all files and write them</li>
 * </ol>
 * Phases run strictly in order; any fatal condition stops the run before the next write.
 */
public final class Bindgen {

    private static final Logger log = LoggerFactory.getLogger(Bindgen.class);

    private final BindgenOptions options;

    public Bindgen(BindgenOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Runs the generator.
     *
     * @throws BindgenException on missing or malformed input, a missing output directory or
     *                          unavailable git metadata
     */
    public void run() throws BindgenException {
        Map<Target, GeneratedFileWriter> writers = writers();
        for (GeneratedFileWriter writer : writers.values()) {
            writer.checkOutputDir();
        }

        GitInfo gitInfo = options.gitInfo().isPresent()
                ? options.gitInfo().get()
                : new GitInfoReader(options.toolkitDir()).read();
        log.info("Using roc-toolkit {} ({})", gitInfo.tag(), gitInfo.commit());

        ApiRoot apiRoot = new DoxygenParser(options.doxygenDir()).parse(gitInfo);

        for (Map.Entry<Target, GeneratedFileWriter> entry : writers.entrySet()) {
            Generator generator = generator(entry.getKey(), apiRoot);
            List<GeneratedFile> files = generator.generateFiles();
            log.info("Writing {} {} files", files.size(), generator.target());
            entry.getValue().write(files);
        }
    }

    private Map<Target, GeneratedFileWriter> writers() {
        Map<Target, GeneratedFileWriter> writers = new LinkedHashMap<>();
        if (options.target().includes(Target.JAVA)) {
            writers.put(Target.JAVA, new GeneratedFileWriter(options.javaOutputDir()));
        }
        if (options.target().includes(Target.GO)) {
            writers.put(Target.GO, new GeneratedFileWriter(options.goOutputDir()));
        }
        return writers;
    }

    /**
     * Creates the generator of a single target.
     */
    static Generator generator(Target target, ApiRoot apiRoot) {
        return switch (target) {
            case JAVA -> new JavaGenerator(apiRoot);
            case GO -> new GoGenerator(apiRoot);
            case ALL -> throw new IllegalArgumentException("Not a single target: " + target);
        };
    }
}
