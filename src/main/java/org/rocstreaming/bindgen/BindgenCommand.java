package org.rocstreaming.bindgen;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command line entry point.
 *
 * <p><b>Exit codes:</b>
 * <ul>
 *   <li>{@code 0} - bindings generated</li>
 *   <li>{@code 1} - missing or malformed input, missing output directory, git failure</li>
 *   <li>{@code 2} - invalid command line</li>
 * </ul>
 */
@Command(
        name = "bindgen",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = {
                "Generate roc-java and roc-go sources from roc-toolkit Doxygen XML.",
                "",
                "Build the toolkit documentation first, e.g. with: scons -Q docs"
        }
)
public class BindgenCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BindgenCommand.class);

    static final int EXIT_FAILURE = 1;

    @Option(names = {"-t", "--type"}, required = true,
            description = "What to generate: ${COMPLETION-CANDIDATES}")
    Target target;

    @Option(names = "--toolkit-dir", defaultValue = "../roc-toolkit",
            description = "roc-toolkit checkout, relative to the working directory (default: ${DEFAULT-VALUE})")
    Path toolkitDir;

    @Option(names = "--doxygen-dir",
            description = "Doxygen XML directory (default: <toolkit-dir>/" + BindgenOptions.DEFAULT_DOXYGEN_SUBDIR + ")")
    Path doxygenDir;

    @Option(names = "--java-output-dir", defaultValue = "../roc-java",
            description = "roc-java checkout, relative to the working directory (default: ${DEFAULT-VALUE})")
    Path javaOutputDir;

    @Option(names = "--go-output-dir", defaultValue = "../roc-go",
            description = "roc-go checkout, relative to the working directory (default: ${DEFAULT-VALUE})")
    Path goOutputDir;

    @Option(names = "--git-tag", description = "roc-toolkit tag; skips querying git (needs --git-commit)")
    String gitTag;

    @Option(names = "--git-commit", description = "roc-toolkit short commit hash (needs --git-tag)")
    String gitCommit;

    @Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    boolean verbose;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME))
                    .setLevel(Level.DEBUG);
        }
        if ((gitTag == null) != (gitCommit == null)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--git-tag and --git-commit must be given together");
        }

        BindgenOptions options = new BindgenOptions(target, toolkitDir, doxygenDir,
                javaOutputDir, goOutputDir, gitTag, gitCommit);
        try {
            new Bindgen(options).run();
            return 0;
        } catch (BindgenException e) {
            log.error(e.getMessage());
            log.debug("Failure details", e);
            return EXIT_FAILURE;
        }
    }

    /**
     * Creates the command line with case-insensitive target names ({@code -t java}).
     */
    static CommandLine commandLine() {
        return new CommandLine(new BindgenCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
