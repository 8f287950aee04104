package ai.policyatlas.cli;

import ai.policyatlas.AtlasSettings;
import ai.policyatlas.PolicyAtlas;
import ai.policyatlas.exception.NoSourceFilesException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@SuppressWarnings("NullAway.Init") // fields are populated by picocli before call()
@CommandLine.Command(
        name = "policy-atlas",
        mixinStandardHelpOptions = true,
        description = "Converts ADMX/ADML policy templates into one browsable data file per language.")
public final class AtlasCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(AtlasCli.class);

    static final int EXIT_NO_SOURCES = 1;
    static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;

    @CommandLine.Option(
            names = "--source",
            required = true,
            description = "Template root: .admx files, plus one directory of .adml files per language.")
    private Path sourceRoot;

    @CommandLine.Option(
            names = "--output",
            description = "Directory the data files are written to. Defaults to the working directory.")
    private Path outputDir = Path.of(".");

    @CommandLine.Option(
            names = "--languages",
            split = ",",
            description = "Languages to generate, e.g. en-US,de-DE. Overrides the configured list.")
    private List<String> languages = new ArrayList<>();

    @CommandLine.Option(
            names = "--max-depth",
            description = "Maximum JSON nesting depth; a language whose records nest deeper is not written.")
    @Nullable
    private Integer maxDepth;

    @CommandLine.Option(names = "--config", description = "Properties file overriding the bundled defaults.")
    @Nullable
    private Path configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return new CommandLine(new AtlasCli()).execute(args);
    }

    @Override
    public Integer call() {
        AtlasSettings settings;
        try {
            settings = AtlasSettings.load(configFile);
            if (!languages.isEmpty()) {
                settings.withLanguages(languages);
            }
            if (maxDepth != null) {
                settings.withMaxDepth(maxDepth);
            }
            settings.maxDepth();
        } catch (IOException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("Error: invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (settings.languages().isEmpty()) {
            spec.commandLine().getErr().println("Error: no languages configured.");
            return EXIT_USAGE;
        }

        try {
            var report = new PolicyAtlas(settings).run(sourceRoot, outputDir);
            report.written().forEach((language, file) -> spec.commandLine()
                    .getOut()
                    .println(language + " -> " + file));
            if (!report.allLanguagesWritten()) {
                logger.warn("Skipped {}, failed {}", report.skipped(), report.failed().keySet());
            }
            return CommandLine.ExitCode.OK;
        } catch (NoSourceFilesException e) {
            logger.error(e.getMessage());
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return EXIT_NO_SOURCES;
        }
    }
}
