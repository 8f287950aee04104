package ai.policyatlas;

import ai.policyatlas.analyzer.DefinitionCollector;
import ai.policyatlas.analyzer.HierarchyResolver;
import ai.policyatlas.analyzer.IPolicyGraph;
import ai.policyatlas.analyzer.SourceTree;
import ai.policyatlas.diagnostics.DiagnosticKind;
import ai.policyatlas.diagnostics.DiagnosticLog;
import ai.policyatlas.exception.NoSourceFilesException;
import ai.policyatlas.projection.AdmlResourceLoader;
import ai.policyatlas.projection.LanguageProjector;
import ai.policyatlas.projection.RecordSetWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the conversion: collect definitions, link the hierarchy once, then project and write every requested language.
 *
 * <p>Only an empty source tree stops the run. Everything else is recorded in the run's {@link DiagnosticLog} and
 * summarized when the run ends.
 */
public final class PolicyAtlas {
    private static final Logger logger = LogManager.getLogger(PolicyAtlas.class);

    private final AtlasSettings settings;
    private final DiagnosticLog diagnostics = new DiagnosticLog();

    public PolicyAtlas(AtlasSettings settings) {
        this.settings = settings;
    }

    public DiagnosticLog diagnostics() {
        return diagnostics;
    }

    /** Builds the language-neutral graph of {@code tree}. */
    public IPolicyGraph buildGraph(SourceTree tree) {
        var files = tree.definitionFiles();
        if (files.isEmpty()) {
            throw new NoSourceFilesException(tree.getRoot(), tree.definitionExtension());
        }
        var collected = new DefinitionCollector(diagnostics).collect(files);
        var graph = new HierarchyResolver(diagnostics).resolve(collected);
        logger.info("Built graph: {}", graph.getMetrics());
        return graph;
    }

    public RunReport run(Path sourceRoot, Path outputDir) {
        var tree = new SourceTree(sourceRoot, settings.definitionExtension(), settings.resourceExtension());
        var graph = buildGraph(tree);

        var loader = new AdmlResourceLoader(diagnostics);
        var projector = new LanguageProjector(diagnostics);
        var writer = new RecordSetWriter(outputDir, settings.filePrefix(), settings.maxDepth());

        var written = new LinkedHashMap<String, Path>();
        var skipped = new ArrayList<String>();
        var failed = new LinkedHashMap<String, String>();
        for (var language : settings.languages()) {
            var resourceFiles = tree.resourceFiles(language);
            if (resourceFiles.isEmpty()) {
                diagnostics.report(
                        DiagnosticKind.MISSING_LANGUAGE_RESOURCES,
                        language,
                        "no ." + settings.resourceExtension() + " files; language skipped");
                skipped.add(language);
                continue;
            }
            var resources = loader.load(language, resourceFiles, graph);
            var records = projector.project(graph, resources);
            try {
                written.put(language, writer.write(records));
            } catch (IOException e) {
                logger.error("Failed to write {}", writer.fileFor(language), e);
                failed.put(language, e.getMessage());
            }
        }

        diagnostics.logSummary();
        logger.info(
                "Wrote {} of {} languages to {}", written.size(), settings.languages().size(), outputDir);
        return new RunReport(graph.getMetrics(), written, skipped, failed, diagnostics.all());
    }
}
