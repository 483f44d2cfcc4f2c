package work.snakeunit.api;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.snakeunit.dag.ProbeExecutor;
import work.snakeunit.dag.RuleProbe;
import work.snakeunit.execlog.ExecutionLogParser;
import work.snakeunit.execlog.SolvedWorkflow;
import work.snakeunit.shared.Diagnostics;
import work.snakeunit.synth.SynthesisSettings;
import work.snakeunit.synth.WorkspaceSynthesizer;
import work.snakeunit.workflow.WorkflowDocument;
import work.snakeunit.workflow.WorkflowResolver;

/**
 * Public entry point: loads the workflow and the execution log, then emits one test workspace
 * per executed rule.
 */
public final class TestGenerator {
    private static final Logger logger = LoggerFactory.getLogger(TestGenerator.class);
    static final String PHONY_RULE = "all";

    private final ProbeExecutor probeExecutor;

    public TestGenerator() {
        this(null);
    }

    /**
     * @param probeExecutor executor for the missing-rule probe; null launches the configured
     *     snakemake executable
     */
    public TestGenerator(ProbeExecutor probeExecutor) {
        this.probeExecutor = probeExecutor;
    }

    public GenerationResult run(TestGenerationConfiguration configuration) {
        var started = Instant.now();
        var diagnostics = new Diagnostics();
        try {
            Set<String> exclusions = new LinkedHashSet<>(configuration.excludedRules());
            exclusions.add(PHONY_RULE);

            WorkflowDocument document = new WorkflowResolver(diagnostics)
                .loadEverything(configuration.snakefile(), exclusions);
            if (configuration.verbose()) {
                logger.debug("flattened workflow:\n{}", document.render());
            }
            SolvedWorkflow solved = new ExecutionLogParser(diagnostics).load(configuration.snakemakeLog());

            Files.createDirectories(configuration.outputTestDir());
            if (configuration.probeMissingRules()) {
                var executor = probeExecutor != null
                    ? probeExecutor
                    : RuleProbe.processExecutor(configuration.snakemakeExec());
                exclusions.addAll(new RuleProbe(executor).findMissingRules(
                    document,
                    configuration.outputTestDir(),
                    configuration.pipelineTopDir().resolve(configuration.pipelineRunDir())
                ));
            }

            var settings = new SynthesisSettings(
                configuration.outputTestDir(),
                configuration.pipelineTopDir(),
                configuration.pipelineRunDir(),
                snakefileRelativePath(configuration),
                configuration.instDir(),
                exclusions,
                configuration.addedFiles(),
                configuration.addedDirectories(),
                configuration.comparisonExclusions(),
                configuration.includeEntireDag(),
                configuration.updates()
            );
            List<String> tests = new WorkspaceSynthesizer(document, solved, settings, diagnostics).emitTests();

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("snakefile", configuration.snakefile().toString());
            metadata.put("snakemakeLog", configuration.snakemakeLog().toString());
            metadata.put("outputTestDir", configuration.outputTestDir().toString());
            metadata.put("rules", document.ruleNames().size());
            metadata.put("recipes", solved.size());
            metadata.put("tests", tests);
            metadata.put("excluded", List.copyOf(exclusions));
            return GenerationResult.success(metadata, diagnostics.warnings(), started);
        } catch (Exception ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("snakefile", configuration.snakefile().toString());
            if (Boolean.getBoolean("snakeunit.debug")) {
                logger.error("test generation failed", ex);
            }
            return GenerationResult.failure(ex, errorMeta, diagnostics.warnings(), started);
        }
    }

    static Path snakefileRelativePath(TestGenerationConfiguration configuration) {
        Path top = configuration.pipelineTopDir().toAbsolutePath().normalize();
        Path snakefile = configuration.snakefile().toAbsolutePath().normalize();
        if (!snakefile.startsWith(top)) {
            throw new IllegalArgumentException(
                "snakefile " + snakefile + " is not inside pipeline directory " + top
            );
        }
        return top.relativize(snakefile);
    }
}
