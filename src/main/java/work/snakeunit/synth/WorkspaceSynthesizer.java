package work.snakeunit.synth;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.snakeunit.dag.DependencyResolver;
import work.snakeunit.execlog.Recipe;
import work.snakeunit.execlog.SolvedWorkflow;
import work.snakeunit.shared.ContentStager;
import work.snakeunit.shared.Diagnostics;
import work.snakeunit.workflow.WorkflowDocument;

/**
 * Writes one self-contained test workspace per executed rule.
 *
 * <p>Layout under the output directory:
 * <pre>
 * unit/&lt;rule&gt;/workspace/   pruned snakefile, staged inputs, added content
 * unit/&lt;rule&gt;/expected/    staged outputs
 * unit/test_&lt;rule&gt;.py
 * unit/common.py
 * pytest_runner.bash
 * </pre>
 */
public final class WorkspaceSynthesizer {
    private static final Logger logger = LoggerFactory.getLogger(WorkspaceSynthesizer.class);
    static final String UNIT_DIRECTORY = "unit";
    static final String WORKSPACE_DIRECTORY = "workspace";
    static final String EXPECTED_DIRECTORY = "expected";
    static final String PHONY_TARGET = "all";

    private final WorkflowDocument document;
    private final SolvedWorkflow solved;
    private final DependencyResolver dependencies;
    private final SynthesisSettings settings;
    private final Diagnostics diagnostics;

    public WorkspaceSynthesizer(
        WorkflowDocument document,
        SolvedWorkflow solved,
        SynthesisSettings settings,
        Diagnostics diagnostics
    ) {
        this.document = Objects.requireNonNull(document, "document");
        this.solved = Objects.requireNonNull(solved, "solved");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.dependencies = new DependencyResolver(solved);
    }

    /**
     * Emits a workspace for the first recipe of every rule that is not excluded, in log order.
     *
     * @return names of the rules a test was emitted for
     */
    public List<String> emitTests() {
        Path unitDir = settings.outputTestDir().resolve(UNIT_DIRECTORY);
        createDirectories(unitDir);
        Set<String> emitted = new LinkedHashSet<>();
        for (Recipe recipe : solved.recipes()) {
            String name = recipe.ruleName();
            if (settings.excludedRules().contains(name) || PHONY_TARGET.equals(name) || emitted.contains(name)) {
                continue;
            }
            createWorkspace(recipe, unitDir);
            emitted.add(name);
        }
        if (settings.updates(UpdateMode.PYTEST)) {
            copy(settings.instDir().resolve(TemplateRenderer.SUPPORT_SCRIPT), unitDir.resolve(TemplateRenderer.SUPPORT_SCRIPT));
            TemplateRenderer.writeLauncher(
                settings.outputTestDir(),
                settings.outputTestDir().toAbsolutePath().normalize(),
                settings.instDir().resolve(TemplateRenderer.LAUNCHER_TEMPLATE)
            );
        }
        logger.info("emitted {} test(s) under {}", emitted.size(), unitDir);
        return new ArrayList<>(emitted);
    }

    void createWorkspace(Recipe recipe, Path unitDir) {
        String name = recipe.ruleName();
        boolean full = settings.includeEntireDag() || dependencies.isCheckpointDependent(recipe);
        Set<Recipe> closure = dependencies.dependencyClosure(recipe, full);
        logger.debug("rule {}: {} dependenc(ies), {} closure", name, closure.size(), full ? "full" : "shallow");

        Path ruleDir = unitDir.resolve(name);
        Path workspace = ruleDir.resolve(WORKSPACE_DIRECTORY);
        Path expected = ruleDir.resolve(EXPECTED_DIRECTORY);
        Path runSource = settings.pipelineTopDir().resolve(settings.pipelineRunDir());
        createDirectories(workspace);

        if (settings.updates(UpdateMode.SNAKEFILES)) {
            emitSnakefile(workspace.resolve(settings.snakefileRelativePath()), recipe, closure);
        }
        if (settings.updates(UpdateMode.ADDED_CONTENT)) {
            ContentStager.copyContents(settings.addedFiles(), settings.pipelineTopDir(), workspace, name);
            ContentStager.copyContents(settings.addedDirectories(), settings.pipelineTopDir(), workspace, name);
        }
        if (settings.updates(UpdateMode.INPUTS)) {
            Set<Path> inputs = new LinkedHashSet<>(recipe.inputs());
            if (full) {
                closure.forEach(dependency -> inputs.addAll(dependency.inputs()));
            }
            ContentStager.copyContents(
                stageable(inputs, name, "input"),
                runSource,
                workspace.resolve(settings.pipelineRunDir()),
                name
            );
        }
        if (settings.updates(UpdateMode.OUTPUTS)) {
            createDirectories(expected);
            ContentStager.copyContents(
                stageable(recipe.outputs(), name, "output"),
                runSource,
                expected.resolve(settings.pipelineRunDir()),
                name
            );
        }
        if (settings.updates(UpdateMode.PYTEST)) {
            TemplateRenderer.writeTestScript(
                unitDir,
                settings.outputTestDir(),
                name,
                settings.snakefileRelativePath(),
                settings.pipelineRunDir(),
                settings.comparisonExclusions(),
                settings.instDir().resolve(TemplateRenderer.TEST_TEMPLATE)
            );
        }
    }

    /**
     * Writes the workflow with only {@code recipe} and its closure kept, followed by a top-level
     * phony target over every output they produce.
     */
    void emitSnakefile(Path target, Recipe recipe, Collection<Recipe> closure) {
        Set<String> keep = new LinkedHashSet<>();
        Set<Path> targets = new LinkedHashSet<>();
        for (Recipe dependency : closure) {
            keep.add(dependency.ruleName());
            targets.addAll(dependency.outputs());
        }
        keep.add(recipe.ruleName());
        keep.remove(PHONY_TARGET);
        targets.addAll(recipe.outputs());

        StringBuilder out = new StringBuilder(document.renderWithPlaceholders(keep));
        out.append(renderPhonyAll(targets));
        createDirectories(target.getParent());
        try {
            Files.writeString(target, out.toString(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write snakefile: " + target, ex);
        }
    }

    static String renderPhonyAll(Collection<Path> targets) {
        StringBuilder out = new StringBuilder("\n").append("rule ").append(PHONY_TARGET).append(":\n");
        out.append("    input:\n");
        for (Path target : targets) {
            out.append("        \"").append(target.toString().replace('\\', '/')).append("\",\n");
        }
        return out.append("\n\n").toString();
    }

    private List<Path> stageable(Collection<Path> paths, String ruleName, String category) {
        List<Path> relative = new ArrayList<>();
        for (Path path : paths) {
            if (path.isAbsolute()) {
                diagnostics.warn(
                    "rule \"" + ruleName + "\" has absolute " + category + " path \"" + path
                        + "\"; it is not staged into the test workspace"
                );
                continue;
            }
            relative.add(path);
        }
        return relative;
    }

    private static void createDirectories(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to create directory: " + directory, ex);
        }
    }

    private static void copy(Path source, Path target) {
        try {
            ContentStager.copyFile(source, target);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to copy " + source + " to " + target, ex);
        }
    }
}
