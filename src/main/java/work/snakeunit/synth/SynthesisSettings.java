package work.snakeunit.synth;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Filesystem layout and toggles for one test emission run. Paths are expected to be validated.
 *
 * @param snakefileRelativePath top-level snakefile relative to {@code pipelineTopDir}
 * @param pipelineRunDir directory the pipeline ran in, relative to {@code pipelineTopDir}
 */
public record SynthesisSettings(
    Path outputTestDir,
    Path pipelineTopDir,
    Path pipelineRunDir,
    Path snakefileRelativePath,
    Path instDir,
    Set<String> excludedRules,
    List<Path> addedFiles,
    List<Path> addedDirectories,
    List<String> comparisonExclusions,
    boolean includeEntireDag,
    Set<UpdateMode> updates
) {
    public SynthesisSettings {
        Objects.requireNonNull(outputTestDir, "outputTestDir");
        Objects.requireNonNull(pipelineTopDir, "pipelineTopDir");
        Objects.requireNonNull(pipelineRunDir, "pipelineRunDir");
        Objects.requireNonNull(snakefileRelativePath, "snakefileRelativePath");
        Objects.requireNonNull(instDir, "instDir");
        excludedRules = Set.copyOf(excludedRules);
        addedFiles = List.copyOf(addedFiles);
        addedDirectories = List.copyOf(addedDirectories);
        comparisonExclusions = List.copyOf(comparisonExclusions);
        updates = Set.copyOf(updates);
    }

    public boolean updates(UpdateMode mode) {
        return UpdateMode.enabled(updates, mode);
    }
}
