package work.snakeunit.cli;

import java.util.List;

/**
 * Values read from a {@code --config} file. Absent keys are null (scalars) or empty (lists).
 */
record ConfigFile(
    String snakefile,
    String pipelineDir,
    String pipelineRunDir,
    String snakemakeLog,
    String outputTestDir,
    String instDir,
    List<String> excludeRules,
    List<String> addedFiles,
    List<String> addedDirectories,
    List<String> comparisonExclusions,
    Boolean includeEntireDag,
    List<String> update
) {
    static final List<String> KEYS = List.of(
        "snakefile",
        "pipeline-dir",
        "pipeline-run-dir",
        "snakemake-log",
        "output-test-dir",
        "inst-dir",
        "exclude-rules",
        "added-files",
        "added-directories",
        "comparison-exclusions",
        "include-entire-dag",
        "update"
    );

    static ConfigFile empty() {
        return new ConfigFile(null, null, null, null, null, null, List.of(), List.of(), List.of(), List.of(), null, List.of());
    }
}
