package work.snakeunit.api;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.snakeunit.synth.UpdateMode;

/**
 * Immutable, validated configuration for one test generation run.
 *
 * @param pipelineTopDir parent of the pipeline, e.g. {@code X} for {@code X/workflow/Snakefile}
 * @param pipelineRunDir directory the pipeline was run in, relative to {@code pipelineTopDir}
 * @param instDir directory holding the {@code test.py}, {@code common.py} and
 *     {@code pytest_runner.bash} templates
 */
public record TestGenerationConfiguration(
    Path snakefile,
    Path pipelineTopDir,
    Path pipelineRunDir,
    Path snakemakeLog,
    Path outputTestDir,
    Path instDir,
    Set<String> excludedRules,
    List<Path> addedFiles,
    List<Path> addedDirectories,
    List<String> comparisonExclusions,
    boolean includeEntireDag,
    boolean probeMissingRules,
    String snakemakeExec,
    Set<UpdateMode> updates,
    boolean verbose,
    LogLevel logLevel
) {
    public TestGenerationConfiguration {
        Objects.requireNonNull(snakefile, "snakefile");
        Objects.requireNonNull(pipelineTopDir, "pipelineTopDir");
        Objects.requireNonNull(pipelineRunDir, "pipelineRunDir");
        Objects.requireNonNull(snakemakeLog, "snakemakeLog");
        Objects.requireNonNull(outputTestDir, "outputTestDir");
        Objects.requireNonNull(instDir, "instDir");
        Objects.requireNonNull(snakemakeExec, "snakemakeExec");
        Objects.requireNonNull(logLevel, "logLevel");
        excludedRules = Set.copyOf(excludedRules);
        addedFiles = List.copyOf(addedFiles);
        addedDirectories = List.copyOf(addedDirectories);
        comparisonExclusions = List.copyOf(comparisonExclusions);
        updates = updates.isEmpty() ? Set.of(UpdateMode.ALL) : Set.copyOf(updates);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path snakefile;
        private Path pipelineTopDir;
        private Path pipelineRunDir = Paths.get(".");
        private Path snakemakeLog;
        private Path outputTestDir = Paths.get(".tests");
        private Path instDir;
        private Set<String> excludedRules = new LinkedHashSet<>();
        private List<Path> addedFiles = List.of();
        private List<Path> addedDirectories = List.of();
        private List<String> comparisonExclusions = List.of();
        private boolean includeEntireDag;
        private boolean probeMissingRules;
        private String snakemakeExec = "snakemake";
        private Set<UpdateMode> updates = EnumSet.of(UpdateMode.ALL);
        private boolean verbose;
        private LogLevel logLevel = LogLevel.INFO;

        public Builder snakefile(Path snakefile) {
            this.snakefile = snakefile;
            return this;
        }

        public Builder pipelineTopDir(Path pipelineTopDir) {
            this.pipelineTopDir = pipelineTopDir;
            return this;
        }

        public Builder pipelineRunDir(Path pipelineRunDir) {
            this.pipelineRunDir = pipelineRunDir;
            return this;
        }

        public Builder snakemakeLog(Path snakemakeLog) {
            this.snakemakeLog = snakemakeLog;
            return this;
        }

        public Builder outputTestDir(Path outputTestDir) {
            this.outputTestDir = outputTestDir;
            return this;
        }

        public Builder instDir(Path instDir) {
            this.instDir = instDir;
            return this;
        }

        public Builder excludedRules(Set<String> excludedRules) {
            this.excludedRules = excludedRules;
            return this;
        }

        public Builder addedFiles(List<Path> addedFiles) {
            this.addedFiles = addedFiles;
            return this;
        }

        public Builder addedDirectories(List<Path> addedDirectories) {
            this.addedDirectories = addedDirectories;
            return this;
        }

        public Builder comparisonExclusions(List<String> comparisonExclusions) {
            this.comparisonExclusions = comparisonExclusions;
            return this;
        }

        public Builder includeEntireDag(boolean includeEntireDag) {
            this.includeEntireDag = includeEntireDag;
            return this;
        }

        public Builder probeMissingRules(boolean probeMissingRules) {
            this.probeMissingRules = probeMissingRules;
            return this;
        }

        public Builder snakemakeExec(String snakemakeExec) {
            this.snakemakeExec = snakemakeExec;
            return this;
        }

        public Builder updates(Set<UpdateMode> updates) {
            this.updates = updates;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public TestGenerationConfiguration build() {
            return new TestGenerationConfiguration(
                snakefile,
                pipelineTopDir,
                pipelineRunDir,
                snakemakeLog,
                outputTestDir,
                instDir,
                excludedRules,
                addedFiles,
                addedDirectories,
                comparisonExclusions,
                includeEntireDag,
                probeMissingRules,
                snakemakeExec,
                updates,
                verbose,
                logLevel
            );
        }
    }
}
