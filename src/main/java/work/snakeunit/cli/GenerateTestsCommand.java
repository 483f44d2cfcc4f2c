package work.snakeunit.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import picocli.CommandLine;
import work.snakeunit.api.GenerationResult;
import work.snakeunit.api.LogLevel;
import work.snakeunit.api.TestGenerationConfiguration;
import work.snakeunit.api.TestGenerator;
import work.snakeunit.synth.UpdateMode;

@CommandLine.Command(
    name = "snakeunit",
    description = "Generate per-rule pytest workspaces from a snakemake pipeline and the log of a run.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class GenerateTestsCommand implements Callable<Integer> {
    static final String DEFAULT_SNAKEFILE = "workflow/Snakefile";
    static final String DEFAULT_OUTPUT_DIR = ".tests";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "YAML or TOML file with default values for the options below.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = {"-s", "--snakefile"},
        description = "Top-level snakefile of the pipeline (default: " + DEFAULT_SNAKEFILE + ").",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path snakefile;

    @CommandLine.Option(
        names = {"-p", "--pipeline-dir"},
        description = "Top-level pipeline directory (default: two levels above the snakefile).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path pipelineDir;

    @CommandLine.Option(
        names = {"-r", "--pipeline-run-dir"},
        description = "Directory the pipeline was run in, relative to the pipeline directory (default: .).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path pipelineRunDir;

    @CommandLine.Option(
        names = {"-l", "--snakemake-log"},
        description = "Log of a snakemake run of the pipeline.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path snakemakeLog;

    @CommandLine.Option(
        names = {"-o", "--output-test-dir"},
        description = "Directory to write tests to (default: " + DEFAULT_OUTPUT_DIR + ").",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path outputTestDir;

    @CommandLine.Option(
        names = {"-i", "--inst-dir"},
        description = "Directory holding test.py, common.py and pytest_runner.bash.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path instDir;

    @CommandLine.Option(
        names = {"-e", "--exclude-rules"},
        description = "Rules not to generate tests for.",
        split = ","
    )
    private List<String> excludeRules = new ArrayList<>();

    @CommandLine.Option(
        names = {"-f", "--added-files"},
        description = "Files, relative to the pipeline directory, to copy into every workspace.",
        split = ","
    )
    private List<Path> addedFiles = new ArrayList<>();

    @CommandLine.Option(
        names = {"-d", "--added-directories"},
        description = "Directories, relative to the pipeline directory, to copy into every workspace.",
        split = ","
    )
    private List<Path> addedDirectories = new ArrayList<>();

    @CommandLine.Option(
        names = {"-x", "--comparison-exclusions"},
        description = "File suffixes the generated tests do not compare.",
        split = ","
    )
    private List<String> comparisonExclusions = new ArrayList<>();

    @CommandLine.Option(
        names = "--include-entire-dag",
        description = "Keep every upstream rule in each test snakefile, not only direct producers."
    )
    private boolean includeEntireDag;

    @CommandLine.Option(
        names = "--probe-missing-rules",
        description = "Dry-run snakemake to skip rules it does not define."
    )
    private boolean probeMissingRules;

    @CommandLine.Option(
        names = "--snakemake-exec",
        description = "Snakemake executable used by --probe-missing-rules.",
        defaultValue = "snakemake"
    )
    private String snakemakeExec;

    @CommandLine.Option(
        names = {"-u", "--update"},
        description = "Content to refresh (all|snakefiles|added-content|inputs|outputs|pytest; default: all).",
        split = ","
    )
    private List<String> update = new ArrayList<>();

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log debug output, including the flattened workflow."
    )
    private boolean verbose;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        LogLevel logLevel = resolveLogLevel();
        logLevel.apply();

        TestGenerationConfiguration configuration;
        try {
            configuration = buildConfiguration(logLevel);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
        }

        GenerationResult result = new TestGenerator().run(configuration);
        result.error().ifPresent(error ->
            spec.commandLine().getErr().println(spec.commandLine().getColorScheme().errorText(error))
        );
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }

    TestGenerationConfiguration buildConfiguration(LogLevel logLevel) {
        ConfigFile file = config != null
            ? ConfigFileLoader.load(ParameterChecks.requireRegularFile(config, "--config"))
            : ConfigFile.empty();
        Path fileBase = config != null ? config.toAbsolutePath().normalize().getParent() : null;

        Path resolvedSnakefile = pick(snakefile, file.snakefile(), fileBase, DEFAULT_SNAKEFILE).toAbsolutePath().normalize();
        ParameterChecks.requireRegularFile(resolvedSnakefile, "--snakefile");

        Path resolvedPipelineDir = pipelineDir != null
            ? pipelineDir
            : file.pipelineDir() != null ? againstConfig(fileBase, file.pipelineDir()) : defaultPipelineDir(resolvedSnakefile);
        resolvedPipelineDir = ParameterChecks.requireDirectory(resolvedPipelineDir.toAbsolutePath().normalize(), "--pipeline-dir");

        Path resolvedRunDir = pick(pipelineRunDir, file.pipelineRunDir(), null, ".");
        if (resolvedRunDir.isAbsolute()) {
            throw new IllegalArgumentException("--pipeline-run-dir must be relative to the pipeline directory: " + resolvedRunDir);
        }
        ParameterChecks.requireDirectory(resolvedPipelineDir.resolve(resolvedRunDir), "--pipeline-run-dir");

        Path resolvedLog = pick(snakemakeLog, file.snakemakeLog(), fileBase, null);
        if (resolvedLog == null) {
            throw new IllegalArgumentException("--snakemake-log is required");
        }
        ParameterChecks.requireRegularFile(resolvedLog, "--snakemake-log");

        Path resolvedInstDir = pick(instDir, file.instDir(), fileBase, null);
        if (resolvedInstDir == null) {
            throw new IllegalArgumentException("--inst-dir is required");
        }
        ParameterChecks.requireInstallation(resolvedInstDir);

        List<Path> files = merge(file.addedFiles().stream().map(Paths::get).collect(Collectors.toList()), addedFiles);
        List<Path> directories = merge(
            file.addedDirectories().stream().map(Paths::get).collect(Collectors.toList()),
            addedDirectories
        );
        ParameterChecks.requireRelativeContent(files, resolvedPipelineDir, false, "--added-files");
        ParameterChecks.requireRelativeContent(directories, resolvedPipelineDir, true, "--added-directories");

        Set<String> exclusions = new LinkedHashSet<>(merge(file.excludeRules(), excludeRules));
        Set<UpdateMode> updates = EnumSet.noneOf(UpdateMode.class);
        for (String mode : merge(file.update(), update)) {
            updates.add(UpdateMode.from(mode));
        }
        if (updates.isEmpty()) {
            updates.add(UpdateMode.ALL);
        }

        return TestGenerationConfiguration.builder()
            .snakefile(resolvedSnakefile)
            .pipelineTopDir(resolvedPipelineDir)
            .pipelineRunDir(resolvedRunDir)
            .snakemakeLog(resolvedLog.toAbsolutePath().normalize())
            .outputTestDir(pick(outputTestDir, file.outputTestDir(), fileBase, DEFAULT_OUTPUT_DIR).toAbsolutePath().normalize())
            .instDir(resolvedInstDir.toAbsolutePath().normalize())
            .excludedRules(exclusions)
            .addedFiles(files)
            .addedDirectories(directories)
            .comparisonExclusions(merge(file.comparisonExclusions(), comparisonExclusions))
            .includeEntireDag(includeEntireDag || Boolean.TRUE.equals(file.includeEntireDag()))
            .probeMissingRules(probeMissingRules)
            .snakemakeExec(snakemakeExec)
            .updates(updates)
            .verbose(verbose)
            .logLevel(logLevel)
            .build();
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("SNAKEUNIT_LOG_LEVEL");
        }
        if ((candidate == null || candidate.isBlank()) && verbose) {
            candidate = "debug";
        }
        return LogLevel.from(candidate);
    }

    private static Path defaultPipelineDir(Path snakefile) {
        Path parent = snakefile.getParent();
        Path grandparent = parent != null ? parent.getParent() : null;
        return grandparent != null ? grandparent : Paths.get("").toAbsolutePath();
    }

    /**
     * Command line values win over config file values, which win over the fallback. Relative config
     * file values are taken from the config file's directory when {@code fileBase} is set.
     */
    private static Path pick(Path cli, String fromFile, Path fileBase, String fallback) {
        if (cli != null) {
            return cli;
        }
        if (fromFile != null && !fromFile.isBlank()) {
            return againstConfig(fileBase, fromFile);
        }
        return fallback != null ? Paths.get(fallback) : null;
    }

    private static Path againstConfig(Path fileBase, String value) {
        Path path = Paths.get(value);
        return fileBase == null || path.isAbsolute() ? path : fileBase.resolve(path);
    }

    private static <T> List<T> merge(List<T> fromFile, List<T> cli) {
        List<T> merged = new ArrayList<>(fromFile);
        for (T value : cli) {
            if (!merged.contains(value)) {
                merged.add(value);
            }
        }
        return merged;
    }
}
