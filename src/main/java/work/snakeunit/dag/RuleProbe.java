package work.snakeunit.dag;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.snakeunit.shared.ContentStager;
import work.snakeunit.workflow.Block;
import work.snakeunit.workflow.WorkflowDocument;

/**
 * Asks snakemake which of the parsed rules it actually defines. Rules hidden behind
 * conditional code parse fine but are absent at runtime; the probe snakefile touches every
 * parsed rule name and prints the attribute error for each one snakemake does not know.
 */
public final class RuleProbe {
    private static final Logger logger = LoggerFactory.getLogger(RuleProbe.class);
    static final String PROBE_RULE = "snakeunit_probe";
    static final String PROBE_DIRECTORY = ".probe";

    private final ProbeExecutor executor;

    public RuleProbe(ProbeExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Executor that launches {@code <snakemakeExec> -n -s <snakefile>} as a child process.
     */
    public static ProbeExecutor processExecutor(String snakemakeExec) {
        return (workingDirectory, snakefile) -> {
            Process process = new ProcessBuilder(snakemakeExec, "-n", "-s", snakefile.toString())
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true)
                .start();
            List<String> output = new ArrayList<>();
            try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)
            )) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.add(line);
                }
            }
            int exitCode = process.waitFor();
            logger.debug("snakemake probe exited with {}", exitCode);
            return new DryRun(exitCode, output);
        };
    }

    public static String renderProbeSnakefile(WorkflowDocument document) {
        StringBuilder out = new StringBuilder();
        out.append("rule ").append(PROBE_RULE).append(":\n    run:\n        pass\n\n\n");
        out.append(document.render());
        Set<String> seen = new LinkedHashSet<>();
        for (Block rule : document.rules()) {
            if (!seen.add(rule.ruleName())) {
                continue;
            }
            String collection = rule.isCheckpoint() ? "checkpoints" : "rules";
            out.append("try:\n")
                .append("    ").append(collection).append('.').append(rule.ruleName()).append('\n')
                .append("except AttributeError as ex:\n")
                .append("    print(\"Exception: {}\".format(ex))\n");
        }
        return out.toString();
    }

    /**
     * Writes the probe under {@code <outputDirectory>/.probe}, dry-runs it from
     * {@code workingDirectory} so that paths relative to the pipeline run resolve, and returns
     * the names snakemake did not recognize. The probe directory is removed afterwards.
     *
     * @throws IllegalStateException if the dry run exits with a nonzero status
     */
    public Set<String> findMissingRules(WorkflowDocument document, Path outputDirectory, Path workingDirectory) {
        Path probeDirectory = outputDirectory.resolve(PROBE_DIRECTORY);
        Path snakefile = probeDirectory.resolve("Snakefile").toAbsolutePath();
        Set<String> missing = new LinkedHashSet<>();
        try {
            Files.createDirectories(probeDirectory);
            Files.writeString(snakefile, renderProbeSnakefile(document), StandardCharsets.UTF_8);
            DryRun run = executor.dryRun(workingDirectory, snakefile);
            if (!run.succeeded()) {
                throw new IllegalStateException(
                    "snakemake dry run of rule probe failed with exit code " + run.exitCode() + " in "
                        + workingDirectory + ":\n" + String.join("\n", run.output())
                );
            }
            MissingRuleScanner.findMissingRules(run.output(), missing);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to run rule probe in " + workingDirectory, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running rule probe in " + workingDirectory, ex);
        } finally {
            cleanUp(probeDirectory);
        }
        if (!missing.isEmpty()) {
            logger.info("snakemake does not define {} parsed rule(s): {}", missing.size(), missing);
        }
        return missing;
    }

    private static void cleanUp(Path probeDirectory) {
        try {
            ContentStager.deleteRecursively(probeDirectory);
        } catch (IOException ex) {
            logger.warn("could not remove probe directory {}: {}", probeDirectory, ex.getMessage());
        }
    }
}
