package work.snakeunit.synth;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Instantiates the pytest and launcher script templates shipped in the installation directory.
 */
public final class TemplateRenderer {
    static final String TEST_TEMPLATE = "test.py";
    static final String SUPPORT_SCRIPT = "common.py";
    static final String LAUNCHER_TEMPLATE = "pytest_runner.bash";
    static final String LAUNCHER_VARIABLE = "SNAKEMAKE_UNIT_TESTS_DIR";

    private TemplateRenderer() {}

    /**
     * Writes {@code <unitDir>/test_<ruleName>.py}: a block of variable assignments followed by
     * the template body, unchanged.
     */
    public static Path writeTestScript(
        Path unitDir,
        Path testDir,
        String ruleName,
        Path snakefileRelativePath,
        Path pipelineRunDir,
        List<String> comparisonExclusions,
        Path template
    ) {
        Path target = unitDir.resolve("test_" + ruleName + ".py");
        List<String> lines = new ArrayList<>();
        lines.add("#!/usr/bin/env python3");
        lines.add("unit_test_dir='" + unitDir + "'");
        lines.add("testdir='" + testDir + "'");
        lines.add("rulename='" + ruleName + "'");
        lines.add("snakefile_relative_path='" + snakefileRelativePath + "'");
        lines.add("snakemake_exec_path='" + pipelineRunDir + "'");
        lines.add("extra_comparison_exclusions=" + pythonList(comparisonExclusions));
        lines.addAll(readTemplate(template));
        write(target, lines);
        return target;
    }

    /**
     * Writes {@code <targetDir>/pytest_runner.bash}, inserting the test directory binding after
     * the template's first line.
     */
    public static Path writeLauncher(Path targetDir, Path testDir, Path template) {
        if (!Files.isDirectory(targetDir)) {
            throw new IllegalStateException("launcher target directory does not exist: " + targetDir);
        }
        List<String> body = readTemplate(template);
        List<String> lines = new ArrayList<>();
        if (!body.isEmpty()) {
            lines.add(body.get(0));
        }
        lines.add(LAUNCHER_VARIABLE + "=" + testDir);
        if (body.size() > 1) {
            lines.addAll(body.subList(1, body.size()));
        }
        Path target = targetDir.resolve(LAUNCHER_TEMPLATE);
        write(target, lines);
        target.toFile().setExecutable(true);
        return target;
    }

    static String pythonList(List<String> values) {
        if (values.isEmpty()) {
            return "[]";
        }
        StringBuilder out = new StringBuilder("[");
        for (String value : values) {
            out.append('\'').append(value).append("', ");
        }
        return out.append(']').toString();
    }

    private static List<String> readTemplate(Path template) {
        if (!Files.isRegularFile(template)) {
            throw new IllegalStateException("cannot find template file: " + template);
        }
        try {
            return Files.readAllLines(template, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read template: " + template, ex);
        }
    }

    private static void write(Path target, List<String> lines) {
        try {
            Files.write(target, lines, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write " + target, ex);
        }
    }
}
