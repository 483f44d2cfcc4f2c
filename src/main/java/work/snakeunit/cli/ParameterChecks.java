package work.snakeunit.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Path checks applied to command-line and config-file values before a run starts.
 */
final class ParameterChecks {
    static final List<String> INSTALLED_TEMPLATES = List.of("test.py", "common.py", "pytest_runner.bash");

    private ParameterChecks() {}

    static Path requireRegularFile(Path path, String option) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException(option + " does not name a regular file: " + path);
        }
        return path;
    }

    static Path requireDirectory(Path path, String option) {
        if (!Files.isDirectory(path)) {
            throw new IllegalArgumentException(option + " does not name a directory: " + path);
        }
        return path;
    }

    static Path requireInstallation(Path instDir) {
        requireDirectory(instDir, "--inst-dir");
        for (String template : INSTALLED_TEMPLATES) {
            if (!Files.isRegularFile(instDir.resolve(template))) {
                throw new IllegalArgumentException("--inst-dir " + instDir + " is missing \"" + template + "\"");
            }
        }
        return instDir;
    }

    /**
     * Checks that every entry exists relative to {@code pipelineDir}.
     */
    static List<Path> requireRelativeContent(List<Path> entries, Path pipelineDir, boolean directories, String option) {
        for (Path entry : entries) {
            if (entry.isAbsolute()) {
                throw new IllegalArgumentException(option + " entries must be relative to the pipeline directory: " + entry);
            }
            Path resolved = pipelineDir.resolve(entry);
            boolean present = directories ? Files.isDirectory(resolved) : Files.isRegularFile(resolved);
            if (!present) {
                throw new IllegalArgumentException(
                    option + " entry not found in pipeline directory: " + resolved
                );
            }
        }
        return entries;
    }
}
