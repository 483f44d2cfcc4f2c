package work.snakeunit.execlog;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.snakeunit.shared.Diagnostics;
import work.snakeunit.shared.PathLists;

/**
 * Reads the job sections of a snakemake execution log into a {@link SolvedWorkflow}.
 *
 * <p>A section starts with a {@code rule <name>:} or {@code checkpoint <name>:} line and
 * continues with indented {@code key: value} entries. Any other line ends the section.
 */
public final class ExecutionLogParser {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionLogParser.class);
    private static final Pattern SECTION_HEADER = Pattern.compile("^\\s*(local)?(rule|checkpoint)\\s+(\\S+?):\\s*$");
    private static final Pattern ENTRY = Pattern.compile("^\\s+([A-Za-z_]+):\\s?(.*)$");
    private static final Set<String> IGNORED_KEYS =
        Set.of("jobid", "wildcards", "benchmark", "resources", "threads", "priority", "reason");
    static final String UNRESOLVED_TOKEN = "<TBD>";

    private final Diagnostics diagnostics;

    public ExecutionLogParser(Diagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public SolvedWorkflow load(Path logFile) {
        try (BufferedReader reader = Files.newBufferedReader(logFile, StandardCharsets.UTF_8)) {
            SolvedWorkflow solved = parse(reader);
            logger.info("loaded {} recipes from {}", solved.size(), logFile);
            return solved;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read snakemake log: " + logFile, ex);
        }
    }

    public SolvedWorkflow parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        SolvedWorkflow.Builder builder = SolvedWorkflow.builder(diagnostics);
        Section section = null;
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            Matcher header = SECTION_HEADER.matcher(line);
            if (header.matches()) {
                finish(section, builder);
                section = new Section(header.group(3), "checkpoint".equals(header.group(2)));
                continue;
            }
            if (section == null) {
                continue;
            }
            Matcher entry = ENTRY.matcher(line);
            if (!entry.matches()) {
                finish(section, builder);
                section = null;
                continue;
            }
            section.accept(entry.group(1), entry.group(2).strip(), lineNumber);
        }
        finish(section, builder);
        return builder.build();
    }

    private void finish(Section section, SolvedWorkflow.Builder builder) {
        if (section != null) {
            builder.add(section.toRecipe());
        }
    }

    private final class Section {
        private final String ruleName;
        private final boolean checkpoint;
        private final List<Path> inputs = new ArrayList<>();
        private final List<Path> outputs = new ArrayList<>();
        private Path log;

        Section(String ruleName, boolean checkpoint) {
            this.ruleName = ruleName;
            this.checkpoint = checkpoint;
        }

        void accept(String key, String value, int lineNumber) {
            switch (key) {
                case "input" -> addPaths(value, inputs);
                case "output" -> addPaths(value, outputs);
                case "log" -> log = value.isEmpty() ? null : Paths.get(value);
                default -> {
                    if (!IGNORED_KEYS.contains(key)) {
                        diagnostics.warn(
                            "unrecognized log block \"" + key + "\" for rule \"" + ruleName + "\" on line "
                                + lineNumber + "; skipping"
                        );
                    }
                }
            }
        }

        private void addPaths(String value, List<Path> target) {
            for (String token : PathLists.split(value)) {
                // checkpoint dependencies not yet materialized
                if (UNRESOLVED_TOKEN.equals(token)) {
                    continue;
                }
                target.add(Paths.get(token).normalize());
            }
        }

        Recipe toRecipe() {
            if (outputs.isEmpty()) {
                logger.debug("rule {} has no outputs in the log", ruleName);
            }
            return new Recipe(-1, ruleName, checkpoint, inputs, outputs, Optional.ofNullable(log));
        }
    }
}
