package work.snakeunit.workflow;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.snakeunit.shared.Diagnostics;
import work.snakeunit.shared.LexicalNormalizer;

/**
 * Loads a workflow and all files it includes into one {@link WorkflowDocument}, flags constructs
 * that cannot be resolved without evaluating host-language code, and merges derived rules with
 * their base.
 */
public final class WorkflowResolver {
    private static final Logger logger = LoggerFactory.getLogger(WorkflowResolver.class);
    static final int MAX_INCLUDE_EXPANSIONS = 4096;

    private final Diagnostics diagnostics;

    public WorkflowResolver(Diagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Loads the snakefile, runs the known-issue checks and merges derived rules. Includes are
     * resolved relative to the snakefile's directory.
     */
    public WorkflowDocument loadEverything(Path snakefile, Set<String> exclusions) {
        Path absolute = snakefile.toAbsolutePath().normalize();
        Path baseDirectory = absolute.getParent();
        WorkflowDocument document = load(baseDirectory.relativize(absolute), baseDirectory);
        detectKnownIssues(document, exclusions);
        resolveDerivedRules(document);
        return document;
    }

    public WorkflowDocument load(Path topLevel, Path baseDirectory) {
        Objects.requireNonNull(topLevel, "topLevel");
        Objects.requireNonNull(baseDirectory, "baseDirectory");
        WorkflowDocument document = new WorkflowDocument();
        document.add(Block.includeDirective(topLevel.toString().replace('\\', '/')));

        int expansions = 0;
        int index;
        while ((index = document.firstUnresolvedInclude()) >= 0) {
            Block include = document.blocks().get(index);
            var target = include.includeTarget();
            if (target.isEmpty()) {
                include.setResolution(ResolutionStatus.RESOLUTION_REQUIRES_PYTHON_INTERPRETATION);
                logger.debug("include at {} needs evaluation: {}", include.describeOrigin(), include.filenameExpression());
                continue;
            }
            if (++expansions > MAX_INCLUDE_EXPANSIONS) {
                throw new IllegalStateException(
                    "too many include expansions, likely a recursive include of \"" + target.get() + "\" at "
                        + include.describeOrigin()
                );
            }
            Path path = baseDirectory.resolve(target.get());
            include.setResolution(ResolutionStatus.RESOLVED_INCLUDED);
            include.setResolvedIncludedFilename(path);
            List<Block> loaded = BlockParser.parseAll(
                LexicalNormalizer.normalize(readLines(path)),
                path,
                include.includeDepth()
            );
            logger.debug("included {} ({} blocks)", path, loaded.size());
            document.splice(index, loaded);
        }
        return document;
    }

    /**
     * Reports include directives left in code chunks and rules with divergent duplicate
     * definitions. Names of the latter are added to {@code exclusions}.
     */
    public void detectKnownIssues(WorkflowDocument document, Set<String> exclusions) {
        Objects.requireNonNull(exclusions, "exclusions");
        for (Block block : document.blocks()) {
            if (block.isRule() || block.codeChunk().isEmpty()) {
                continue;
            }
            String last = block.codeChunk().get(block.codeChunk().size() - 1);
            if (last.contains("include:") && block.resolution() != ResolutionStatus.RESOLVED_INCLUDED) {
                diagnostics.warn(
                    "leftover include directive at " + block.describeOrigin() + ": \"" + last.strip()
                        + "\"; includes on expressions or inside conditional code are not resolved"
                );
            }
        }

        Map<String, List<Block>> definitions = new LinkedHashMap<>();
        for (Block rule : document.rules()) {
            definitions.computeIfAbsent(rule.ruleName(), name -> new ArrayList<>()).add(rule);
        }
        int duplicated = 0;
        Set<String> unresolvable = new TreeSet<>();
        for (Map.Entry<String, List<Block>> entry : definitions.entrySet()) {
            List<Block> variants = entry.getValue();
            if (variants.size() < 2) {
                continue;
            }
            duplicated++;
            List<Block> distinct = new ArrayList<>();
            for (Block variant : variants) {
                if (!distinct.contains(variant)) {
                    distinct.add(variant);
                }
            }
            if (distinct.size() > 1) {
                unresolvable.add(entry.getKey());
                if (exclusions.add(entry.getKey())) {
                    diagnostics.warn(
                        "rule \"" + entry.getKey() + "\" has " + distinct.size()
                            + " divergent definitions and will not get a test"
                    );
                }
            }
        }
        diagnostics.note(
            "snakefile load summary: " + definitions.size() + " distinct rule names, "
                + document.rules().size() + " rule blocks, " + duplicated + " with duplicate definitions, "
                + unresolvable.size() + " unresolvable" + (unresolvable.isEmpty() ? "" : " " + unresolvable)
        );
    }

    /**
     * Copies sub-blocks from each base rule into rules derived from it, where the derived rule
     * does not define them itself, re-indented to the derived rule's body depth. Only one level
     * of inheritance is followed.
     *
     * @throws IllegalStateException if a base rule cannot be found
     */
    public void resolveDerivedRules(WorkflowDocument document) {
        for (Block derived : document.rules()) {
            if (derived.kind() != BlockKind.DERIVED_RULE || derived.isBaseMerged()) {
                continue;
            }
            Block base = null;
            for (Block candidate : document.rules()) {
                if (candidate.ruleName().equals(derived.baseRuleName())) {
                    base = candidate;
                    break;
                }
            }
            if (base == null) {
                throw new IllegalStateException(
                    "cannot find base rule \"" + derived.baseRuleName() + "\" for derived rule \""
                        + derived.ruleName() + "\" at " + derived.describeOrigin()
                );
            }
            int shift = derived.bodyIndentation() - base.bodyIndentation();
            for (Map.Entry<String, String> entry : base.namedBlocks().entrySet()) {
                derived.offerBaseRuleContents(
                    derived.baseRuleName(),
                    entry.getKey(),
                    Block.shiftContinuationLines(entry.getValue(), shift)
                );
            }
            derived.setCheckpoint(base.isCheckpoint());
            derived.markBaseMerged();
        }
    }

    private static List<String> readLines(Path path) {
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read workflow file: " + path, ex);
        }
    }
}
