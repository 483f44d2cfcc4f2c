package work.snakeunit.workflow;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.snakeunit.shared.LexicalNormalizer;

/**
 * Groups normalized workflow lines into {@link Block}s. Each call to {@link #nextBlock()}
 * consumes the lines belonging to one block and advances the cursor past them.
 */
public final class BlockParser {
    private static final Pattern RULE_HEADER = Pattern.compile("^(rule|checkpoint)\\s+(\\w+)\\s*:\\s*$");
    private static final Pattern DERIVED_HEADER =
        Pattern.compile("^use\\s+rule\\s+(\\w+)\\s+as\\s+(\\w+)(\\s+with\\s*:)?\\s*$");
    private static final Pattern SUB_BLOCK_HEADER = Pattern.compile("^([A-Za-z_]\\w*)\\s*:(.*)$", Pattern.DOTALL);
    private static final Pattern INCLUDE_LINE = Pattern.compile("^include:.*$", Pattern.DOTALL);

    private final List<String> lines;
    private final Path source;
    private final int globalIndentation;
    private int cursor;

    /**
     * @param lines output of {@link LexicalNormalizer#normalize(List)}
     * @param source file the lines came from, used in diagnostics
     * @param globalIndentation indentation of the include site the file is loaded through
     */
    public BlockParser(List<String> lines, Path source, int globalIndentation) {
        this.lines = Objects.requireNonNull(lines, "lines");
        this.source = source;
        this.globalIndentation = globalIndentation;
    }

    public static List<Block> parseAll(List<String> lines, Path source, int globalIndentation) {
        BlockParser parser = new BlockParser(lines, source, globalIndentation);
        List<Block> blocks = new ArrayList<>();
        Optional<Block> block;
        while ((block = parser.nextBlock()).isPresent()) {
            blocks.add(block.get());
        }
        return blocks;
    }

    public int cursor() {
        return cursor;
    }

    /**
     * Parses the block starting at the cursor, or returns empty once only blank lines remain.
     */
    public Optional<Block> nextBlock() {
        skipBlankLines();
        if (cursor >= lines.size()) {
            return Optional.empty();
        }
        String line = lines.get(cursor);
        String stripped = line.strip();

        Matcher rule = RULE_HEADER.matcher(stripped);
        if (rule.matches()) {
            Block block = startRule(line, rule.group(2));
            block.setCheckpoint("checkpoint".equals(rule.group(1)));
            cursor++;
            parseRuleBody(block);
            return Optional.of(block);
        }
        Matcher derived = DERIVED_HEADER.matcher(stripped);
        if (derived.matches()) {
            Block block = startRule(line, derived.group(2));
            block.setBaseRuleName(derived.group(1));
            cursor++;
            if (derived.group(3) != null) {
                parseRuleBody(block);
            }
            return Optional.of(block);
        }
        if (isIncludeLine(stripped)) {
            Block block = Block.codeChunk(List.of(line), LexicalNormalizer.indentation(line), globalIndentation);
            block.setOrigin(source, cursor + 1);
            cursor++;
            return Optional.of(block);
        }
        return Optional.of(parseCodeChunk());
    }

    private Block startRule(String line, String name) {
        Block block = new Block();
        block.setRuleName(name);
        block.setLocalIndentation(LexicalNormalizer.indentation(line));
        block.setGlobalIndentation(globalIndentation);
        block.setOrigin(source, cursor + 1);
        return block;
    }

    private void parseRuleBody(Block block) {
        String currentName = null;
        int currentIndentation = -1;
        while (cursor < lines.size()) {
            String line = lines.get(cursor);
            if (line.isBlank()) {
                cursor++;
                continue;
            }
            int indentation = LexicalNormalizer.indentation(line);
            if (indentation <= block.localIndentation()) {
                return;
            }
            String stripped = line.strip();
            if (currentName != null && indentation > currentIndentation) {
                block.putNamedBlock(currentName, block.namedBlocks().get(currentName) + "\n" + line);
            } else if (currentName == null && block.docstring().isEmpty()
                && LexicalNormalizer.startsWithStringLiteral(stripped)) {
                block.setDocstring(stripped);
                block.setBodyIndentation(indentation);
            } else {
                Matcher header = SUB_BLOCK_HEADER.matcher(stripped);
                if (!header.matches()) {
                    throw new IllegalStateException(
                        "unrecognized content in rule \"" + block.ruleName() + "\" at " + location() + ": " + stripped
                    );
                }
                String name = header.group(1);
                if (block.namedBlocks().containsKey(name)) {
                    throw new IllegalStateException(
                        "rule \"" + block.ruleName() + "\" declares sub-block \"" + name + "\" twice at " + location()
                    );
                }
                if (currentName == null && block.docstring().isEmpty()) {
                    block.setBodyIndentation(indentation);
                }
                block.putNamedBlock(name, header.group(2));
                currentName = name;
                currentIndentation = indentation;
            }
            cursor++;
        }
    }

    private Block parseCodeChunk() {
        int start = cursor;
        List<String> chunk = new ArrayList<>();
        while (cursor < lines.size()) {
            String line = lines.get(cursor);
            if (line.isBlank()) {
                cursor++;
                continue;
            }
            String stripped = line.strip();
            if (RULE_HEADER.matcher(stripped).matches()
                || DERIVED_HEADER.matcher(stripped).matches()
                || isIncludeLine(stripped)) {
                break;
            }
            chunk.add(line);
            cursor++;
        }
        Block block = Block.codeChunk(chunk, LexicalNormalizer.indentation(chunk.get(0)), globalIndentation);
        block.setOrigin(source, start + 1);
        return block;
    }

    private static boolean isIncludeLine(String stripped) {
        return INCLUDE_LINE.matcher(stripped).matches() && stripped.indexOf('\n') < 0;
    }

    private void skipBlankLines() {
        while (cursor < lines.size() && lines.get(cursor).isBlank()) {
            cursor++;
        }
    }

    private String location() {
        return (source != null ? source.toString() : "<input>") + ":" + (cursor + 1);
    }
}
