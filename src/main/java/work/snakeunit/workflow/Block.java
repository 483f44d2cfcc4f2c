package work.snakeunit.workflow;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.snakeunit.shared.LexicalNormalizer;

/**
 * One unit of parsed workflow content: either a rule-like declaration with named sub-blocks,
 * or a chunk of host-language code (which may be a single include directive).
 *
 * <p>Equality compares semantic content only (names, bodies, indentation); resolution status,
 * interpreter tag and source position are bookkeeping.
 */
public final class Block {
    private static final Pattern INCLUDE_DIRECTIVE = Pattern.compile("^\\s*include:\\s*(\\S.*?)\\s*$");
    private static final Pattern QUOTED_LITERAL = Pattern.compile("^([\"'])([^\"']*)\\1$");
    private static final List<String> LEADING_BLOCKS = List.of("input", "output");
    private static final List<String> TRAILING_BLOCKS = List.of("cwl", "run", "script", "shell", "wrapper");
    private static final Set<String> RESERVED_BLOCKS = Set.of("input", "output", "cwl", "run", "script", "shell", "wrapper");
    static final int DEFAULT_BODY_OFFSET = 4;

    private String ruleName = "";
    private String baseRuleName = "";
    private boolean checkpoint;
    private String docstring = "";
    private final LinkedHashMap<String, String> namedBlocks = new LinkedHashMap<>();
    private final List<String> codeChunk = new ArrayList<>();
    private int localIndentation;
    private int globalIndentation;
    private int bodyIndentation = -1;
    private boolean baseMerged;
    private ResolutionStatus resolution = ResolutionStatus.UNRESOLVED;
    private int interpreterTag;
    private Path resolvedIncludedFilename;
    private Path source;
    private int lineNumber;

    /**
     * Creates the synthetic include directive used to seed loading of a top-level file.
     */
    public static Block includeDirective(String filename) {
        Block block = new Block();
        block.addCodeLine("include: \"" + filename + "\"");
        return block;
    }

    public static Block codeChunk(List<String> lines, int localIndentation, int globalIndentation) {
        Block block = new Block();
        lines.forEach(block::addCodeLine);
        block.localIndentation = localIndentation;
        block.globalIndentation = globalIndentation;
        return block;
    }

    public BlockKind kind() {
        if (!ruleName.isEmpty()) {
            if (!baseRuleName.isEmpty()) {
                return BlockKind.DERIVED_RULE;
            }
            return checkpoint ? BlockKind.CHECKPOINT : BlockKind.RULE;
        }
        return isIncludeDirective() ? BlockKind.INCLUDE : BlockKind.CODE;
    }

    public boolean isRule() {
        return kind().isRule();
    }

    public String ruleName() {
        return ruleName;
    }

    public void setRuleName(String ruleName) {
        this.ruleName = Objects.requireNonNull(ruleName, "ruleName");
    }

    public String baseRuleName() {
        return baseRuleName;
    }

    public void setBaseRuleName(String baseRuleName) {
        this.baseRuleName = Objects.requireNonNull(baseRuleName, "baseRuleName");
    }

    public boolean isCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(boolean checkpoint) {
        this.checkpoint = checkpoint;
    }

    public String docstring() {
        return docstring;
    }

    public void setDocstring(String docstring) {
        this.docstring = Objects.requireNonNull(docstring, "docstring");
    }

    public Map<String, String> namedBlocks() {
        return Collections.unmodifiableMap(namedBlocks);
    }

    public void putNamedBlock(String name, String body) {
        if (!codeChunk.isEmpty()) {
            throw new IllegalStateException("block already holds code and cannot take sub-block \"" + name + "\"");
        }
        namedBlocks.put(name, body);
    }

    public List<String> codeChunk() {
        return Collections.unmodifiableList(codeChunk);
    }

    public void addCodeLine(String line) {
        if (!namedBlocks.isEmpty()) {
            throw new IllegalStateException("rule \"" + ruleName + "\" cannot take code lines");
        }
        codeChunk.add(line);
    }

    public int localIndentation() {
        return localIndentation;
    }

    public void setLocalIndentation(int localIndentation) {
        this.localIndentation = localIndentation;
    }

    public int globalIndentation() {
        return globalIndentation;
    }

    public void setGlobalIndentation(int globalIndentation) {
        this.globalIndentation = globalIndentation;
    }

    /**
     * Indentation of sub-block headers (and docstring) inside a rule body.
     */
    public int bodyIndentation() {
        return bodyIndentation >= 0 ? bodyIndentation : localIndentation + DEFAULT_BODY_OFFSET;
    }

    public void setBodyIndentation(int bodyIndentation) {
        this.bodyIndentation = bodyIndentation;
    }

    /**
     * Depth at which blocks loaded through this include directive must be re-emitted.
     */
    public int includeDepth() {
        return globalIndentation + localIndentation;
    }

    public ResolutionStatus resolution() {
        return resolution;
    }

    public void setResolution(ResolutionStatus resolution) {
        this.resolution = Objects.requireNonNull(resolution, "resolution");
    }

    public int interpreterTag() {
        return interpreterTag;
    }

    public void setInterpreterTag(int interpreterTag) {
        this.interpreterTag = interpreterTag;
    }

    public Optional<Path> resolvedIncludedFilename() {
        return Optional.ofNullable(resolvedIncludedFilename);
    }

    public void setResolvedIncludedFilename(Path resolvedIncludedFilename) {
        this.resolvedIncludedFilename = resolvedIncludedFilename;
    }

    public boolean isBaseMerged() {
        return baseMerged;
    }

    public void markBaseMerged() {
        this.baseMerged = true;
    }

    public Optional<Path> source() {
        return Optional.ofNullable(source);
    }

    public int lineNumber() {
        return lineNumber;
    }

    public void setOrigin(Path source, int lineNumber) {
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public String describeOrigin() {
        return (source != null ? source.toString() : "<generated>") + ":" + lineNumber;
    }

    /**
     * An include directive is a code chunk of exactly one line of the form {@code include: <expr>}.
     * Multi-line chunks never qualify, even if one of their lines mentions {@code include:}.
     */
    public boolean isIncludeDirective() {
        return codeChunk.size() == 1 && INCLUDE_DIRECTIVE.matcher(codeChunk.get(0)).matches();
    }

    /**
     * Returns the raw expression following {@code include:}, quotes included.
     *
     * @throws IllegalStateException if this block is not an include directive
     */
    public String filenameExpression() {
        if (codeChunk.size() != 1) {
            throw new IllegalStateException("filename expression requested for a block that is not an include directive");
        }
        Matcher matcher = INCLUDE_DIRECTIVE.matcher(codeChunk.get(0));
        if (!matcher.matches()) {
            throw new IllegalStateException(
                "filename expression requested for a statement that is not an include directive: " + codeChunk.get(0)
            );
        }
        return matcher.group(1);
    }

    /**
     * The literal path named by this include directive, or empty when the directive operates on
     * an expression that cannot be evaluated statically.
     */
    public Optional<String> includeTarget() {
        Matcher matcher = QUOTED_LITERAL.matcher(filenameExpression());
        if (!matcher.matches() || matcher.group(2).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(2));
    }

    /**
     * Copies a sub-block from the base rule unless this rule defines it already.
     */
    public void offerBaseRuleContents(String baseName, String blockName, String body) {
        if (!baseName.equals(baseRuleName)) {
            throw new IllegalArgumentException(
                "rule \"" + ruleName + "\" derives from \"" + baseRuleName + "\", not from \"" + baseName + "\""
            );
        }
        namedBlocks.putIfAbsent(blockName, body);
    }

    public String render() {
        StringBuilder out = new StringBuilder();
        switch (kind()) {
            case CODE, INCLUDE -> renderCode(out);
            case RULE, CHECKPOINT, DERIVED_RULE -> renderRule(out);
        }
        return out.toString();
    }

    /**
     * No-op statement standing in for a rule that is not needed, at the rule's indentation.
     */
    public String renderPlaceholder() {
        return pad(globalIndentation + localIndentation) + "pass\n";
    }

    private void renderCode(StringBuilder out) {
        for (String line : codeChunk) {
            out.append(pad(globalIndentation));
            appendIndented(out, globalIndentation, line);
            out.append('\n');
        }
    }

    private void renderRule(StringBuilder out) {
        out.append(pad(globalIndentation + localIndentation));
        if (kind() == BlockKind.DERIVED_RULE && !baseMerged) {
            out.append("use rule ").append(baseRuleName).append(" as ").append(ruleName);
            if (!namedBlocks.isEmpty() || !docstring.isEmpty()) {
                out.append(" with:");
            }
        } else {
            out.append(checkpoint ? "checkpoint " : "rule ").append(ruleName).append(':');
        }
        out.append('\n');

        int bodyDepth = globalIndentation + bodyIndentation();
        if (!docstring.isEmpty()) {
            out.append(pad(bodyDepth));
            appendIndented(out, globalIndentation, docstring);
            out.append('\n');
        }
        for (String name : LEADING_BLOCKS) {
            renderNamedBlock(out, bodyDepth, name);
        }
        for (String name : namedBlocks.keySet()) {
            if (!RESERVED_BLOCKS.contains(name)) {
                renderNamedBlock(out, bodyDepth, name);
            }
        }
        for (String name : TRAILING_BLOCKS) {
            renderNamedBlock(out, bodyDepth, name);
        }
        out.append("\n\n");
    }

    private void renderNamedBlock(StringBuilder out, int bodyDepth, String name) {
        String body = namedBlocks.get(name);
        if (body == null) {
            return;
        }
        out.append(pad(bodyDepth)).append(name).append(':');
        appendIndented(out, globalIndentation, body);
        out.append('\n');
    }

    /**
     * Appends {@code text}, prefixing every line after the first with the global indentation.
     */
    private static void appendIndented(StringBuilder out, int indentation, String text) {
        if (indentation == 0) {
            out.append(text);
            return;
        }
        out.append(text.replace("\n", "\n" + pad(indentation)));
    }

    /**
     * Moves every line of a sub-block body after the first by {@code shift} columns. Lines are
     * never dedented past their first non-blank character.
     */
    static String shiftContinuationLines(String body, int shift) {
        if (shift == 0 || body.indexOf('\n') < 0) {
            return body;
        }
        String[] lines = body.split("\n", -1);
        StringBuilder out = new StringBuilder(lines[0]);
        for (int index = 1; index < lines.length; index++) {
            String line = lines[index];
            out.append('\n');
            if (line.isBlank()) {
                out.append(line);
            } else if (shift > 0) {
                out.append(pad(shift)).append(line);
            } else {
                int remove = Math.min(-shift, LexicalNormalizer.indentation(line));
                out.append(line.substring(remove));
            }
        }
        return out.toString();
    }

    static String pad(int width) {
        return " ".repeat(Math.max(0, width));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Block block)) {
            return false;
        }
        return checkpoint == block.checkpoint
            && localIndentation == block.localIndentation
            && globalIndentation == block.globalIndentation
            && bodyIndentation() == block.bodyIndentation()
            && ruleName.equals(block.ruleName)
            && baseRuleName.equals(block.baseRuleName)
            && docstring.equals(block.docstring)
            && namedBlocks.equals(block.namedBlocks)
            && codeChunk.equals(block.codeChunk);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleName, baseRuleName, checkpoint, docstring, namedBlocks, codeChunk, localIndentation, globalIndentation);
    }

    @Override
    public String toString() {
        return switch (kind()) {
            case CODE -> "code(" + codeChunk.size() + " lines @ " + describeOrigin() + ")";
            case INCLUDE -> "include(" + codeChunk.get(0).strip() + ")";
            case RULE, CHECKPOINT, DERIVED_RULE -> kind().name().toLowerCase() + "(" + ruleName + ")";
        };
    }
}
