package work.snakeunit.workflow;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flattened, include-expanded workflow source as an ordered sequence of blocks. Order is load
 * order and determines re-emission order.
 */
public final class WorkflowDocument {
    private final List<Block> blocks = new ArrayList<>();

    public WorkflowDocument() {}

    public WorkflowDocument(List<Block> blocks) {
        this.blocks.addAll(blocks);
    }

    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    public int size() {
        return blocks.size();
    }

    void add(Block block) {
        blocks.add(Objects.requireNonNull(block, "block"));
    }

    /**
     * Replaces the block at {@code index} with {@code replacement}, keeping their order.
     */
    void splice(int index, List<Block> replacement) {
        blocks.remove(index);
        blocks.addAll(index, replacement);
    }

    /**
     * Index of the first include directive still awaiting expansion, or -1.
     */
    int firstUnresolvedInclude() {
        for (int index = 0; index < blocks.size(); index++) {
            Block block = blocks.get(index);
            if (block.kind() == BlockKind.INCLUDE && block.resolution() == ResolutionStatus.UNRESOLVED) {
                return index;
            }
        }
        return -1;
    }

    public List<Block> rules() {
        return blocks.stream().filter(Block::isRule).collect(Collectors.toList());
    }

    public Set<String> ruleNames() {
        return blocks.stream()
            .filter(Block::isRule)
            .map(Block::ruleName)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * First rule declared with {@code name}, in load order.
     */
    public Optional<Block> findRule(String name) {
        return blocks.stream().filter(Block::isRule).filter(block -> block.ruleName().equals(name)).findFirst();
    }

    public String render() {
        StringBuilder out = new StringBuilder();
        for (Block block : blocks) {
            out.append(block.render());
        }
        return out.toString();
    }

    /**
     * Renders the document with every rule outside {@code keep} replaced by a placeholder
     * statement. Code blocks are always kept.
     *
     * @throws IllegalStateException if a name in {@code keep} matches no rule
     */
    public String renderWithPlaceholders(Collection<String> keep) {
        Set<String> missing = new LinkedHashSet<>(keep);
        missing.removeAll(ruleNames());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("cannot find requested rule(s) in workflow: " + String.join(", ", missing));
        }
        StringBuilder out = new StringBuilder();
        for (Block block : blocks) {
            if (block.isRule() && !keep.contains(block.ruleName())) {
                out.append(block.renderPlaceholder());
            } else {
                out.append(block.render());
            }
        }
        return out.toString();
    }

    public String renderSingleRule(String name) {
        return renderWithPlaceholders(Set.of(name));
    }

    public void print(Writer out) throws IOException {
        out.write(render());
        out.flush();
    }
}
