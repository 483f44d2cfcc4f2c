package work.snakeunit.dag;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.snakeunit.execlog.Recipe;
import work.snakeunit.execlog.SolvedWorkflow;

/**
 * Walks the output-to-producer relation of a {@link SolvedWorkflow}.
 */
public final class DependencyResolver {
    private final SolvedWorkflow solved;
    private final Map<Integer, Boolean> checkpointDependent = new HashMap<>();

    public DependencyResolver(SolvedWorkflow solved) {
        this.solved = Objects.requireNonNull(solved, "solved");
    }

    /**
     * Recipes producing the inputs of {@code leaf}, in discovery order. With {@code full} the walk
     * follows producers transitively, otherwise it stops at direct producers. The leaf itself is
     * never part of the result.
     */
    public Set<Recipe> dependencyClosure(Recipe leaf, boolean full) {
        Set<Recipe> target = new LinkedHashSet<>();
        addDagFromLeaf(leaf, full, target);
        return target;
    }

    /**
     * Adds the producers of {@code leaf}'s inputs to {@code target}.
     *
     * @throws NullPointerException if {@code target} is null
     */
    public void addDagFromLeaf(Recipe leaf, boolean full, Set<Recipe> target) {
        Objects.requireNonNull(leaf, "leaf");
        Objects.requireNonNull(target, "target");
        Set<Integer> visited = new HashSet<>();
        visited.add(leaf.id());
        Deque<Recipe> pending = new ArrayDeque<>();
        pending.add(leaf);
        while (!pending.isEmpty()) {
            Recipe current = pending.poll();
            for (Path input : current.inputs()) {
                var producer = solved.producerOf(input);
                if (producer.isEmpty() || !visited.add(producer.get().id())) {
                    continue;
                }
                target.add(producer.get());
                if (full) {
                    pending.add(producer.get());
                }
            }
        }
    }

    /**
     * True when {@code recipe} is a checkpoint or any recipe it directly depends on is
     * checkpoint-dependent. Results are memoized per recipe.
     */
    public boolean isCheckpointDependent(Recipe recipe) {
        Boolean known = checkpointDependent.get(recipe.id());
        if (known != null) {
            return known;
        }
        // provisional entry stops cycles in malformed logs
        checkpointDependent.put(recipe.id(), recipe.checkpoint());
        boolean result = recipe.checkpoint();
        if (!result) {
            for (Recipe dependency : dependencyClosure(recipe, false)) {
                if (isCheckpointDependent(dependency)) {
                    result = true;
                    break;
                }
            }
        }
        checkpointDependent.put(recipe.id(), result);
        return result;
    }
}
