package work.snakeunit.execlog;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.snakeunit.shared.Diagnostics;

/**
 * Recipes parsed from one execution log, in log order, with a lookup from each produced path
 * to the recipe that produced it. When two recipes declare the same output the later one wins.
 */
public final class SolvedWorkflow {
    private final List<Recipe> recipes;
    private final Map<Path, Integer> outputLookup;

    private SolvedWorkflow(Builder builder) {
        this.recipes = Collections.unmodifiableList(new ArrayList<>(builder.recipes));
        this.outputLookup = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputLookup));
    }

    public static Builder builder(Diagnostics diagnostics) {
        return new Builder(diagnostics);
    }

    public List<Recipe> recipes() {
        return recipes;
    }

    public Recipe recipe(int id) {
        return recipes.get(id);
    }

    public int size() {
        return recipes.size();
    }

    public Optional<Recipe> producerOf(Path output) {
        Integer id = outputLookup.get(output.normalize());
        return id == null ? Optional.empty() : Optional.of(recipes.get(id));
    }

    public Map<Path, Integer> outputLookup() {
        return outputLookup;
    }

    public static final class Builder {
        private final Diagnostics diagnostics;
        private final List<Recipe> recipes = new ArrayList<>();
        private final Map<Path, Integer> outputLookup = new LinkedHashMap<>();
        private boolean duplicateReported;

        private Builder(Diagnostics diagnostics) {
            this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        }

        /**
         * Appends a recipe, replacing its id with its position in log order.
         */
        public Recipe add(Recipe draft) {
            Recipe recipe = draft.withId(recipes.size());
            recipes.add(recipe);
            for (Path output : recipe.outputs()) {
                Integer previous = outputLookup.put(output.normalize(), recipe.id());
                if (previous != null && previous != recipe.id()) {
                    if (!duplicateReported) {
                        diagnostics.warn(
                            "at least one output file appears multiple times in the log; "
                                + "the last recipe producing it is used"
                        );
                        duplicateReported = true;
                    }
                    diagnostics.warn(
                        "output \"" + output + "\" of rule \"" + recipe.ruleName()
                            + "\" was already produced by rule \"" + recipes.get(previous).ruleName() + "\""
                    );
                }
            }
            return recipe;
        }

        public SolvedWorkflow build() {
            return new SolvedWorkflow(this);
        }
    }
}
