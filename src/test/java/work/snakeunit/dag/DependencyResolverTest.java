package work.snakeunit.dag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.snakeunit.execlog.Recipe;
import work.snakeunit.execlog.SolvedWorkflow;
import work.snakeunit.shared.Diagnostics;

class DependencyResolverTest {
    private Recipe rec1;
    private Recipe rec2;
    private Recipe rec3;
    private DependencyResolver resolver;

    private static Recipe recipe(String name, boolean checkpoint, List<String> inputs, List<String> outputs) {
        return new Recipe(
            -1,
            name,
            checkpoint,
            inputs.stream().map(Path::of).collect(Collectors.toList()),
            outputs.stream().map(Path::of).collect(Collectors.toList()),
            Optional.empty()
        );
    }

    @BeforeEach
    void buildChain() {
        var builder = SolvedWorkflow.builder(new Diagnostics());
        rec1 = builder.add(recipe("first", true, List.of("input1.tsv", "input2.tsv"), List.of("output1.tsv")));
        rec2 = builder.add(recipe("second", false, List.of("input3.tsv", "output1.tsv"), List.of("output2.tsv")));
        rec3 = builder.add(recipe("third", false, List.of("input4.tsv", "output2.tsv"), List.of("output3.tsv")));
        builder.add(recipe("independent", false, List.of("input5.tsv"), List.of("output4.tsv")));
        resolver = new DependencyResolver(builder.build());
    }

    @Test
    void shallowClosureHoldsDirectProducersOnly() {
        assertEquals(Set.of(rec2), resolver.dependencyClosure(rec3, false));
    }

    @Test
    void fullClosureFollowsProducersTransitively() {
        var full = resolver.dependencyClosure(rec3, true);
        assertEquals(List.of(rec2, rec1), List.copyOf(full));
        assertTrue(full.containsAll(resolver.dependencyClosure(rec3, false)));
        assertTrue(resolver.dependencyClosure(rec1, true).isEmpty());
    }

    @Test
    void nullTargetIsRejected() {
        assertThrows(NullPointerException.class, () -> resolver.addDagFromLeaf(rec3, true, null));
    }

    @Test
    void propagatesCheckpointDependency() {
        assertTrue(resolver.isCheckpointDependent(rec1));
        assertTrue(resolver.isCheckpointDependent(rec3));
        assertTrue(resolver.isCheckpointDependent(rec2));
    }

    @Test
    void recipesWithoutCheckpointAncestorsAreIndependent() {
        var builder = SolvedWorkflow.builder(new Diagnostics());
        var a = builder.add(recipe("a", false, List.of("raw.txt"), List.of("a.txt")));
        var b = builder.add(recipe("b", false, List.of("a.txt"), List.of("b.txt")));
        var local = new DependencyResolver(builder.build());
        assertFalse(local.isCheckpointDependent(b));
        assertFalse(local.isCheckpointDependent(a));
    }

    @Test
    void toleratesCyclesInMalformedLogs() {
        var builder = SolvedWorkflow.builder(new Diagnostics());
        var a = builder.add(recipe("a", false, List.of("b.txt"), List.of("a.txt")));
        var b = builder.add(recipe("b", false, List.of("a.txt"), List.of("b.txt")));
        var local = new DependencyResolver(builder.build());
        assertEquals(Set.of(b), local.dependencyClosure(a, true));
        assertFalse(local.isCheckpointDependent(a));
    }
}
