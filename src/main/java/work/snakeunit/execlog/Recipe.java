package work.snakeunit.execlog;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One executed rule instance recorded in an execution log. The {@code id} is the recipe's
 * position in its {@link SolvedWorkflow}.
 */
public record Recipe(
    int id,
    String ruleName,
    boolean checkpoint,
    List<Path> inputs,
    List<Path> outputs,
    Optional<Path> log
) {
    public Recipe {
        Objects.requireNonNull(ruleName, "ruleName");
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        log = Objects.requireNonNull(log, "log");
    }

    Recipe withId(int newId) {
        return new Recipe(newId, ruleName, checkpoint, inputs, outputs, log);
    }
}
