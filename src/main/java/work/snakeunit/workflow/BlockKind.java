package work.snakeunit.workflow;

/**
 * Closed set of content a {@link Block} can hold.
 */
public enum BlockKind {
    RULE,
    DERIVED_RULE,
    CHECKPOINT,
    INCLUDE,
    CODE;

    public boolean isRule() {
        return this == RULE || this == DERIVED_RULE || this == CHECKPOINT;
    }
}
