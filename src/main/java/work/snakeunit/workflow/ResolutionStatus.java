package work.snakeunit.workflow;

/**
 * Tracks whether an include directive has been expanded into the document.
 */
public enum ResolutionStatus {
    UNRESOLVED,
    RESOLVED_INCLUDED,
    RESOLVED_NOT_INCLUDED,
    RESOLUTION_REQUIRES_PYTHON_INTERPRETATION
}
