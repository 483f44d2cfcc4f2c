package work.snakeunit.cli;

import picocli.CommandLine;

/**
 * Prints the innermost cause of a failed run as one line. Bad option values are reported with the
 * usage exit code, everything else with the execution failure code.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String PREFIX = "snakeunit: ";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        Throwable cause = rootCause(ex);
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = cause.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(PREFIX + message));
        if (Boolean.getBoolean("snakeunit.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (cause instanceof IllegalArgumentException) {
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static Throwable rootCause(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
