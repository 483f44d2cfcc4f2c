package work.snakeunit.dag;

import java.util.List;

/**
 * Exit status and combined console output of one snakemake dry run.
 */
public record DryRun(int exitCode, List<String> output) {
    public DryRun {
        output = List.copyOf(output);
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
