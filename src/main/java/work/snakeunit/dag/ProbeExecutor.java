package work.snakeunit.dag;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs a snakemake dry run of {@code snakefile} from {@code workingDirectory}.
 */
@FunctionalInterface
public interface ProbeExecutor {
    DryRun dryRun(Path workingDirectory, Path snakefile) throws IOException, InterruptedException;
}
