package work.snakeunit.dag;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds rule names that a snakemake dry run did not recognize, from the attribute errors the
 * rule probe prints.
 */
public final class MissingRuleScanner {
    private static final Logger logger = LoggerFactory.getLogger(MissingRuleScanner.class);
    private static final Pattern MISSING_RULE = Pattern.compile("'Rules' object has no attribute '([^']+)'");
    private static final Pattern MISSING_CHECKPOINT = Pattern.compile("'Checkpoints' object has no attribute '([^']+)'");

    private MissingRuleScanner() {}

    /**
     * Adds every missing rule or checkpoint name found in {@code lines} to {@code missing}. A
     * null {@code missing} makes this a no-op.
     *
     * @throws IllegalStateException on an {@code Exception:} line of any other shape
     */
    public static void findMissingRules(List<String> lines, Set<String> missing) {
        if (missing == null) {
            return;
        }
        for (String line : lines) {
            Matcher rule = MISSING_RULE.matcher(line);
            Matcher checkpoint = MISSING_CHECKPOINT.matcher(line);
            if (rule.find()) {
                missing.add(rule.group(1));
            } else if (checkpoint.find()) {
                missing.add(checkpoint.group(1));
            } else if (line.contains("Exception:")) {
                logger.error("unexpected exception in rule probe output: {}", line.strip());
                throw new IllegalStateException("unexpected exception in rule probe output: " + line.strip());
            }
        }
    }
}
