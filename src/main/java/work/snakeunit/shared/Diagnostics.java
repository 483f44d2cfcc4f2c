package work.snakeunit.shared;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects warnings and summary notes produced while loading and synthesizing, so callers can
 * inspect them after a run. Every entry is also forwarded to the log.
 */
public final class Diagnostics {
    private static final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

    private final List<String> warnings = new ArrayList<>();
    private final List<String> notes = new ArrayList<>();

    public void warn(String message) {
        warnings.add(message);
        logger.warn(message);
    }

    public void note(String message) {
        notes.add(message);
        logger.info(message);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<String> notes() {
        return Collections.unmodifiableList(notes);
    }

    public boolean hasWarningContaining(String fragment) {
        return warnings.stream().anyMatch(warning -> warning.contains(fragment));
    }
}
