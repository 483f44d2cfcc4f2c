package work.snakeunit.synth;

import java.util.Locale;
import java.util.Set;

/**
 * Categories of generated content that a run refreshes.
 */
public enum UpdateMode {
    ALL,
    SNAKEFILES,
    ADDED_CONTENT,
    INPUTS,
    OUTPUTS,
    PYTEST;

    public static UpdateMode from(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        try {
            return UpdateMode.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported update mode: " + value);
        }
    }

    public static boolean enabled(Set<UpdateMode> modes, UpdateMode mode) {
        return modes.contains(ALL) || modes.contains(mode);
    }
}
