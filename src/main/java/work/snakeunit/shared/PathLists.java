package work.snakeunit.shared;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits the comma/space delimited file lists that appear in execution logs.
 */
public final class PathLists {
    private static final Pattern DELIMITER = Pattern.compile("[,\\s]+");

    private PathLists() {}

    public static List<String> split(String raw) {
        List<String> values = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return values;
        }
        for (String token : DELIMITER.split(raw.strip())) {
            if (!token.isEmpty()) {
                values.add(token);
            }
        }
        return values;
    }
}
