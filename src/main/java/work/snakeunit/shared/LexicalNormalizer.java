package work.snakeunit.shared;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reduces raw workflow source lines to their semantically meaningful content.
 *
 * <p>The result always has the same number of entries as the input. A statement spread over
 * several physical lines (open string literal, open bracket or trailing backslash) is joined
 * with {@code '\n'} and stored at the index of its first physical line; the lines it consumed
 * become empty strings. Comments, trailing whitespace and standalone triple-quoted literals
 * are removed, except that a literal directly following a line that ends in {@code ':'} is
 * kept, since it is either a rule docstring or the value of a sub-block such as {@code shell:}.
 */
public final class LexicalNormalizer {
    private static final Pattern HEADER_START = Pattern.compile("^[A-Za-z_]\\w*\\s*:");

    private LexicalNormalizer() {}

    public static List<String> normalize(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        return pruneDocstrings(joinLogicalLines(lines));
    }

    static List<String> joinLogicalLines(List<String> lines) {
        String[] result = new String[lines.size()];
        Arrays.fill(result, "");
        StringBuilder current = null;
        int start = 0;
        QuoteType quote = QuoteType.NONE;
        int depth = 0;

        for (int index = 0; index < lines.size(); index++) {
            String physical = lines.get(index);
            if (current == null) {
                current = new StringBuilder();
                start = index;
            } else {
                current.append('\n');
            }

            int pos = 0;
            while (pos < physical.length()) {
                char c = physical.charAt(pos);
                if (quote == QuoteType.NONE) {
                    if (c == '#') {
                        break;
                    }
                    QuoteType opening = QuoteType.opening(physical, pos);
                    if (opening != QuoteType.NONE) {
                        quote = opening;
                        current.append(opening.delimiter());
                        pos += opening.delimiter().length();
                        continue;
                    }
                    if (c == '(' || c == '[' || c == '{') {
                        depth++;
                    } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                        depth--;
                    }
                    current.append(c);
                    pos++;
                } else if (c == '\\') {
                    current.append(c);
                    if (pos + 1 < physical.length()) {
                        current.append(physical.charAt(pos + 1));
                    }
                    pos += 2;
                } else if (quote.closesAt(physical, pos)) {
                    current.append(quote.delimiter());
                    pos += quote.delimiter().length();
                    quote = QuoteType.NONE;
                } else {
                    current.append(c);
                    pos++;
                }
            }

            boolean explicitJoin = false;
            if (quote == QuoteType.NONE) {
                stripTrailingWhitespace(current);
                explicitJoin = current.length() > 0 && current.charAt(current.length() - 1) == '\\';
            }
            if (quote != QuoteType.NONE || depth > 0 || explicitJoin) {
                continue;
            }
            result[start] = current.toString();
            current = null;
        }
        // unterminated literal or bracket at end of file: keep what was collected
        if (current != null) {
            stripTrailingWhitespace(current);
            result[start] = current.toString();
        }
        return new ArrayList<>(Arrays.asList(result));
    }

    /**
     * Blanks triple-quoted literals that form a statement of their own. A literal is kept when
     * it directly follows a line ending in {@code ':'}, continues a string literal on the
     * previous line (implicit concatenation) or sits deeper than the last header line.
     */
    static List<String> pruneDocstrings(List<String> logicalLines) {
        List<String> result = new ArrayList<>(logicalLines);
        String previous = null;
        int headerIndentation = -1;
        for (int index = 0; index < result.size(); index++) {
            String line = result.get(index);
            if (line.isBlank()) {
                result.set(index, "");
                continue;
            }
            String stripped = line.strip();
            int indentation = indentation(line);
            boolean opensBlock = previous != null && previous.endsWith(":");
            boolean continuesString = previous != null && startsWithStringLiteral(previous.strip());
            boolean insideHeader = headerIndentation >= 0 && indentation > headerIndentation;
            if (!opensBlock && !continuesString && !insideHeader && isStandaloneTripleQuotedLiteral(stripped)) {
                result.set(index, "");
                continue;
            }
            if (line.endsWith(":") || HEADER_START.matcher(stripped).lookingAt()) {
                headerIndentation = indentation;
            } else if (indentation <= headerIndentation) {
                headerIndentation = -1;
            }
            previous = line;
        }
        return result;
    }

    /**
     * True when {@code text} consists of exactly one triple-quoted literal, optionally with a
     * string prefix such as {@code r} or {@code f}.
     */
    static boolean isStandaloneTripleQuotedLiteral(String text) {
        int pos = 0;
        while (pos < text.length() && pos < 2 && "rRbBuUfF".indexOf(text.charAt(pos)) >= 0) {
            pos++;
        }
        if (pos >= text.length()) {
            return false;
        }
        QuoteType quote = QuoteType.opening(text, pos);
        if (!quote.isTriple()) {
            return false;
        }
        pos += quote.delimiter().length();
        while (pos < text.length()) {
            if (text.charAt(pos) == '\\') {
                pos += 2;
                continue;
            }
            if (quote.closesAt(text, pos)) {
                return pos + quote.delimiter().length() == text.length();
            }
            pos++;
        }
        return false;
    }

    /**
     * True when the stripped line starts with a string literal (single or triple quoted).
     */
    public static boolean startsWithStringLiteral(String stripped) {
        int pos = 0;
        while (pos < stripped.length() && pos < 2 && "rRbBuUfF".indexOf(stripped.charAt(pos)) >= 0) {
            pos++;
        }
        return pos < stripped.length() && QuoteType.opening(stripped, pos) != QuoteType.NONE;
    }

    public static int indentation(String line) {
        int count = 0;
        while (count < line.length() && (line.charAt(count) == ' ' || line.charAt(count) == '\t')) {
            count++;
        }
        return count;
    }

    private static void stripTrailingWhitespace(StringBuilder builder) {
        int length = builder.length();
        while (length > 0 && (builder.charAt(length - 1) == ' ' || builder.charAt(length - 1) == '\t')) {
            length--;
        }
        builder.setLength(length);
    }
}
