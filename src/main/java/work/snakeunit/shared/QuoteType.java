package work.snakeunit.shared;

/**
 * String delimiters the normalizer tracks across physical line boundaries.
 */
public enum QuoteType {
    NONE(""),
    SINGLE_TICK("'"),
    SINGLE_QUOTE("\""),
    TRIPLE_TICK("'''"),
    TRIPLE_QUOTE("\"\"\"");

    private final String delimiter;

    QuoteType(String delimiter) {
        this.delimiter = delimiter;
    }

    public String delimiter() {
        return delimiter;
    }

    public boolean isTriple() {
        return this == TRIPLE_TICK || this == TRIPLE_QUOTE;
    }

    /**
     * Determines which literal opens at {@code pos}, or {@link #NONE} if the character there
     * is not a quote.
     */
    public static QuoteType opening(String line, int pos) {
        char c = line.charAt(pos);
        if (c == '\'') {
            return line.startsWith("'''", pos) ? TRIPLE_TICK : SINGLE_TICK;
        }
        if (c == '"') {
            return line.startsWith("\"\"\"", pos) ? TRIPLE_QUOTE : SINGLE_QUOTE;
        }
        return NONE;
    }

    public boolean closesAt(String line, int pos) {
        return this != NONE && line.startsWith(delimiter, pos);
    }
}
