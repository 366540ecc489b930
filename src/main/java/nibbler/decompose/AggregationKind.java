package nibbler.decompose;

/**
 * How per nibble flags are combined into an instruction level result
 */
public enum AggregationKind {
    /**
     * Conjunction of all flags
     */
    ALL_EQUAL,
    /**
     * Disjunction of all flags
     */
    ANY_DIFFER,
    /**
     * Strict order of the most significant differing nibble, less than
     */
    LEXICOGRAPHIC_LESS,
    /**
     * Strict order of the most significant differing nibble, greater than
     */
    LEXICOGRAPHIC_GREATER,
    /**
     * Strict order result or equality result
     */
    OR_EQUAL;

    public boolean isLexicographic() {
        return this == LEXICOGRAPHIC_LESS || this == LEXICOGRAPHIC_GREATER;
    }

    public String label() {
        return name().toLowerCase();
    }
}
