package nibbler.decompose;

import java.util.*;

import nibbler.contract.VariableId;

/**
 * The flags an aggregator folds, ordered from the least significant nibble
 */
public final class Aggregation {

    public final AggregationKind kind;
    public final List<VariableId> flags;
    /**
     * Per nibble equality flags of a lexicographic fold, the equality result for {@link AggregationKind#OR_EQUAL}
     */
    public final List<VariableId> equalities;

    private Aggregation(AggregationKind kind, List<VariableId> flags, List<VariableId> equalities) {
        if (flags.isEmpty()) {
            throw new IllegalArgumentException("Nothing to aggregate");
        }
        this.kind = kind;
        this.flags = Collections.unmodifiableList(new ArrayList<>(flags));
        this.equalities = Collections.unmodifiableList(new ArrayList<>(equalities));
    }

    public static Aggregation allEqual(List<VariableId> flags) {
        return new Aggregation(AggregationKind.ALL_EQUAL, flags, Collections.emptyList());
    }

    public static Aggregation anyDiffer(List<VariableId> flags) {
        return new Aggregation(AggregationKind.ANY_DIFFER, flags, Collections.emptyList());
    }

    public static Aggregation lexicographic(AggregationKind kind, List<VariableId> strict, List<VariableId> equal) {
        if (!kind.isLexicographic()) {
            throw new IllegalArgumentException(kind + " is not lexicographic");
        }
        if (strict.size() != equal.size()) {
            throw new IllegalArgumentException(String.format("%d order flags but %d equality flags",
                    strict.size(), equal.size()));
        }
        return new Aggregation(kind, strict, equal);
    }

    public static Aggregation orEqual(VariableId strict, VariableId equal) {
        return new Aggregation(AggregationKind.OR_EQUAL, Collections.singletonList(strict),
                Collections.singletonList(equal));
    }
}
