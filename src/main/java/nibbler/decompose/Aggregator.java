package nibbler.decompose;

import java.util.*;
import java.util.stream.Collectors;

import nibbler.contract.*;

import static nibbler.contract.Terms.*;

/**
 * Folds per nibble flags into a single instruction level result
 */
public class Aggregator {

    /**
     * Lexicographic fold starting at the most significant position:
     * <code>s[n-1] | (e[n-1] &amp; (s[n-2] | (e[n-2] &amp; ... s[0])))</code>.
     * Evaluates to false if every position is equal.
     *
     * @param strict order flags, least significant first
     * @param equal  equality flags, least significant first
     */
    public static Term lexicographic(List<? extends Term> strict, List<? extends Term> equal) {
        if (strict.size() != equal.size() || strict.isEmpty()) {
            throw new IllegalArgumentException("Lexicographic fold needs equally many order and equality flags");
        }
        Term result = strict.get(0);
        for (int k = 1; k < strict.size(); k++) {
            result = or(strict.get(k), and(equal.get(k), result));
        }
        return result;
    }

    public Term fold(Aggregation aggregation) {
        List<Term> flags = vars(aggregation.flags);
        List<Term> equalities = vars(aggregation.equalities);
        switch (aggregation.kind) {
            case ALL_EQUAL:
                return and(flags);
            case ANY_DIFFER:
                return or(flags);
            case LEXICOGRAPHIC_LESS:
            case LEXICOGRAPHIC_GREATER:
                return lexicographic(flags, equalities);
            case OR_EQUAL:
                return or(flags.get(0), equalities.get(0));
        }
        throw new AssertionError(aggregation.kind);
    }

    public Component aggregate(InstructionKind instruction, String name, Aggregation aggregation, VariableId result) {
        Term fold = fold(aggregation);
        Set<VariableId> consumed = new TreeSet<>();
        fold.collectVariables(consumed);
        List<Predicate> assumptions = consumed.stream().map(Predicate::isBoolean).collect(Collectors.toList());
        Predicate definition = Predicate.eq(result, fold);
        Contract contract = new Contract(name, assumptions, Collections.singletonList(definition),
                Collections.singletonList(definition));
        return new Component(instruction, contract, Component.Kind.AGGREGATOR, OptionalInt.empty(), false, false);
    }

    private static List<Term> vars(List<VariableId> ids) {
        return ids.stream().map(Terms::var).collect(Collectors.toList());
    }
}
