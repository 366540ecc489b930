package nibbler.contract;

import java.util.*;

import nibbler.contract.Term.*;

/**
 * Factory methods for terms that fold constants and trivial operands away
 */
public class Terms {

    public static final Const ZERO = new Const(B.ZERO);
    public static final Const ONE = new Const(B.ONE);

    private Terms() {
    }

    public static Const constant(boolean value) {
        return value ? ONE : ZERO;
    }

    public static Const constant(B value) {
        return value == B.ONE ? ONE : ZERO;
    }

    public static Var var(VariableId id) {
        return new Var(id);
    }

    public static Term not(Term term) {
        if (term instanceof Const) {
            return constant(((Const) term).value.neg());
        }
        if (term instanceof Not) {
            return ((Not) term).operand;
        }
        return new Not(term);
    }

    public static Term and(Term... terms) {
        return and(Arrays.asList(terms));
    }

    public static Term and(List<? extends Term> terms) {
        List<Term> operands = new ArrayList<>();
        for (Term term : flatten(Term.Operator.AND, terms)) {
            if (term.equals(ZERO) || operands.contains(not(term))) {
                return ZERO;
            }
            if (!term.equals(ONE) && !operands.contains(term)) {
                operands.add(term);
            }
        }
        return build(Term.Operator.AND, operands, ONE);
    }

    public static Term or(Term... terms) {
        return or(Arrays.asList(terms));
    }

    public static Term or(List<? extends Term> terms) {
        List<Term> operands = new ArrayList<>();
        for (Term term : flatten(Term.Operator.OR, terms)) {
            if (term.equals(ONE) || operands.contains(not(term))) {
                return ONE;
            }
            if (!term.equals(ZERO) && !operands.contains(term)) {
                operands.add(term);
            }
        }
        return build(Term.Operator.OR, operands, ZERO);
    }

    public static Term xor(Term... terms) {
        return xor(Arrays.asList(terms));
    }

    /**
     * Constants are folded into a final negation, so <code>a+b+1</code> becomes <code>(a+b)'</code>
     */
    public static Term xor(List<? extends Term> terms) {
        List<Term> operands = new ArrayList<>();
        boolean negate = false;
        for (Term term : flatten(Term.Operator.XOR, terms)) {
            if (term instanceof Const) {
                negate ^= ((Const) term).value == B.ONE;
            } else {
                operands.add(term);
            }
        }
        Term result = build(Term.Operator.XOR, operands, ZERO);
        return negate ? not(result) : result;
    }

    /**
     * <code>a = b</code> as a term: <code>(a+b)'</code>
     */
    public static Term equal(Term a, Term b) {
        return not(xor(a, b));
    }

    private static List<Term> flatten(Term.Operator operator, List<? extends Term> terms) {
        List<Term> result = new ArrayList<>();
        for (Term term : terms) {
            if (term instanceof Op && ((Op) term).operator == operator) {
                result.addAll(((Op) term).operands);
            } else {
                result.add(Objects.requireNonNull(term));
            }
        }
        return result;
    }

    private static Term build(Term.Operator operator, List<Term> operands, Const neutral) {
        switch (operands.size()) {
            case 0:
                return neutral;
            case 1:
                return operands.get(0);
            default:
                return new Op(operator, operands);
        }
    }
}
