package nibbler.contract;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A boolean clause of a contract
 */
public abstract class Predicate {

    public abstract B evaluate(Function<VariableId, B> assignment);

    public abstract void collectVariables(Set<VariableId> variables);

    public Set<VariableId> variables() {
        Set<VariableId> variables = new TreeSet<>();
        collectVariables(variables);
        return variables;
    }

    public static Equation eq(Term left, Term right) {
        return new Equation(left, right);
    }

    public static Equation eq(VariableId left, Term right) {
        return new Equation(Terms.var(left), right);
    }

    public static Equation eq(VariableId left, VariableId right) {
        return new Equation(Terms.var(left), Terms.var(right));
    }

    public static AnyOf anyOf(Predicate... predicates) {
        return new AnyOf(Arrays.asList(predicates));
    }

    /**
     * <code>(v=0|v=1)</code>
     */
    public static AnyOf isBoolean(VariableId variable) {
        return anyOf(eq(variable, Terms.ZERO), eq(variable, Terms.ONE));
    }

    /**
     * <code>left=right</code>
     */
    public static class Equation extends Predicate {

        public final Term left;
        public final Term right;

        Equation(Term left, Term right) {
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        @Override
        public B evaluate(Function<VariableId, B> assignment) {
            return left.evaluate(assignment).xor(right.evaluate(assignment)).neg();
        }

        @Override
        public void collectVariables(Set<VariableId> variables) {
            left.collectVariables(variables);
            right.collectVariables(variables);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Equation && ((Equation) o).left.equals(left) && ((Equation) o).right.equals(right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(left, right);
        }

        @Override
        public String toString() {
            return left.renderAsOperand() + "=" + right.renderAsOperand();
        }
    }

    /**
     * Disjunction of predicates
     */
    public static class AnyOf extends Predicate {

        public final List<Predicate> predicates;

        AnyOf(List<Predicate> predicates) {
            if (predicates.isEmpty()) {
                throw new IllegalArgumentException("Empty disjunction");
            }
            this.predicates = Collections.unmodifiableList(new ArrayList<>(predicates));
        }

        @Override
        public B evaluate(Function<VariableId, B> assignment) {
            B result = B.ZERO;
            for (Predicate predicate : predicates) {
                result = result.or(predicate.evaluate(assignment));
            }
            return result;
        }

        @Override
        public void collectVariables(Set<VariableId> variables) {
            predicates.forEach(p -> p.collectVariables(variables));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof AnyOf && ((AnyOf) o).predicates.equals(predicates);
        }

        @Override
        public int hashCode() {
            return predicates.hashCode();
        }

        @Override
        public String toString() {
            return predicates.stream().map(Predicate::toString).collect(Collectors.joining("|", "(", ")"));
        }
    }
}
