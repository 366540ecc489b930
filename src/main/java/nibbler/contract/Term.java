package nibbler.contract;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Boolean term of the solver language. Use {@link Terms} to build simplified terms.
 */
public abstract class Term {

    public enum Operator {
        AND("&"), OR("|"), XOR("+");

        public final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }
    }

    public abstract B evaluate(Function<VariableId, B> assignment);

    public abstract void collectVariables(Set<VariableId> variables);

    /**
     * Whether the term has to be wrapped in parentheses when used as an operand
     */
    boolean isCompound() {
        return false;
    }

    String renderAsOperand() {
        return isCompound() ? "(" + this + ")" : toString();
    }

    public static class Const extends Term {

        public final B value;

        Const(B value) {
            if (!value.isConstant()) {
                throw new IllegalArgumentException("Constant terms have to be 0 or 1");
            }
            this.value = value;
        }

        @Override
        public B evaluate(Function<VariableId, B> assignment) {
            return value;
        }

        @Override
        public void collectVariables(Set<VariableId> variables) {
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Const && ((Const) o).value == value;
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    public static class Var extends Term {

        public final VariableId id;

        Var(VariableId id) {
            this.id = Objects.requireNonNull(id);
        }

        @Override
        public B evaluate(Function<VariableId, B> assignment) {
            return assignment.apply(id);
        }

        @Override
        public void collectVariables(Set<VariableId> variables) {
            variables.add(id);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Var && ((Var) o).id.equals(id);
        }

        @Override
        public int hashCode() {
            return id.hashCode();
        }

        @Override
        public String toString() {
            return id.toString();
        }
    }

    public static class Not extends Term {

        public final Term operand;

        Not(Term operand) {
            this.operand = Objects.requireNonNull(operand);
        }

        @Override
        public B evaluate(Function<VariableId, B> assignment) {
            return operand.evaluate(assignment).neg();
        }

        @Override
        public void collectVariables(Set<VariableId> variables) {
            operand.collectVariables(variables);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Not && ((Not) o).operand.equals(operand);
        }

        @Override
        public int hashCode() {
            return ~operand.hashCode();
        }

        @Override
        public String toString() {
            return operand.renderAsOperand() + "'";
        }
    }

    public static class Op extends Term {

        public final Operator operator;
        public final List<Term> operands;

        Op(Operator operator, List<Term> operands) {
            if (operands.size() < 2) {
                throw new IllegalArgumentException("Operations need at least two operands");
            }
            this.operator = operator;
            this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        }

        @Override
        public B evaluate(Function<VariableId, B> assignment) {
            B result = operands.get(0).evaluate(assignment);
            for (Term operand : operands.subList(1, operands.size())) {
                B value = operand.evaluate(assignment);
                switch (operator) {
                    case AND:
                        result = result.and(value);
                        break;
                    case OR:
                        result = result.or(value);
                        break;
                    case XOR:
                        result = result.xor(value);
                        break;
                }
            }
            return result;
        }

        @Override
        public void collectVariables(Set<VariableId> variables) {
            operands.forEach(o -> o.collectVariables(variables));
        }

        @Override
        boolean isCompound() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Op && ((Op) o).operator == operator && ((Op) o).operands.equals(operands);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, operands);
        }

        @Override
        public String toString() {
            return operands.stream().map(Term::renderAsOperand).collect(Collectors.joining(operator.symbol));
        }
    }
}
