package nibbler.solver;

import java.util.*;

import nibbler.NibblerError;
import nibbler.contract.B;
import nibbler.contract.Predicate;
import nibbler.contract.Term;
import nibbler.contract.VariableId;

/**
 * Small in process solver for conjunctions of contract predicates: unit propagation over
 * equations whose one side is a (possibly negated) variable, and backtracking over the
 * remaining free variables in variable order.
 */
public class PropagationSolver {

    public static final int DEFAULT_MAX_DECISIONS = 1 << 16;

    private final int maxDecisions;

    public PropagationSolver() {
        this(DEFAULT_MAX_DECISIONS);
    }

    public PropagationSolver(int maxDecisions) {
        this.maxDecisions = maxDecisions;
    }

    /**
     * Thrown when the decision budget is exhausted, the clauses might still be satisfiable
     */
    public static class SearchExhausted extends NibblerError {
        SearchExhausted(int decisions) {
            super(String.format("Gave up after %d decisions", decisions));
        }
    }

    private enum Outcome {
        CONFLICT, PROGRESS, NOTHING
    }

    /**
     * @param fixed values that the variables are bound to beforehand
     * @return a satisfying assignment of all mentioned variables, empty if there is none
     * @throws SearchExhausted if the decision budget is not sufficient
     */
    public Optional<Map<VariableId, Boolean>> solve(List<Predicate> predicates, Map<VariableId, Boolean> fixed) {
        SortedSet<VariableId> variables = new TreeSet<>(fixed.keySet());
        predicates.forEach(p -> p.collectVariables(variables));
        Map<VariableId, B> assignment = new HashMap<>();
        fixed.forEach((v, b) -> assignment.put(v, B.of(b)));
        int[] decisions = {0};
        return search(predicates, new ArrayList<>(variables), assignment, decisions).map(result -> {
            Map<VariableId, Boolean> witness = new TreeMap<>();
            result.forEach((v, b) -> witness.put(v, b.toBoolean()));
            return witness;
        });
    }

    public Optional<Map<VariableId, Boolean>> solve(List<Predicate> predicates) {
        return solve(predicates, Collections.emptyMap());
    }

    private Optional<Map<VariableId, B>> search(List<Predicate> predicates, List<VariableId> variables,
                                                Map<VariableId, B> assignment, int[] decisions) {
        if (!propagate(predicates, assignment)) {
            return Optional.empty();
        }
        Optional<VariableId> free = variables.stream().filter(v -> !assignment.containsKey(v)).findFirst();
        if (!free.isPresent()) {
            boolean satisfied = predicates.stream().allMatch(p -> p.evaluate(v -> value(assignment, v)) == B.ONE);
            return satisfied ? Optional.of(assignment) : Optional.empty();
        }
        for (B value : Arrays.asList(B.ZERO, B.ONE)) {
            if (++decisions[0] > maxDecisions) {
                throw new SearchExhausted(maxDecisions);
            }
            Map<VariableId, B> copy = new HashMap<>(assignment);
            copy.put(free.get(), value);
            Optional<Map<VariableId, B>> result = search(predicates, variables, copy, decisions);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    /**
     * @return false on a conflict
     */
    private boolean propagate(List<Predicate> predicates, Map<VariableId, B> assignment) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Predicate predicate : predicates) {
                Outcome outcome = propagate(predicate, assignment);
                if (outcome == Outcome.CONFLICT) {
                    return false;
                }
                changed |= outcome == Outcome.PROGRESS;
            }
        }
        return true;
    }

    private Outcome propagate(Predicate predicate, Map<VariableId, B> assignment) {
        B value = predicate.evaluate(v -> value(assignment, v));
        if (value == B.ONE) {
            return Outcome.NOTHING;
        }
        if (value == B.ZERO) {
            return Outcome.CONFLICT;
        }
        if (predicate instanceof Predicate.Equation) {
            Predicate.Equation equation = (Predicate.Equation) predicate;
            B left = equation.left.evaluate(v -> value(assignment, v));
            B right = equation.right.evaluate(v -> value(assignment, v));
            if (right.isConstant() && assign(equation.left, right, assignment)) {
                return Outcome.PROGRESS;
            }
            if (left.isConstant() && assign(equation.right, left, assignment)) {
                return Outcome.PROGRESS;
            }
        }
        return Outcome.NOTHING;
    }

    /**
     * Makes the term evaluate to the value, if it is a variable or a negated variable
     */
    private boolean assign(Term term, B value, Map<VariableId, B> assignment) {
        if (term instanceof Term.Var) {
            assignment.put(((Term.Var) term).id, value);
            return true;
        }
        if (term instanceof Term.Not && ((Term.Not) term).operand instanceof Term.Var) {
            assignment.put(((Term.Var) ((Term.Not) term).operand).id, value.neg());
            return true;
        }
        return false;
    }

    private static B value(Map<VariableId, B> assignment, VariableId variable) {
        return assignment.getOrDefault(variable, B.U);
    }
}
