package nibbler.contract;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Assume/guarantee contract of a component: if the assumptions hold, the constraints imply the
 * guarantees. Immutable, {@link #variables} always contains every variable that any predicate mentions.
 */
public class Contract {

    public static final String CONJUNCTION = " && ";

    public final String name;
    public final List<Predicate> assumptions;
    public final List<Predicate> guarantees;
    public final List<Predicate> constraints;
    public final SortedSet<VariableId> variables;

    public Contract(String name, List<? extends Predicate> assumptions, List<? extends Predicate> guarantees,
                    List<? extends Predicate> constraints) {
        this(name, assumptions, guarantees, constraints, Collections.emptySet());
    }

    public Contract(String name, List<? extends Predicate> assumptions, List<? extends Predicate> guarantees,
                    List<? extends Predicate> constraints, Collection<VariableId> extraVariables) {
        this.name = Objects.requireNonNull(name);
        this.assumptions = Collections.unmodifiableList(new ArrayList<>(assumptions));
        this.guarantees = Collections.unmodifiableList(new ArrayList<>(guarantees));
        this.constraints = Collections.unmodifiableList(new ArrayList<>(constraints));
        SortedSet<VariableId> vars = new TreeSet<>(extraVariables);
        Stream.of(this.assumptions, this.guarantees, this.constraints)
                .flatMap(List::stream).forEach(p -> p.collectVariables(vars));
        this.variables = Collections.unmodifiableSortedSet(vars);
    }

    public boolean mentions(VariableId variable) {
        return variables.contains(variable);
    }

    /**
     * Assumptions followed by the constraints, the part of the query the solver has to satisfy
     */
    public List<Predicate> clauses() {
        List<Predicate> clauses = new ArrayList<>(assumptions);
        clauses.addAll(constraints);
        return clauses;
    }

    /**
     * The body of the solve command, its length is what the size budget restricts
     */
    public String expression() {
        return clauses().stream().map(Predicate::toString).collect(Collectors.joining(CONJUNCTION));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Contract)) {
            return false;
        }
        Contract contract = (Contract) o;
        return name.equals(contract.name) && assumptions.equals(contract.assumptions) &&
                guarantees.equals(contract.guarantees) && constraints.equals(contract.constraints) &&
                variables.equals(contract.variables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, assumptions, guarantees, constraints, variables);
    }

    @Override
    public String toString() {
        return String.format("%s: assume %s, guarantee %s", name, assumptions, guarantees);
    }
}
