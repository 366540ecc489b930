package nibbler.solver;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import nibbler.contract.Component;
import nibbler.contract.VariableId;

/**
 * Solves components with the {@link PropagationSolver}, no external process needed
 */
public class InProcessSolver extends Solver {

    private final PropagationSolver solver;

    public InProcessSolver() {
        this(new PropagationSolver());
    }

    public InProcessSolver(PropagationSolver solver) {
        this.solver = solver;
    }

    @Override
    public String name() {
        return "in-process";
    }

    @Override
    public Result solve(Component component) {
        Optional<Map<VariableId, Boolean>> assignment;
        try {
            assignment = solver.solve(component.contract.clauses());
        } catch (PropagationSolver.SearchExhausted e) {
            LOG.warning(String.format("%s: %s", component.name(), e.getMessage()));
            return Result.unproven(e.getMessage());
        }
        if (!assignment.isPresent()) {
            return Result.unproven("no solution");
        }
        Map<String, Boolean> witness = new LinkedHashMap<>();
        assignment.get().forEach((v, b) -> witness.put(v.toString(), b));
        return Result.satisfiable(witness);
    }
}
