package nibbler.vm;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

import nibbler.contract.InstructionPlan;
import nibbler.contract.Operand;
import nibbler.contract.VariableId;
import nibbler.decompose.InstructionKind;
import nibbler.decompose.UnknownInstruction;
import nibbler.solver.PropagationSolver;

/**
 * Validates instructions by solving the clauses of their plans with the inputs bound
 */
public class PlanValidator implements ConstraintValidator {

    public static final Logger LOG = Logger.getLogger("Validation");

    static {
        LOG.setLevel(Level.INFO);
    }

    private final Map<InstructionKind, InstructionPlan> plans;
    private final ViolationPolicy policy;
    private final PropagationSolver solver;
    private final AtomicLong validations = new AtomicLong();
    private final List<ConstraintViolation> violations = Collections.synchronizedList(new ArrayList<>());

    public PlanValidator(Map<InstructionKind, InstructionPlan> plans) {
        this(plans, ViolationPolicy.RECORD);
    }

    public PlanValidator(Map<InstructionKind, InstructionPlan> plans, ViolationPolicy policy) {
        this(plans, policy, new PropagationSolver());
    }

    public PlanValidator(Map<InstructionKind, InstructionPlan> plans, ViolationPolicy policy,
                         PropagationSolver solver) {
        this.plans = Collections.unmodifiableMap(new EnumMap<>(plans));
        this.policy = policy;
        this.solver = solver;
    }

    /**
     * @throws UnknownInstruction if there is no plan for the instruction
     * @throws ConstraintViolation on a violation if the policy is {@link ViolationPolicy#HALT}
     */
    @Override
    public boolean validate(InstructionKind instruction, long[] inputs, long[] outputs) {
        validations.incrementAndGet();
        InstructionPlan plan = plan(instruction);
        if (outputs.length != plan.outputs.size()) {
            return violation(instruction, String.format("expected %d outputs, got %d", plan.outputs.size(),
                    outputs.length));
        }
        Map<VariableId, Boolean> solution;
        try {
            solution = solve(plan, inputs);
        } catch (ConstraintViolation e) {
            return violation(e);
        }
        for (int i = 0; i < outputs.length; i++) {
            Operand operand = plan.outputs.get(i);
            OptionalLong expected = operand.read(solution);
            if (!expected.isPresent()) {
                return violation(instruction, String.format("output %s is not determined", operand.name));
            }
            if (expected.getAsLong() != outputs[i]) {
                return violation(instruction, String.format("output %s is %d, expected %d", operand.name,
                        outputs[i], expected.getAsLong()));
            }
        }
        return true;
    }

    /**
     * Outputs that the constraints allow for the inputs
     *
     * @throws ConstraintViolation if the inputs do not fit the plan or admit no solution
     */
    public long[] execute(InstructionKind instruction, long... inputs) {
        InstructionPlan plan = plan(instruction);
        Map<VariableId, Boolean> solution = solve(plan, inputs);
        long[] outputs = new long[plan.outputs.size()];
        for (int i = 0; i < outputs.length; i++) {
            Operand operand = plan.outputs.get(i);
            outputs[i] = operand.read(solution).orElseThrow(() ->
                    new ConstraintViolation(instruction, String.format("output %s is not determined", operand.name)));
        }
        return outputs;
    }

    public long validations() {
        return validations.get();
    }

    public List<ConstraintViolation> violations() {
        synchronized (violations) {
            return new ArrayList<>(violations);
        }
    }

    private InstructionPlan plan(InstructionKind instruction) {
        InstructionPlan plan = plans.get(instruction);
        if (plan == null) {
            throw new UnknownInstruction(instruction.mnemonic(), "no plan to validate against");
        }
        return plan;
    }

    private Map<VariableId, Boolean> solve(InstructionPlan plan, long[] inputs) {
        InstructionKind instruction = plan.instruction;
        if (inputs.length != plan.inputs.size()) {
            throw new ConstraintViolation(instruction, String.format("expected %d inputs, got %d",
                    plan.inputs.size(), inputs.length));
        }
        Map<VariableId, Boolean> binding = new HashMap<>();
        for (int i = 0; i < inputs.length; i++) {
            try {
                binding.putAll(plan.inputs.get(i).bind(inputs[i]));
            } catch (IllegalArgumentException e) {
                throw new ConstraintViolation(instruction, String.format("input %s: %s", plan.inputs.get(i).name,
                        e.getMessage()));
            }
        }
        try {
            return solver.solve(plan.clauses(), binding).orElseThrow(() ->
                    new ConstraintViolation(instruction, "the inputs admit no solution"));
        } catch (PropagationSolver.SearchExhausted e) {
            throw new ConstraintViolation(instruction, e.getMessage());
        }
    }

    private boolean violation(InstructionKind instruction, String reason) {
        return violation(new ConstraintViolation(instruction, reason));
    }

    private boolean violation(ConstraintViolation violation) {
        if (policy == ViolationPolicy.HALT) {
            throw violation;
        }
        LOG.warning(violation.getMessage());
        violations.add(violation);
        return false;
    }
}
