package nibbler.contract;

import java.util.*;
import java.util.stream.Collectors;

import nibbler.decompose.InstructionKind;

/**
 * The accepted components of one instruction. The plan owns its components, no other plan refers to them.
 */
public class InstructionPlan {

    public final InstructionKind instruction;
    public final List<Component> components;
    public final int totalConstraintCount;
    public final List<LinkSpec> links;
    public final List<Operand> inputs;
    public final List<Operand> outputs;
    /**
     * Variables of other instructions that this plan reads
     */
    public final Set<VariableId> imports;

    public InstructionPlan(InstructionKind instruction, List<Component> components, List<LinkSpec> links,
                           List<Operand> inputs, List<Operand> outputs, Set<VariableId> imports) {
        this.instruction = instruction;
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
        this.totalConstraintCount = components.stream().mapToInt(Component::constraintCount).sum();
        this.links = Collections.unmodifiableList(new ArrayList<>(links));
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
        this.imports = Collections.unmodifiableSet(new TreeSet<>(imports));
        components.stream().filter(c -> c.instruction != instruction).findFirst().ifPresent(c -> {
            throw new IllegalArgumentException(String.format("Component %s belongs to %s", c.name(), c.instruction));
        });
    }

    public Optional<Component> component(String name) {
        return components.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public List<Component> components(Component.Kind kind) {
        return components.stream().filter(c -> c.kind == kind).collect(Collectors.toList());
    }

    public Optional<Operand> output(String name) {
        return outputs.stream().filter(o -> o.name.equals(name)).findFirst();
    }

    public Optional<Operand> input(String name) {
        return inputs.stream().filter(o -> o.name.equals(name)).findFirst();
    }

    /**
     * Assumptions and constraints of all components, their conjunction describes the whole instruction
     */
    public List<Predicate> clauses() {
        return components.stream().flatMap(c -> c.contract.clauses().stream()).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return String.format("%s: %d components, %d links, %d constraints", instruction, components.size(),
                links.size(), totalConstraintCount);
    }
}
