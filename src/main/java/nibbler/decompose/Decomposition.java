package nibbler.decompose;

import java.util.*;

import nibbler.contract.*;

/**
 * Everything a decomposition rule produces for one instruction, before the size budget is checked
 */
public class Decomposition {

    public final InstructionKind instruction;
    /**
     * Nibble components first, then link components, then aggregators and checks
     */
    public final List<Component> components;
    public final List<LinkSpec> links;
    public final List<Operand> inputs;
    public final List<Operand> outputs;
    public final Set<VariableId> imports;

    public Decomposition(InstructionKind instruction, List<Component> components, List<LinkSpec> links,
                         List<Operand> inputs, List<Operand> outputs, Set<VariableId> imports) {
        this.instruction = instruction;
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
        this.links = Collections.unmodifiableList(new ArrayList<>(links));
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
        this.imports = Collections.unmodifiableSet(new TreeSet<>(imports));
        Set<String> names = new HashSet<>();
        for (Component component : components) {
            if (!names.add(component.name())) {
                throw new IllegalArgumentException("Duplicate component name " + component.name());
            }
        }
    }

    /**
     * Plan of the given subset of the components
     */
    public InstructionPlan toPlan(List<Component> accepted) {
        return new InstructionPlan(instruction, accepted, links, inputs, outputs, imports);
    }

    public InstructionPlan toPlan() {
        return toPlan(components);
    }
}
