package nibbler.contract;

import java.util.Objects;

import nibbler.decompose.InstructionKind;

/**
 * Names a component of an instruction without holding on to it
 */
public final class ComponentRef {

    public final InstructionKind instruction;
    public final String name;

    public ComponentRef(InstructionKind instruction, String name) {
        this.instruction = Objects.requireNonNull(instruction);
        this.name = Objects.requireNonNull(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ComponentRef)) {
            return false;
        }
        ComponentRef that = (ComponentRef) o;
        return instruction == that.instruction && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instruction, name);
    }

    @Override
    public String toString() {
        return instruction.mnemonic() + ":" + name;
    }
}
