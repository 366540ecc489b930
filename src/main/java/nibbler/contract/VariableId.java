package nibbler.contract;

import java.util.Comparator;
import java.util.Objects;

import nibbler.decompose.InstructionKind;

/**
 * Structured identity of a solver variable. {@link #toString()} is the only place where the
 * textual variable name is produced.
 */
public final class VariableId implements Comparable<VariableId> {

    public static final int NIBBLE_WIDTH = 4;

    private static final Comparator<VariableId> ORDER = Comparator
            .comparing((VariableId v) -> v.instruction)
            .thenComparing(v -> v.role)
            .thenComparingInt(v -> v.nibble)
            .thenComparingInt(v -> v.bit);

    public final InstructionKind instruction;
    public final Role role;
    /**
     * -1 for word scoped roles
     */
    public final int nibble;
    /**
     * Bit inside the nibble, -1 for nibble and word scoped roles
     */
    public final int bit;

    private VariableId(InstructionKind instruction, Role role, int nibble, int bit) {
        this.instruction = Objects.requireNonNull(instruction);
        this.role = Objects.requireNonNull(role);
        this.nibble = nibble;
        this.bit = bit;
    }

    public static VariableId bit(InstructionKind instruction, Role role, int nibble, int bit) {
        if (role.scope != Role.Scope.BIT) {
            throw new IllegalArgumentException(String.format("Role %s is %s scoped", role.name(), role.scope));
        }
        if (nibble < 0 || bit < 0 || bit >= NIBBLE_WIDTH) {
            throw new IllegalArgumentException(String.format("Invalid bit position %d of nibble %d", bit, nibble));
        }
        return new VariableId(instruction, role, nibble, bit);
    }

    /**
     * Bit variable addressed by its position in the word
     */
    public static VariableId bit(InstructionKind instruction, Role role, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative bit index " + index);
        }
        return bit(instruction, role, index / NIBBLE_WIDTH, index % NIBBLE_WIDTH);
    }

    public static VariableId nibble(InstructionKind instruction, Role role, int nibble) {
        if (role.scope != Role.Scope.NIBBLE) {
            throw new IllegalArgumentException(String.format("Role %s is %s scoped", role.name(), role.scope));
        }
        if (nibble < 0) {
            throw new IllegalArgumentException("Negative nibble index " + nibble);
        }
        return new VariableId(instruction, role, nibble, -1);
    }

    public static VariableId word(InstructionKind instruction, Role role) {
        if (role.scope != Role.Scope.WORD) {
            throw new IllegalArgumentException(String.format("Role %s is %s scoped", role.name(), role.scope));
        }
        return new VariableId(instruction, role, -1, -1);
    }

    /**
     * Position of a bit variable in the whole word
     */
    public int index() {
        switch (role.scope) {
            case BIT:
                return nibble * NIBBLE_WIDTH + bit;
            case NIBBLE:
                return nibble;
            default:
                return -1;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VariableId)) {
            return false;
        }
        VariableId that = (VariableId) o;
        return nibble == that.nibble && bit == that.bit && instruction == that.instruction && role == that.role;
    }

    @Override
    public int hashCode() {
        return Objects.hash(instruction, role, nibble, bit);
    }

    @Override
    public int compareTo(VariableId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        String name = instruction.namespace + "_" + role.token;
        return role.scope == Role.Scope.WORD ? name : name + index();
    }
}
