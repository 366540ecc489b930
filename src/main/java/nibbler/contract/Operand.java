package nibbler.contract;

import java.util.*;

import nibbler.util.Util;

/**
 * An instruction level input or output, its bits are ordered from the least significant one
 */
public final class Operand {

    public final String name;
    public final List<VariableId> bits;

    public Operand(String name, List<VariableId> bits) {
        if (bits.isEmpty() || bits.size() > Long.SIZE - 1) {
            throw new IllegalArgumentException(String.format("Operand %s has %d bits", name, bits.size()));
        }
        this.name = Objects.requireNonNull(name);
        this.bits = Collections.unmodifiableList(new ArrayList<>(bits));
    }

    public static Operand flag(VariableId variable) {
        return new Operand(variable.role.token, Collections.singletonList(variable));
    }

    public int width() {
        return bits.size();
    }

    /**
     * Assigns the bits of the (unsigned) value to the variables
     */
    public Map<VariableId, Boolean> bind(long value) {
        Map<VariableId, Boolean> assignment = new LinkedHashMap<>();
        List<Boolean> values = Util.toBits(value, bits.size());
        for (int i = 0; i < bits.size(); i++) {
            assignment.put(bits.get(i), values.get(i));
        }
        return assignment;
    }

    /**
     * Reads the value back, empty if some bit is not assigned
     */
    public OptionalLong read(Map<VariableId, Boolean> assignment) {
        List<Boolean> values = new ArrayList<>();
        for (VariableId bit : bits) {
            Boolean value = assignment.get(bit);
            if (value == null) {
                return OptionalLong.empty();
            }
            values.add(value);
        }
        return OptionalLong.of(Util.fromBits(values));
    }

    @Override
    public String toString() {
        return String.format("%s[%d]", name, bits.size());
    }
}
