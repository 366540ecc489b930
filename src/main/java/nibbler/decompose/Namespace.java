package nibbler.decompose;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import nibbler.contract.*;

import static nibbler.contract.VariableId.NIBBLE_WIDTH;

/**
 * Creates the variables and names of one instruction
 */
public final class Namespace {

    public final InstructionKind instruction;

    public Namespace(InstructionKind instruction) {
        this.instruction = instruction;
    }

    public VariableId bit(Role role, int nibble, int bit) {
        return VariableId.bit(instruction, role, nibble, bit);
    }

    public VariableId nibble(Role role, int nibble) {
        return VariableId.nibble(instruction, role, nibble);
    }

    public VariableId word(Role role) {
        return VariableId.word(instruction, role);
    }

    public Term term(Role role, int nibble, int bit) {
        return Terms.var(bit(role, nibble, bit));
    }

    /**
     * The four bits of a nibble, least significant first
     */
    public List<VariableId> bits(Role role, int nibble) {
        return IntStream.range(0, NIBBLE_WIDTH).mapToObj(j -> bit(role, nibble, j)).collect(Collectors.toList());
    }

    public List<Term> terms(Role role, int nibble) {
        return bits(role, nibble).stream().map(Terms::var).collect(Collectors.toList());
    }

    public List<VariableId> word(Role role, int nibbles) {
        return IntStream.range(0, nibbles).boxed().flatMap(i -> bits(role, i).stream()).collect(Collectors.toList());
    }

    public Operand operand(Role role, int nibbles) {
        return new Operand(role.token, word(role, nibbles));
    }

    public Operand flag(Role role) {
        return Operand.flag(word(role));
    }

    public String name(String suffix) {
        return instruction.namespace + "_" + suffix;
    }

    public String nibbleName(int nibble) {
        return name("nibble_" + nibble);
    }

    public String nibbleName(String part, int nibble) {
        return name(part + "_nibble_" + nibble);
    }
}
