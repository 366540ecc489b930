package nibbler.decompose;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

import static nibbler.decompose.OperationFamily.*;

/**
 * All instructions that can be decomposed. The set is closed, decomposers switch over it exhaustively.
 */
public enum InstructionKind {
    ADD("add", CARRY_CHAIN),
    SUB("sub", CARRY_CHAIN),

    AND("and", PARALLEL),
    OR("or", PARALLEL),
    XOR("xor", PARALLEL),
    NOT("not", PARALLEL),

    SHL("shl", SHIFT),
    SHR("shr", SHIFT),
    ROL("rol", SHIFT),
    ROR("ror", SHIFT),

    EQ("eq", COMPARISON),
    NEQ("neq", COMPARISON),
    LT("lt", COMPARISON),
    GT("gt", COMPARISON),
    LTE("lte", COMPARISON),
    GTE("gte", COMPARISON),

    LOAD("ld", MEMORY_SPLIT),
    STORE("st", MEMORY_SPLIT),
    MLOAD("mld", MEMORY_SPLIT),
    MSTORE("mst", MEMORY_SPLIT),

    PUSH("push", STACK),
    POP("pop", STACK),
    DUP("dup", STACK),
    SWAP("swap", STACK),

    JMP("jmp", CONTROL_FLOW),
    JZ("jz", CONTROL_FLOW),
    JNZ("jnz", CONTROL_FLOW),
    CALL("call", CONTROL_FLOW),
    RET("ret", CONTROL_FLOW),
    NOP("nop", CONTROL_FLOW),
    HALT("halt", CONTROL_FLOW),

    HASH("hash", CRYPTO_CHAIN),
    SIGN("sign", CRYPTO_CHAIN),
    VERIFY("vfy", CRYPTO_CHAIN);

    /**
     * Prefix of every variable of the instruction, unique among all instructions
     */
    public final String namespace;
    public final OperationFamily family;

    InstructionKind(String namespace, OperationFamily family) {
        this.namespace = namespace;
        this.family = family;
    }

    public String mnemonic() {
        return name();
    }

    /**
     * Instructions whose results this instruction consumes
     */
    public Set<InstructionKind> dependencies() {
        switch (this) {
            case JZ:
                return Collections.unmodifiableSet(EnumSet.of(EQ));
            case JNZ:
                return Collections.unmodifiableSet(EnumSet.of(NEQ));
            default:
                return Collections.emptySet();
        }
    }

    public static InstructionKind from(String str) {
        return Arrays.stream(values()).filter(k -> k.name().equalsIgnoreCase(str.trim())).findFirst()
                .orElseThrow(() -> new UnknownInstruction(str, String.format("valid instructions are %s",
                        Arrays.stream(values()).map(InstructionKind::name).collect(Collectors.joining(", ")))));
    }

    public static Set<InstructionKind> ofFamily(OperationFamily family) {
        return Arrays.stream(values()).filter(k -> k.family == family)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(InstructionKind.class)));
    }
}
