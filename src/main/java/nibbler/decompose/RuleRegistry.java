package nibbler.decompose;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable mapping from instructions to the rules that decompose them
 */
public class RuleRegistry {

    private final Map<InstructionKind, DecompositionRule> rules;

    private RuleRegistry(Map<InstructionKind, DecompositionRule> rules) {
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
    }

    public static RuleRegistry empty() {
        return new RuleRegistry(new EnumMap<>(InstructionKind.class));
    }

    /**
     * Every instruction is decomposed by the {@link NibbleDecomposer}
     */
    public static RuleRegistry standard() {
        NibbleDecomposer decomposer = new NibbleDecomposer();
        Map<InstructionKind, DecompositionRule> rules = new EnumMap<>(InstructionKind.class);
        for (InstructionKind kind : InstructionKind.values()) {
            rules.put(kind, decomposer);
        }
        return new RuleRegistry(rules);
    }

    public RuleRegistry with(InstructionKind instruction, DecompositionRule rule) {
        Map<InstructionKind, DecompositionRule> copy = new EnumMap<>(InstructionKind.class);
        copy.putAll(rules);
        copy.put(instruction, rule);
        return new RuleRegistry(copy);
    }

    public RuleRegistry without(InstructionKind instruction) {
        Map<InstructionKind, DecompositionRule> copy = new EnumMap<>(InstructionKind.class);
        copy.putAll(rules);
        copy.remove(instruction);
        return new RuleRegistry(copy);
    }

    public boolean has(InstructionKind instruction) {
        return rules.containsKey(instruction);
    }

    public DecompositionRule rule(InstructionKind instruction) {
        DecompositionRule rule = rules.get(instruction);
        if (rule == null) {
            throw new UnknownInstruction(instruction.mnemonic(), "no decomposition rule registered");
        }
        return rule;
    }

    public Set<InstructionKind> instructions() {
        return rules.keySet();
    }
}
