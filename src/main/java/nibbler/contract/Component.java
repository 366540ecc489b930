package nibbler.contract;

import java.util.Objects;
import java.util.OptionalInt;

import nibbler.decompose.InstructionKind;
import nibbler.util.Lazy;

import static nibbler.util.Lazy.l;

/**
 * A contract that is emitted as one solver query
 */
public final class Component {

    public enum Kind {
        NIBBLE, LINK, AGGREGATOR, CHECK;

        @Override
        public String toString() {
            return name().toLowerCase();
        }
    }

    public final InstructionKind instruction;
    public final Contract contract;
    public final Kind kind;
    public final OptionalInt nibbleIndex;
    /**
     * Whether the component consumes a carry (or shift or state) bit from a neighbouring nibble
     */
    public final boolean carryIn;
    /**
     * Whether the component exports a carry (or shift or state) bit to a neighbouring nibble
     */
    public final boolean carryOut;

    private final Lazy<String> expression;

    public Component(InstructionKind instruction, Contract contract, Kind kind, OptionalInt nibbleIndex,
                     boolean carryIn, boolean carryOut) {
        this.instruction = Objects.requireNonNull(instruction);
        this.contract = Objects.requireNonNull(contract);
        this.kind = Objects.requireNonNull(kind);
        this.nibbleIndex = Objects.requireNonNull(nibbleIndex);
        this.carryIn = carryIn;
        this.carryOut = carryOut;
        this.expression = l(contract::expression);
    }

    public static Component nibble(InstructionKind instruction, Contract contract, int nibble,
                                   boolean carryIn, boolean carryOut) {
        return new Component(instruction, contract, Kind.NIBBLE, OptionalInt.of(nibble), carryIn, carryOut);
    }

    public String name() {
        return contract.name;
    }

    public ComponentRef ref() {
        return new ComponentRef(instruction, contract.name);
    }

    /**
     * Text of the solve command, computed once
     */
    public String expression() {
        return expression.get();
    }

    public int constraintCount() {
        return contract.constraints.size();
    }

    @Override
    public String toString() {
        return String.format("%s %s (%d constraints)", kind, contract.name, constraintCount());
    }
}
