package nibbler.decompose;

import java.util.Collections;
import java.util.OptionalInt;

import nibbler.contract.*;

/**
 * Creates the components that connect a bit exported by one nibble component with the
 * bit that a neighbouring nibble component consumes. Used for carries, borrows, shifted
 * out bits and crypto state bits alike.
 */
public class CarryLinker {

    /**
     * @throws IllegalArgumentException if the link refers to variables that its endpoints do not mention
     */
    public Component link(Component from, Component to, VariableId produced, VariableId consumed) {
        if (!from.contract.mentions(produced)) {
            throw new IllegalArgumentException(String.format("%s does not produce %s", from.name(), produced));
        }
        if (!to.contract.mentions(consumed)) {
            throw new IllegalArgumentException(String.format("%s does not consume %s", to.name(), consumed));
        }
        return link(LinkSpec.between(from, to, produced, consumed));
    }

    public Component link(LinkSpec spec) {
        Predicate transfer = Predicate.eq(spec.consumed, spec.produced);
        Contract contract = new Contract(name(spec),
                Collections.singletonList(Predicate.isBoolean(spec.produced)),
                Collections.singletonList(transfer),
                Collections.singletonList(transfer));
        return new Component(spec.from.instruction, contract, Component.Kind.LINK, OptionalInt.empty(),
                true, true);
    }

    static String name(LinkSpec spec) {
        return spec.from.instruction.namespace + "_link_" + spec.produced.role.token + spec.produced.index()
                + "_" + spec.consumed.role.token + spec.consumed.index();
    }
}
