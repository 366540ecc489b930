package nibbler.contract;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;
import static nibbler.contract.Predicate.eq;
import static nibbler.contract.Predicate.isBoolean;
import static nibbler.contract.Terms.*;
import static nibbler.decompose.InstructionKind.ADD;
import static org.junit.jupiter.api.Assertions.*;

public class ContractTest {

    private final VariableId a = VariableId.bit(ADD, Role.OPERAND_A, 0, 0);
    private final VariableId b = VariableId.bit(ADD, Role.OPERAND_B, 0, 0);
    private final VariableId s = VariableId.bit(ADD, Role.SUM, 0, 0);
    private final VariableId ci = VariableId.nibble(ADD, Role.CARRY_IN, 1);

    private Contract contract() {
        Predicate sum = eq(s, xor(var(a), var(b), var(ci)));
        return new Contract("add_nibble_1", Collections.singletonList(isBoolean(ci)),
                Collections.singletonList(sum), Collections.singletonList(sum));
    }

    @Test
    public void testExpressionIsAssumptionsAndConstraints() {
        assertEquals("(add_ci1=0|add_ci1=1) && add_s0=(add_a0+add_b0+add_ci1)", contract().expression());
        assertThat(contract().clauses()).hasSize(2);
    }

    @Test
    public void testVariables() {
        Contract contract = contract();
        assertThat(contract.variables).containsExactly(a, b, s, ci).inOrder();
        assertTrue(contract.mentions(ci));
        assertFalse(contract.mentions(VariableId.nibble(ADD, Role.CARRY_OUT, 1)));
    }

    @Test
    public void testExtraVariables() {
        VariableId unused = VariableId.word(ADD, Role.OVERFLOW);
        Contract contract = new Contract("c", Collections.emptyList(), Collections.emptyList(),
                Collections.singletonList(eq(s, var(a))), Arrays.asList(unused));
        assertTrue(contract.mentions(unused));
    }

    @Test
    public void testComponentExpressionIsCached() {
        Component component = Component.nibble(ADD, contract(), 1, true, false);
        assertSame(component.expression(), component.expression());
        assertEquals(1, component.constraintCount());
        assertEquals("add_nibble_1", component.name());
        assertEquals(new ComponentRef(ADD, "add_nibble_1"), component.ref());
    }
}
