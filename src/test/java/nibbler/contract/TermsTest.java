package nibbler.contract;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.google.common.truth.Truth.assertThat;
import static nibbler.contract.Terms.*;
import static nibbler.decompose.InstructionKind.ADD;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class TermsTest {

    private final Term a = var(VariableId.bit(ADD, Role.OPERAND_A, 0, 0));
    private final Term b = var(VariableId.bit(ADD, Role.OPERAND_B, 0, 0));

    @Test
    public void testConstantFolding() {
        assertEquals(ZERO, and(a, ZERO));
        assertEquals(a, and(a, ONE));
        assertEquals(ONE, or(a, ONE));
        assertEquals(a, or(ZERO, a));
        assertEquals(a, xor(a, ZERO));
        assertEquals(not(a), xor(a, ONE));
        assertEquals(ONE, not(ZERO));
    }

    @Test
    public void testComplementaryOperands() {
        assertEquals(ZERO, and(a, not(a)));
        assertEquals(ONE, or(not(a), a));
    }

    @Test
    public void testDoubleNegation() {
        assertEquals(a, not(not(a)));
    }

    @Test
    public void testFlattening() {
        Term term = and(and(a, b), var(VariableId.bit(ADD, Role.SUM, 0, 0)));
        assertThat(term).isInstanceOf(Term.Op.class);
        assertThat(((Term.Op) term).operands).hasSize(3);
        assertEquals("add_a0&add_b0&add_s0", term.toString());
    }

    @Test
    public void testRendering() {
        assertEquals("(add_a0+add_b0)'", equal(a, b).toString());
        assertEquals("add_a0'&add_b0", and(not(a), b).toString());
        assertEquals("(add_a0&add_b0)|add_a0'", or(and(a, b), not(a)).toString());
        assertEquals("add_a1=(add_a0|add_b0)",
                Predicate.eq(VariableId.bit(ADD, Role.OPERAND_A, 1), or(a, b)).toString());
        assertEquals("(add_co0=0|add_co0=1)", Predicate.isBoolean(VariableId.nibble(ADD, Role.CARRY_OUT, 0)).toString());
    }

    @ParameterizedTest
    @CsvSource({"0,0,0", "0,1,1", "1,0,1", "1,1,0"})
    public void testXorEvaluation(int x, int y, int expected) {
        Map<VariableId, B> assignment = new HashMap<>();
        assignment.put(VariableId.bit(ADD, Role.OPERAND_A, 0, 0), B.of(x == 1));
        assignment.put(VariableId.bit(ADD, Role.OPERAND_B, 0, 0), B.of(y == 1));
        assertEquals(B.of(expected == 1), xor(a, b).evaluate(assignment::get));
        assertEquals(B.of(expected == 0), equal(a, b).evaluate(assignment::get));
    }

    @Test
    public void testUnknownPropagation() {
        Map<VariableId, B> assignment = new HashMap<>();
        assignment.put(VariableId.bit(ADD, Role.OPERAND_A, 0, 0), B.ZERO);
        assignment.put(VariableId.bit(ADD, Role.OPERAND_B, 0, 0), B.U);
        assertEquals(B.ZERO, and(a, b).evaluate(assignment::get));
        assertEquals(B.U, or(a, b).evaluate(assignment::get));
        assertEquals(B.U, xor(a, b).evaluate(assignment::get));
    }
}
