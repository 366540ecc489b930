package nibbler.emit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import nibbler.contract.*;

import static com.google.common.truth.Truth.assertThat;
import static nibbler.decompose.InstructionKind.ADD;
import static org.junit.jupiter.api.Assertions.*;

public class SizeBudgetEnforcerTest {

    /**
     * Component with the given number of <code>add_rI=add_aI</code> constraints
     */
    static Component component(String name, int constraints) {
        List<Predicate> predicates = new ArrayList<>();
        for (int i = 0; i < constraints; i++) {
            predicates.add(Predicate.eq(VariableId.bit(ADD, Role.RESULT, i), Terms.var(VariableId.bit(ADD, Role.OPERAND_A, i))));
        }
        return new Component(ADD, new Contract(name, Collections.emptyList(), predicates, predicates),
                Component.Kind.CHECK, java.util.OptionalInt.empty(), false, false);
    }

    @Test
    public void testDefaultLimit() {
        assertEquals(700, new SizeBudgetEnforcer().limit);
    }

    @Test
    public void testAcceptsShortExpressions() {
        assertFalse(new SizeBudgetEnforcer().check(component("short", 4)).isPresent());
    }

    @Test
    public void testRejectsLongExpressions() {
        Component component = component("long", 100);
        Optional<ExpressionTooLong> error = new SizeBudgetEnforcer().check(component);
        assertTrue(error.isPresent());
        assertEquals("long", error.get().component);
        assertEquals(component.expression().length(), error.get().actualLength);
        assertEquals(700, error.get().limit);
        assertThrows(ExpressionTooLong.class, () -> new SizeBudgetEnforcer().enforce(component));
    }

    @Test
    public void testLimitIsInclusive() {
        Component component = component("exact", 3);
        int length = component.expression().length();
        assertFalse(new SizeBudgetEnforcer(length).check(component).isPresent());
        assertTrue(new SizeBudgetEnforcer(length - 1).check(component).isPresent());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 801, 10000})
    public void testInvalidLimits(int limit) {
        assertThrows(IllegalArgumentException.class, () -> new SizeBudgetEnforcer(limit));
    }

    @Test
    public void testMessageNamesComponent() {
        ExpressionTooLong error = new SizeBudgetEnforcer(10).check(component("add_nibble_0", 4)).get();
        assertThat(error.getMessage()).contains("add_nibble_0");
    }
}
