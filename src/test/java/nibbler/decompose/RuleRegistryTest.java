package nibbler.decompose;

import java.util.Collections;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.google.common.truth.Truth.assertThat;
import static nibbler.decompose.InstructionKind.*;
import static org.junit.jupiter.api.Assertions.*;

public class RuleRegistryTest {

    @Test
    public void testStandardCoversEveryInstruction() {
        RuleRegistry registry = RuleRegistry.standard();
        assertThat(registry.instructions()).containsExactlyElementsIn(InstructionKind.values());
    }

    @Test
    public void testMissingRule() {
        RuleRegistry registry = RuleRegistry.standard().without(ADD);
        assertFalse(registry.has(ADD));
        UnknownInstruction error = assertThrows(UnknownInstruction.class, () -> registry.rule(ADD));
        assertEquals("ADD", error.instruction);
        assertTrue(RuleRegistry.standard().has(ADD));
    }

    @Test
    public void testReplacedRule() {
        DecompositionRule empty = (instruction, context) -> new Decomposition(instruction, Collections.emptyList(),
                Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), Collections.emptySet());
        RuleRegistry registry = RuleRegistry.empty().with(XOR, empty);
        assertSame(empty, registry.rule(XOR));
        assertThat(registry.instructions()).containsExactly(XOR);
    }

    @Test
    public void testMnemonics() {
        assertEquals(JZ, InstructionKind.from("jz"));
        assertEquals(MSTORE, InstructionKind.from(" MSTORE "));
        UnknownInstruction error = assertThrows(UnknownInstruction.class, () -> InstructionKind.from("MUL"));
        assertThat(error.getMessage()).contains("ADD");
    }

    @Test
    public void testDependencies() {
        assertThat(JZ.dependencies()).containsExactly(EQ);
        assertThat(JNZ.dependencies()).containsExactly(NEQ);
        assertThat(ADD.dependencies()).isEmpty();
        assertThat(InstructionKind.ofFamily(OperationFamily.PARALLEL)).containsExactly(AND, OR, XOR, NOT);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 6, 36, -4})
    public void testInvalidWidths(int width) {
        assertThrows(IllegalArgumentException.class, () -> new DecompositionContext(width));
    }

    @Test
    public void testMixingFunctions() {
        assertThat(MixingFunction.from("xor-fold")).isInstanceOf(XorFoldMixing.class);
        assertThat(MixingFunction.from("Rotate-Xor")).isInstanceOf(RotateXorMixing.class);
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> MixingFunction.from("sha"));
        assertThat(error.getMessage()).contains("rotate-xor, xor-fold");
    }
}
