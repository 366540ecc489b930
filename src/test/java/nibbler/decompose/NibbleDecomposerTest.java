package nibbler.decompose;

import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import nibbler.contract.*;

import static com.google.common.truth.Truth.assertThat;
import static nibbler.contract.Role.*;
import static nibbler.decompose.InstructionKind.*;
import static nibbler.decompose.InstructionKind.EQ;
import static nibbler.decompose.InstructionKind.LT;
import static org.junit.jupiter.api.Assertions.*;

public class NibbleDecomposerTest {

    private final NibbleDecomposer decomposer = new NibbleDecomposer();

    private Decomposition decompose(InstructionKind instruction, int width) {
        return decomposer.decompose(instruction, new DecompositionContext(width));
    }

    private static long count(Decomposition decomposition, Component.Kind kind) {
        return decomposition.components.stream().filter(c -> c.kind == kind).count();
    }

    @ParameterizedTest
    @ValueSource(ints = {4, 8, 16, 32})
    public void testCarryChainShape(int width) {
        int nibbles = width / 4;
        Decomposition add = decompose(ADD, width);
        assertEquals(nibbles, count(add, Component.Kind.NIBBLE));
        assertEquals(nibbles - 1, count(add, Component.Kind.LINK));
        assertEquals(nibbles - 1, add.links.size());
        for (int i = 0; i + 1 < add.links.size(); i++) {
            assertEquals(new Namespace(ADD).nibble(CARRY_OUT, i), add.links.get(i).produced);
            assertEquals(new Namespace(ADD).nibble(CARRY_IN, i + 1), add.links.get(i).consumed);
        }
    }

    @Test
    public void testCarryFlags() {
        Decomposition add = decompose(ADD, 32);
        Component first = add.components.get(0);
        Component last = add.components.get(7);
        assertFalse(first.carryIn);
        assertTrue(first.carryOut);
        assertTrue(last.carryIn);
        assertFalse(last.carryOut);
        assertTrue(last.contract.mentions(VariableId.word(ADD, OVERFLOW)));
        assertEquals(7, last.nibbleIndex.getAsInt());
    }

    @ParameterizedTest
    @EnumSource(value = InstructionKind.class, names = {"AND", "OR", "XOR", "NOT"})
    public void testParallelHasNoLinks(InstructionKind instruction) {
        Decomposition decomposition = decompose(instruction, 32);
        assertThat(decomposition.links).isEmpty();
        assertThat(decomposition.components).hasSize(8);
        assertTrue(decomposition.components.stream().noneMatch(c -> c.carryIn || c.carryOut));
    }

    @Test
    public void testShiftRightUnderflow() {
        Decomposition shr = decompose(SHR, 8);
        Namespace ns = new Namespace(SHR);
        Component nibble0 = shr.components.get(0);
        assertTrue(nibble0.contract.mentions(ns.word(UNDERFLOW)));
        assertFalse(nibble0.contract.mentions(ns.nibble(SHIFT_OUT, 0)));
        assertThat(shr.links).hasSize(1);
        LinkSpec link = shr.links.get(0);
        assertEquals(ns.nibble(SHIFT_OUT, 1), link.produced);
        assertEquals(ns.nibble(SHIFT_IN, 0), link.consumed);
        assertEquals("shr_nibble_0", link.to.name);
    }

    @Test
    public void testShiftLeftOverflow() {
        Decomposition shl = decompose(SHL, 16);
        Namespace ns = new Namespace(SHL);
        assertTrue(shl.components.get(3).contract.mentions(ns.word(OVERFLOW)));
        assertThat(shl.links).hasSize(3);
        assertFalse(shl.components.get(0).contract.mentions(ns.nibble(SHIFT_IN, 0)));
    }

    @ParameterizedTest
    @EnumSource(value = InstructionKind.class, names = {"ROL", "ROR"})
    public void testRotationsWrapAround(InstructionKind instruction) {
        Decomposition rotation = decompose(instruction, 32);
        assertThat(rotation.links).hasSize(8);
        Set<String> names = rotation.links.stream().map(l -> l.from.name + ">" + l.to.name).collect(Collectors.toSet());
        String ns = instruction.namespace;
        if (instruction == ROL) {
            assertThat(names).contains(ns + "_nibble_7>" + ns + "_nibble_0");
        } else {
            assertThat(names).contains(ns + "_nibble_0>" + ns + "_nibble_7");
        }
        assertThat(rotation.outputs.stream().map(o -> o.name).collect(Collectors.toList())).containsExactly("r");
    }

    @Test
    public void testComparisonAggregators() {
        Decomposition lt = decompose(LT, 8);
        assertEquals(2, count(lt, Component.Kind.NIBBLE));
        assertEquals(2, count(lt, Component.Kind.AGGREGATOR));
        assertThat(lt.links).isEmpty();
        assertThat(lt.outputs.stream().map(o -> o.name).collect(Collectors.toList()))
                .containsExactly("ltfinal", "eqfinal");

        Decomposition gte = decompose(GTE, 32);
        assertEquals(3, count(gte, Component.Kind.AGGREGATOR));
        assertThat(gte.outputs.stream().map(o -> o.name).collect(Collectors.toList()))
                .containsExactly("gtfinal", "gtefinal", "eqfinal");

        Decomposition neq = decompose(NEQ, 32);
        assertEquals(1, count(neq, Component.Kind.AGGREGATOR));
        assertTrue(neq.components.get(8).contract.mentions(VariableId.word(NEQ, NEQ_FINAL)));
    }

    @Test
    public void testMemorySplit() {
        Decomposition load = decompose(LOAD, 32);
        assertEquals(16, count(load, Component.Kind.NIBBLE));
        assertEquals(1, count(load, Component.Kind.CHECK));
        assertThat(load.links).isEmpty();
        Component check = load.components.get(16);
        assertEquals("ld_address_check", check.name());
        assertTrue(check.contract.mentions(VariableId.word(LOAD, ALIGNED)));
        Component byteCheck = decompose(MLOAD, 32).components.get(16);
        assertFalse(byteCheck.contract.mentions(VariableId.word(MLOAD, ALIGNED)));
    }

    @Test
    public void testStack() {
        Decomposition push = decompose(PUSH, 32);
        assertEquals(16, count(push, Component.Kind.NIBBLE));
        assertThat(push.links).hasSize(7);
        Decomposition swap = decompose(SWAP, 32);
        assertEquals(8, count(swap, Component.Kind.NIBBLE));
        assertThat(swap.links).isEmpty();
    }

    @Test
    public void testConditionalJumpImportsComparison() {
        assertThat(decompose(JZ, 32).imports).containsExactly(VariableId.word(EQ, EQ_FINAL));
        assertThat(decompose(JNZ, 32).imports).containsExactly(VariableId.word(NEQ, NEQ_FINAL));
        assertThat(decompose(JMP, 32).imports).isEmpty();
        assertThat(decompose(JMP, 32).links).isEmpty();
    }

    @Test
    public void testCallUsesSeparateCarryChains() {
        Decomposition call = decompose(CALL, 16);
        Set<Role> consumed = call.links.stream().map(l -> l.consumed.role).collect(Collectors.toSet());
        assertThat(consumed).containsExactly(CARRY_IN, SP_CARRY_IN);
        assertThat(call.links).hasSize(6);
    }

    @Test
    public void testCryptoStateLinks() {
        Decomposition hash = decompose(HASH, 16);
        assertEquals(4, count(hash, Component.Kind.NIBBLE));
        assertThat(hash.links).hasSize(12);
        assertTrue(hash.links.stream().allMatch(l -> l.produced.role == STATE_OUT && l.consumed.role == STATE_IN));
        assertThat(hash.outputs.get(0).name).isEqualTo("digest");
        assertEquals(1, count(decompose(VERIFY, 16), Component.Kind.AGGREGATOR));
    }

    @Test
    public void testMixingFunctionIsExchangeable() {
        DecompositionContext rotate = new DecompositionContext(8, 8, new RotateXorMixing());
        DecompositionContext fold = new DecompositionContext(8, 8, new XorFoldMixing());
        Decomposition a = decomposer.decompose(HASH, rotate);
        Decomposition b = decomposer.decompose(HASH, fold);
        assertEquals(a.components.size(), b.components.size());
        assertEquals(a.links, b.links);
        assertNotEquals(a.components.get(0).expression(), b.components.get(0).expression());
    }

    @ParameterizedTest
    @EnumSource(InstructionKind.class)
    public void testNamesAreUniqueAndNamespaced(InstructionKind instruction) {
        Decomposition decomposition = decompose(instruction, 32);
        Set<String> names = decomposition.components.stream().map(Component::name).collect(Collectors.toSet());
        assertEquals(decomposition.components.size(), names.size());
        assertTrue(names.stream().allMatch(n -> n.startsWith(instruction.namespace + "_")));
        assertTrue(decomposition.components.stream().allMatch(c -> c.instruction == instruction));
    }

    @Test
    public void testDeterminism() {
        for (InstructionKind instruction : InstructionKind.values()) {
            assertEquals(decompose(instruction, 32).components.stream().map(Component::expression)
                            .collect(Collectors.toList()),
                    decompose(instruction, 32).components.stream().map(Component::expression)
                            .collect(Collectors.toList()), instruction.toString());
        }
    }
}
