package nibbler.orchestrate;

import java.util.*;

import org.junit.jupiter.api.Test;

import nibbler.NibblerError;
import nibbler.decompose.InstructionKind;

import static com.google.common.truth.Truth.assertThat;
import static nibbler.decompose.InstructionKind.*;
import static org.junit.jupiter.api.Assertions.*;

public class DependencyGraphTest {

    @Test
    public void testTransitiveClosure() {
        DependencyGraph graph = DependencyGraph.of(Arrays.asList(JZ, ADD), InstructionKind::dependencies);
        assertThat(graph.instructions()).containsExactly(ADD, EQ, JZ);
        assertThat(graph.dependencies(JZ)).containsExactly(EQ);
        assertThat(graph.dependents(EQ)).containsExactly(JZ);
        assertThat(graph.dependencies(ADD)).isEmpty();
    }

    @Test
    public void testTopologicalOrderAndWaves() {
        Map<InstructionKind, Set<InstructionKind>> dependencies = new EnumMap<>(InstructionKind.class);
        dependencies.put(JZ, EnumSet.of(EQ));
        dependencies.put(EQ, EnumSet.of(SUB));
        dependencies.put(CALL, EnumSet.of(SUB, JZ));
        DependencyGraph graph = DependencyGraph.of(Arrays.asList(CALL, ADD),
                i -> dependencies.getOrDefault(i, Collections.emptySet()));
        List<InstructionKind> order = graph.topologicalOrder();
        assertThat(order).containsExactly(ADD, SUB, EQ, JZ, CALL).inOrder();
        assertEquals(0, graph.wave(ADD));
        assertEquals(3, graph.wave(CALL));
        assertThat(graph.waves()).containsExactly(Arrays.asList(ADD, SUB), Collections.singletonList(EQ),
                Collections.singletonList(JZ), Collections.singletonList(CALL)).inOrder();
    }

    @Test
    public void testCycle() {
        Map<InstructionKind, Set<InstructionKind>> dependencies = new EnumMap<>(InstructionKind.class);
        dependencies.put(ADD, EnumSet.of(SUB));
        dependencies.put(SUB, EnumSet.of(ADD));
        assertThrows(NibblerError.class, () -> DependencyGraph.of(Collections.singletonList(ADD),
                i -> dependencies.getOrDefault(i, Collections.emptySet())));
    }
}
