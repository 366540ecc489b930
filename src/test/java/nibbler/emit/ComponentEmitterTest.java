package nibbler.emit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import nibbler.contract.Component;
import nibbler.contract.InstructionPlan;
import nibbler.decompose.DecompositionContext;
import nibbler.decompose.NibbleDecomposer;

import static com.google.common.truth.Truth.assertThat;
import static nibbler.decompose.InstructionKind.ADD;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class ComponentEmitterTest {

    @Test
    public void testEnvelope() {
        Component component = SizeBudgetEnforcerTest.component("add_nibble_0", 2);
        assertEquals("# Component: add_nibble_0\n" +
                "# Assumptions: \n" +
                "# Guarantees: add_r0=add_a0, add_r1=add_a1\n" +
                "\n" +
                "solve add_r0=add_a0 && add_r1=add_a1\n" +
                "\n" +
                "quit\n", new ComponentEmitter().render(component));
    }

    @Test
    public void testWritePlan(@TempDir Path out) throws IOException {
        InstructionPlan plan = new NibbleDecomposer().decompose(ADD, new DecompositionContext(8)).toPlan();
        List<Path> files = new ComponentEmitter().write(plan, out);
        assertThat(files).hasSize(3);
        assertEquals(out.resolve("add").resolve("add_nibble_0.tau"), files.get(0));
        String text = new String(Files.readAllBytes(files.get(2)), StandardCharsets.UTF_8);
        assertThat(text).startsWith("# Component: add_link_co0_ci1\n");
        assertThat(text).contains("solve (add_co0=0|add_co0=1) && add_ci1=add_co0\n");
    }
}
