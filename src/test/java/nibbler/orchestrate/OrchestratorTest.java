package nibbler.orchestrate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import nibbler.NibblerError;
import nibbler.contract.*;
import nibbler.decompose.*;
import nibbler.emit.ExpressionTooLong;

import static com.google.common.truth.Truth.assertThat;
import static nibbler.decompose.InstructionKind.*;
import static org.junit.jupiter.api.Assertions.*;

public class OrchestratorTest {

    private static GenerationOptions.Builder options() {
        return GenerationOptions.builder().width(16).workers(4);
    }

    /**
     * Decomposes as usual and adds one component that is far too long
     */
    private static DecompositionRule oversized() {
        NibbleDecomposer decomposer = new NibbleDecomposer();
        return (instruction, context) -> {
            Decomposition decomposition = decomposer.decompose(instruction, context);
            List<Predicate> predicates = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                predicates.add(Predicate.eq(VariableId.bit(instruction, Role.RESULT, i),
                        Terms.var(VariableId.bit(instruction, Role.OPERAND_A, i))));
            }
            List<Component> components = new ArrayList<>(decomposition.components);
            components.add(new Component(instruction, new Contract(instruction.namespace + "_huge",
                    Collections.emptyList(), predicates, predicates), Component.Kind.CHECK, OptionalInt.empty(),
                    false, false));
            return new Decomposition(instruction, components, decomposition.links, decomposition.inputs,
                    decomposition.outputs, decomposition.imports);
        };
    }

    @Test
    public void testAllInstructionsComplete() {
        GenerationResult result = new Orchestrator(options().build()).runAll();
        assertEquals(InstructionKind.values().length, result.reports.size());
        assertTrue(result.allComplete(), result::toString);
        assertEquals(0, result.exitCode(true));
        assertThat(result.waves).hasSize(2);
        assertThat(result.waves.get(1)).containsExactly(JZ, JNZ);
        assertEquals(1, result.report(JZ).wave);
        assertEquals(0, result.report(EQ).wave);
    }

    @Test
    public void testDependenciesAreIncluded() {
        GenerationResult result = new Orchestrator(options().build()).run(Collections.singletonList(JZ));
        assertThat(result.reports.keySet()).containsExactly(EQ, JZ);
        assertEquals(InstructionState.COMPLETE, result.state(JZ));
    }

    @Test
    public void testDependentStartsAfterDependency() {
        List<InstructionKind> order = Collections.synchronizedList(new ArrayList<>());
        NibbleDecomposer decomposer = new NibbleDecomposer();
        DecompositionRule recording = (instruction, context) -> {
            if (instruction == EQ) {
                try {
                    Thread.sleep(200);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            order.add(instruction);
            return decomposer.decompose(instruction, context);
        };
        RuleRegistry rules = RuleRegistry.standard().with(EQ, recording).with(JZ, recording);
        GenerationResult result = new Orchestrator(options().build(), rules).run(Arrays.asList(JZ, EQ));
        assertThat(order).containsExactly(EQ, JZ).inOrder();
        assertTrue(result.allComplete());
    }

    @Test
    public void testDeterministicFiles(@TempDir Path tmp) throws IOException {
        Path first = tmp.resolve("first");
        Path second = tmp.resolve("second");
        new Orchestrator(options().outputDirectory(first).build()).runAll();
        new Orchestrator(options().outputDirectory(second).workers(1).build()).runAll();
        List<Path> files = files(first);
        assertEquals(files, files(second));
        assertThat(files).contains(Path.of("add", "add_nibble_0.tau"));
        assertThat(files).contains(Path.of("manifest.json"));
        for (Path file : files) {
            assertArrayEquals(Files.readAllBytes(first.resolve(file)), Files.readAllBytes(second.resolve(file)),
                    file.toString());
        }
    }

    private static List<Path> files(Path directory) throws IOException {
        try (Stream<Path> stream = Files.walk(directory)) {
            return stream.filter(Files::isRegularFile).map(directory::relativize).sorted()
                    .collect(Collectors.toList());
        }
    }

    @Test
    public void testOversizedComponentsAreRejected(@TempDir Path tmp) {
        RuleRegistry rules = RuleRegistry.standard().with(XOR, oversized());
        GenerationResult result = new Orchestrator(options().outputDirectory(tmp).build(), rules)
                .run(Arrays.asList(XOR, ADD, OR));
        InstructionReport xor = result.report(XOR);
        assertEquals(InstructionState.PARTIALLY_FAILED, xor.state);
        assertThat(xor.rejections).hasSize(1);
        ExpressionTooLong rejection = xor.rejections.get(0);
        assertEquals("xor_huge", rejection.component);
        assertEquals(700, rejection.limit);
        assertEquals(4, xor.passed());
        assertFalse(xor.plan().get().component("xor_huge").isPresent());
        assertFalse(Files.exists(tmp.resolve("xor").resolve("xor_huge.tau")));
        assertTrue(Files.exists(tmp.resolve("xor").resolve("xor_nibble_3.tau")));
        assertEquals(InstructionState.COMPLETE, result.state(ADD));
        assertEquals(InstructionState.COMPLETE, result.state(OR));
        assertEquals(1, result.exitCode(true));
        assertEquals(0, result.exitCode(false));
    }

    @Test
    public void testTightBudgetRejectsEveryLongComponent() {
        GenerationResult result = new Orchestrator(options().maxExpressionChars(100).build())
                .run(Collections.singletonList(ADD));
        InstructionReport add = result.report(ADD);
        assertEquals(InstructionState.PARTIALLY_FAILED, add.state);
        Set<String> rejected = add.rejections.stream().map(r -> r.component).collect(Collectors.toSet());
        assertEquals(add.rejections.size(), rejected.size());
        assertThat(rejected).containsExactly("add_nibble_0", "add_nibble_1", "add_nibble_2", "add_nibble_3");
        assertEquals(3, add.passed());
    }

    @Test
    public void testMissingRule() {
        GenerationResult result = new Orchestrator(options().build(), RuleRegistry.standard().without(SUB))
                .run(Arrays.asList(ADD, SUB));
        InstructionReport sub = result.report(SUB);
        assertEquals(InstructionState.FAILED, sub.state);
        assertThat(sub.error().get()).isInstanceOf(UnknownInstruction.class);
        assertFalse(sub.plan().isPresent());
        assertEquals(InstructionState.COMPLETE, result.state(ADD));
    }

    @Test
    public void testFailedDependency() {
        DecompositionRule failing = (instruction, context) -> {
            throw new NibblerError("comparison unavailable");
        };
        GenerationResult result = new Orchestrator(options().build(), RuleRegistry.standard().with(EQ, failing))
                .run(Arrays.asList(JZ, JNZ));
        assertEquals(InstructionState.FAILED, result.state(EQ));
        assertEquals(InstructionState.FAILED, result.state(JZ));
        assertThat(result.report(JZ).error().get()).isInstanceOf(DependencyTimeout.class);
        assertEquals(InstructionState.COMPLETE, result.state(JNZ));
        assertEquals(InstructionState.COMPLETE, result.state(NEQ));
    }

    @Test
    public void testPartiallyFailedDependencyFailsDependent() {
        GenerationResult result = new Orchestrator(options().build(), RuleRegistry.standard().with(EQ, oversized()))
                .run(Collections.singletonList(JZ));
        assertEquals(InstructionState.PARTIALLY_FAILED, result.state(EQ));
        assertThat(result.report(JZ).error().get()).isInstanceOf(DependencyTimeout.class);
    }

    @Test
    public void testDependencyTimeout() {
        NibbleDecomposer decomposer = new NibbleDecomposer();
        DecompositionRule slow = (instruction, context) -> {
            try {
                Thread.sleep(1500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return decomposer.decompose(instruction, context);
        };
        GenerationOptions options = options().dependencyTimeout(Duration.ofMillis(100)).build();
        GenerationResult result = new Orchestrator(options, RuleRegistry.standard().with(EQ, slow))
                .run(Collections.singletonList(JZ));
        assertEquals(InstructionState.COMPLETE, result.state(EQ));
        assertEquals(InstructionState.FAILED, result.state(JZ));
        assertThat(result.report(JZ).error().get()).isInstanceOf(DependencyTimeout.class);
    }

    @Test
    public void testCyclicDependencies() {
        GenerationOptions options = options().dependency(EQ, JZ).build();
        assertThrows(NibblerError.class, () -> new Orchestrator(options).run(Collections.singletonList(JZ)));
    }

    @Test
    public void testManifest(@TempDir Path tmp) throws IOException {
        GenerationResult result = new Orchestrator(options().outputDirectory(tmp).build(), RuleRegistry.standard()
                .without(HASH)).run(Arrays.asList(ADD, HASH));
        JsonNode manifest = new ObjectMapper().readTree(tmp.resolve(Manifest.FILE_NAME).toFile());
        assertEquals(16, manifest.get("width").asInt());
        assertEquals(700, manifest.get("maxExpressionChars").asInt());
        JsonNode add = manifest.get("instructions").get("ADD");
        assertEquals("COMPLETE", add.get("status").asText());
        assertEquals(7, add.get("passed").asInt());
        assertEquals("add/add_nibble_0.tau", add.get("files").get(0).asText());
        assertThat(add.get("contracts").get("add_link_co0_ci1").get("guarantees").get(0).asText())
                .isEqualTo("add_ci1=add_co0");
        JsonNode hash = manifest.get("instructions").get("HASH");
        assertEquals("FAILED", hash.get("status").asText());
        assertThat(hash.get("errors").get(0).asText()).contains("HASH");
        assertThrows(IllegalStateException.class, () -> result.manifest.record(result.report(ADD),
                Optional.of(tmp)));
    }
}
