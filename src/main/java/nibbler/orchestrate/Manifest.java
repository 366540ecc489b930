package nibbler.orchestrate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import nibbler.contract.Component;
import nibbler.contract.Contract;
import nibbler.contract.Predicate;
import nibbler.decompose.InstructionKind;
import nibbler.emit.ExpressionTooLong;
import nibbler.solver.ComponentVerifier;

/**
 * Summary of a run: files, contracts and counts per instruction. Every instruction is recorded
 * at most once, the manifest is only read for reporting.
 */
public class Manifest {

    public static final String FILE_NAME = "manifest.json";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    public static class ContractEntry {
        public final List<String> assumptions;
        public final List<String> guarantees;
        public final List<String> variables;

        ContractEntry(Contract contract) {
            this.assumptions = render(contract.assumptions);
            this.guarantees = render(contract.guarantees);
            this.variables = contract.variables.stream().map(Object::toString).collect(Collectors.toList());
        }

        private static List<String> render(List<Predicate> predicates) {
            return predicates.stream().map(Predicate::toString).collect(Collectors.toList());
        }
    }

    public static class Entry {
        public final String status;
        public final int wave;
        public final int passed;
        public final int failed;
        public final List<String> files;
        public final List<String> errors;
        public final Map<String, ContractEntry> contracts;

        Entry(InstructionReport report, Optional<Path> outputDirectory) {
            this.status = report.state.name();
            this.wave = report.wave;
            this.passed = report.passed();
            this.failed = report.failed();
            this.files = report.files.stream()
                    .map(f -> outputDirectory.map(d -> d.relativize(f)).orElse(f).toString().replace('\\', '/'))
                    .collect(Collectors.toList());
            List<String> errors = report.rejections.stream().map(ExpressionTooLong::getMessage)
                    .collect(Collectors.toList());
            report.error().ifPresent(e -> errors.add(e.getMessage()));
            this.errors = errors;
            Map<String, ContractEntry> contracts = new LinkedHashMap<>();
            report.plan().ifPresent(p -> {
                for (Component component : p.components) {
                    contracts.put(component.name(), new ContractEntry(component.contract));
                }
            });
            this.contracts = contracts;
        }
    }

    public static class ValidationEntry {
        public final int satisfiable;
        public final int unproven;
        public final List<String> unprovenComponents;

        ValidationEntry(ComponentVerifier.Tally tally) {
            this.satisfiable = tally.satisfiable;
            this.unproven = tally.unproven;
            this.unprovenComponents = tally.unprovenComponents;
        }
    }

    public final int width;
    public final int maxExpressionChars;
    private final ConcurrentMap<InstructionKind, Entry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<InstructionKind, ValidationEntry> validations = new ConcurrentHashMap<>();

    public Manifest(int width, int maxExpressionChars) {
        this.width = width;
        this.maxExpressionChars = maxExpressionChars;
    }

    /**
     * @throws IllegalStateException if the instruction has already been recorded
     */
    public void record(InstructionReport report, Optional<Path> outputDirectory) {
        if (entries.putIfAbsent(report.instruction, new Entry(report, outputDirectory)) != null) {
            throw new IllegalStateException(report.instruction + " is already recorded in the manifest");
        }
    }

    public void recordValidation(InstructionKind instruction, ComponentVerifier.Tally tally) {
        if (validations.putIfAbsent(instruction, new ValidationEntry(tally)) != null) {
            throw new IllegalStateException(instruction + " is already validated");
        }
    }

    public Optional<Entry> entry(InstructionKind instruction) {
        return Optional.ofNullable(entries.get(instruction));
    }

    public Optional<ValidationEntry> validation(InstructionKind instruction) {
        return Optional.ofNullable(validations.get(instruction));
    }

    public String toJson() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("width", width);
        root.put("maxExpressionChars", maxExpressionChars);
        root.put("instructions", byMnemonic(entries));
        if (!validations.isEmpty()) {
            root.put("validation", byMnemonic(validations));
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize the manifest", e);
        }
    }

    public Path write(Path directory) {
        Path file = directory.resolve(FILE_NAME);
        try {
            Files.createDirectories(directory);
            Files.write(file, (toJson() + "\n").getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write the manifest", e);
        }
        return file;
    }

    private static <V> Map<String, V> byMnemonic(Map<InstructionKind, V> map) {
        Map<String, V> result = new TreeMap<>();
        map.forEach((k, v) -> result.put(k.mnemonic(), v));
        return result;
    }
}
