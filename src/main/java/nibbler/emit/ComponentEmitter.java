package nibbler.emit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import nibbler.contract.Component;
import nibbler.contract.InstructionPlan;
import nibbler.contract.Predicate;
import nibbler.decompose.InstructionKind;

/**
 * Writes components in the text format of the solver, one file per component:
 *
 * <pre>
 * # Component: add_nibble_0
 * # Assumptions: ...
 * # Guarantees: ...
 *
 * solve ...
 *
 * quit
 * </pre>
 */
public class ComponentEmitter {

    public static final String FILE_EXTENSION = ".tau";

    public String render(Component component) {
        StringBuilder builder = new StringBuilder();
        builder.append("# Component: ").append(component.name()).append("\n");
        builder.append("# Assumptions: ").append(join(component.contract.assumptions)).append("\n");
        builder.append("# Guarantees: ").append(join(component.contract.guarantees)).append("\n");
        builder.append("\n");
        builder.append("solve ").append(component.expression()).append("\n");
        builder.append("\n");
        builder.append("quit\n");
        return builder.toString();
    }

    private String join(List<Predicate> predicates) {
        return predicates.stream().map(Predicate::toString).collect(Collectors.joining(", "));
    }

    public static Path directory(Path outputDirectory, InstructionKind instruction) {
        return outputDirectory.resolve(instruction.mnemonic().toLowerCase());
    }

    public Path write(Component component, Path directory) {
        Path file = directory.resolve(component.name() + FILE_EXTENSION);
        try {
            Files.createDirectories(directory);
            Files.write(file, render(component).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("Cannot write component %s", component.name()), e);
        }
        return file;
    }

    /**
     * Writes every component of the plan into the directory of its instruction
     *
     * @return written files in component order
     */
    public List<Path> write(InstructionPlan plan, Path outputDirectory) {
        Path directory = directory(outputDirectory, plan.instruction);
        List<Path> files = new ArrayList<>();
        for (Component component : plan.components) {
            files.add(write(component, directory));
        }
        return files;
    }
}
