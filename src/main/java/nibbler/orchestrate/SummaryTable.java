package nibbler.orchestrate;

import java.util.*;
import java.util.stream.Collectors;

import de.vandermeer.asciitable.AsciiTable;
import de.vandermeer.asciithemes.TA_GridThemes;
import de.vandermeer.skb.interfaces.transformers.textformat.TextAlignment;

import nibbler.decompose.InstructionKind;
import nibbler.solver.ComponentVerifier;

/**
 * Formats the result of a run, either as a table for the console or as csv
 */
public class SummaryTable {

    public enum Mode {
        NICE, CSV
    }

    private static final List<String> HEADER = Arrays.asList("instruction", "wave", "state", "passed", "failed",
            "constraints", "ms");

    private final GenerationResult result;
    private final Map<InstructionKind, ComponentVerifier.Tally> tallies;

    public SummaryTable(GenerationResult result) {
        this(result, Collections.emptyMap());
    }

    public SummaryTable(GenerationResult result, Map<InstructionKind, ComponentVerifier.Tally> tallies) {
        this.result = result;
        this.tallies = tallies;
    }

    List<List<String>> lines() {
        List<List<String>> lines = new ArrayList<>();
        List<String> header = new ArrayList<>(HEADER);
        if (!tallies.isEmpty()) {
            header.add("satisfiable");
            header.add("unproven");
        }
        lines.add(header);
        for (InstructionReport report : result.reports.values()) {
            List<String> line = new ArrayList<>(Arrays.asList(report.instruction.mnemonic(),
                    String.valueOf(report.wave), report.state.toString(), String.valueOf(report.passed()),
                    String.valueOf(report.failed()),
                    String.valueOf(report.plan().map(p -> p.totalConstraintCount).orElse(0)),
                    String.valueOf(report.duration.toMillis())));
            if (!tallies.isEmpty()) {
                ComponentVerifier.Tally tally = tallies.get(report.instruction);
                line.add(tally == null ? "-" : String.valueOf(tally.satisfiable));
                line.add(tally == null ? "-" : String.valueOf(tally.unproven));
            }
            lines.add(line);
        }
        return lines;
    }

    public String render(Mode mode) {
        List<List<String>> lines = lines();
        if (mode == Mode.CSV) {
            return lines.stream().map(cols -> String.join(",", cols)).collect(Collectors.joining("\n"));
        }
        AsciiTable at = new AsciiTable();
        at.addRule();
        for (List<String> line : lines) {
            at.addRow(line);
            at.addRule();
        }
        at.setTextAlignment(TextAlignment.RIGHT);
        at.getContext().setGridTheme(TA_GridThemes.TOPBOTTOM);
        return at.render(120);
    }

    @Override
    public String toString() {
        return render(Mode.NICE);
    }
}
