package nibbler.orchestrate;

import java.util.*;
import java.util.stream.Collectors;

import nibbler.contract.InstructionPlan;
import nibbler.decompose.InstructionKind;

/**
 * Reports of all instructions of a run, in instruction order
 */
public class GenerationResult {

    public final Map<InstructionKind, InstructionReport> reports;
    public final List<List<InstructionKind>> waves;
    public final Manifest manifest;

    GenerationResult(Map<InstructionKind, InstructionReport> reports, List<List<InstructionKind>> waves,
                     Manifest manifest) {
        this.reports = Collections.unmodifiableMap(new EnumMap<>(reports));
        this.waves = Collections.unmodifiableList(waves.stream()
                .map(w -> Collections.unmodifiableList(new ArrayList<>(w))).collect(Collectors.toList()));
        this.manifest = manifest;
    }

    public InstructionReport report(InstructionKind instruction) {
        InstructionReport report = reports.get(instruction);
        if (report == null) {
            throw new IllegalArgumentException(instruction + " was not part of the run");
        }
        return report;
    }

    public InstructionState state(InstructionKind instruction) {
        return report(instruction).state;
    }

    /**
     * Plans of all instructions that were decomposed, including partially failed ones
     */
    public Map<InstructionKind, InstructionPlan> plans() {
        Map<InstructionKind, InstructionPlan> plans = new EnumMap<>(InstructionKind.class);
        reports.forEach((k, r) -> r.plan().ifPresent(p -> plans.put(k, p)));
        return plans;
    }

    public long count(InstructionState state) {
        return reports.values().stream().filter(r -> r.state == state).count();
    }

    public boolean allComplete() {
        return count(InstructionState.COMPLETE) == reports.size();
    }

    /**
     * Non zero only in strict mode, if some instruction did not complete
     */
    public int exitCode(boolean strict) {
        return strict && !allComplete() ? 1 : 0;
    }

    @Override
    public String toString() {
        return reports.values().stream().map(InstructionReport::toString).collect(Collectors.joining("\n"));
    }
}
