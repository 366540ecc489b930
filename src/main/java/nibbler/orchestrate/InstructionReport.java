package nibbler.orchestrate;

import java.nio.file.Path;
import java.time.Duration;
import java.util.*;

import javax.annotation.Nullable;

import nibbler.NibblerError;
import nibbler.contract.InstructionPlan;
import nibbler.decompose.InstructionKind;
import nibbler.emit.ExpressionTooLong;

/**
 * Outcome of the generation of one instruction
 */
public class InstructionReport {

    public final InstructionKind instruction;
    public final InstructionState state;
    public final int wave;
    /**
     * Accepted components, null if the instruction failed before decomposition
     */
    @Nullable
    public final InstructionPlan plan;
    public final List<ExpressionTooLong> rejections;
    /**
     * Error that failed the whole instruction
     */
    @Nullable
    public final NibblerError error;
    public final List<Path> files;
    public final Duration duration;

    InstructionReport(InstructionKind instruction, InstructionState state, int wave, @Nullable InstructionPlan plan,
                      List<ExpressionTooLong> rejections, @Nullable NibblerError error, List<Path> files,
                      Duration duration) {
        this.instruction = instruction;
        this.state = state;
        this.wave = wave;
        this.plan = plan;
        this.rejections = Collections.unmodifiableList(new ArrayList<>(rejections));
        this.error = error;
        this.files = Collections.unmodifiableList(new ArrayList<>(files));
        this.duration = duration;
    }

    static InstructionReport failed(InstructionKind instruction, int wave, NibblerError error, Duration duration) {
        return new InstructionReport(instruction, InstructionState.FAILED, wave, null, Collections.emptyList(),
                error, Collections.emptyList(), duration);
    }

    public Optional<InstructionPlan> plan() {
        return Optional.ofNullable(plan);
    }

    public Optional<NibblerError> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Number of components that passed the size budget
     */
    public int passed() {
        return plan == null ? 0 : plan.components.size();
    }

    public int failed() {
        return rejections.size();
    }

    @Override
    public String toString() {
        if (error != null) {
            return String.format("%s: %s (%s)", instruction, state, error.getMessage());
        }
        return String.format("%s: %s, %d passed, %d failed", instruction, state, passed(), failed());
    }
}
