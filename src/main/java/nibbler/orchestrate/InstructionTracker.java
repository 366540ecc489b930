package nibbler.orchestrate;

import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

import nibbler.decompose.InstructionKind;

import static nibbler.orchestrate.Orchestrator.LOG;

/**
 * Thread safe state of every instruction of a run
 */
public class InstructionTracker {

    private final Map<InstructionKind, AtomicReference<InstructionState>> states = new EnumMap<>(InstructionKind.class);

    public InstructionTracker(Collection<InstructionKind> instructions) {
        instructions.forEach(i -> states.put(i, new AtomicReference<>(InstructionState.PENDING)));
    }

    public InstructionState state(InstructionKind instruction) {
        return reference(instruction).get();
    }

    /**
     * @throws IllegalStateException if the transition would move backwards or skip a state
     */
    public void advance(InstructionKind instruction, InstructionState next) {
        InstructionState previous = reference(instruction).getAndUpdate(current -> current.canMoveTo(next) ? next : current);
        if (!previous.canMoveTo(next)) {
            throw new IllegalStateException(String.format("%s cannot move from %s to %s", instruction, previous, next));
        }
        LOG.fine(String.format("%s: %s -> %s", instruction, previous, next));
    }

    public Map<InstructionKind, InstructionState> snapshot() {
        Map<InstructionKind, InstructionState> snapshot = new EnumMap<>(InstructionKind.class);
        states.forEach((k, v) -> snapshot.put(k, v.get()));
        return snapshot;
    }

    private AtomicReference<InstructionState> reference(InstructionKind instruction) {
        AtomicReference<InstructionState> reference = states.get(instruction);
        if (reference == null) {
            throw new IllegalArgumentException(instruction + " is not tracked");
        }
        return reference;
    }
}
