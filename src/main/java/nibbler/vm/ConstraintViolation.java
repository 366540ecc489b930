package nibbler.vm;

import nibbler.NibblerError;
import nibbler.decompose.InstructionKind;

public class ConstraintViolation extends NibblerError {

    public final InstructionKind instruction;

    public ConstraintViolation(InstructionKind instruction, String reason) {
        super(String.format("Constraint violation in %s: %s", instruction, reason));
        this.instruction = instruction;
    }
}
