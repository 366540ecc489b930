package nibbler.orchestrate;

import nibbler.NibblerError;
import nibbler.decompose.InstructionKind;

/**
 * A dependency of an instruction did not reach {@link InstructionState#COMPLETE} in time
 */
public class DependencyTimeout extends NibblerError {

    public final InstructionKind instruction;

    public DependencyTimeout(InstructionKind instruction, String reason) {
        super(String.format("Dependencies of %s did not complete: %s", instruction, reason));
        this.instruction = instruction;
    }
}
