package nibbler.vm;

import nibbler.decompose.InstructionKind;

/**
 * Checks an executed instruction against its constraints. Inputs and outputs are given in the
 * operand order of the instruction plan.
 */
public interface ConstraintValidator {

    /**
     * @return true if the outputs are the ones the constraints allow for the inputs
     */
    boolean validate(InstructionKind instruction, long[] inputs, long[] outputs);
}
