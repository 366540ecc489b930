package nibbler.decompose;

import nibbler.NibblerError;

/**
 * An instruction without a registered decomposition rule, or an unknown mnemonic
 */
public class UnknownInstruction extends NibblerError {

    public final String instruction;

    public UnknownInstruction(String instruction, String reason) {
        super(String.format("Unknown instruction '%s': %s", instruction, reason));
        this.instruction = instruction;
    }
}
