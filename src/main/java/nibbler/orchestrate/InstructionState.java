package nibbler.orchestrate;

/**
 * Generation progress of an instruction, states only move forward
 */
public enum InstructionState {
    PENDING, GENERATING, COMPLETE, PARTIALLY_FAILED,
    /**
     * The request failed before any component was accepted
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == PARTIALLY_FAILED || this == FAILED;
    }

    public boolean canMoveTo(InstructionState next) {
        switch (this) {
            case PENDING:
                return next == GENERATING || next == FAILED;
            case GENERATING:
                return next == COMPLETE || next == PARTIALLY_FAILED || next == FAILED;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase().replace("_", " ");
    }
}
