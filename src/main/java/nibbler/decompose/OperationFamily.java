package nibbler.decompose;

/**
 * Decomposition strategy shared by a group of instructions
 */
public enum OperationFamily {
    /**
     * Ripple carry arithmetic, nibbles linked low to high
     */
    CARRY_CHAIN,
    /**
     * Bitwise operations, no linking at all
     */
    PARALLEL,
    /**
     * Shifts and rotations, the boundary bit crosses to the neighbouring nibble
     */
    SHIFT,
    /**
     * Nibble local flags that are folded by aggregators
     */
    COMPARISON,
    /**
     * Address and data nibbles plus an alignment and bounds check
     */
    MEMORY_SPLIT,
    /**
     * Stack pointer carry chain plus carry free data movement
     */
    STACK,
    /**
     * Program counter carry chain plus jump target selection
     */
    CONTROL_FLOW,
    /**
     * Running mixing state threaded from nibble to nibble
     */
    CRYPTO_CHAIN;

    @Override
    public String toString() {
        return name().toLowerCase().replace("_", " ");
    }
}
