package nibbler.decompose;

import java.util.Objects;

import nibbler.contract.VariableId;

/**
 * Parameters of a decomposition that do not depend on the instruction
 */
public class DecompositionContext {

    public static final int DEFAULT_WIDTH = 32;
    public static final int DEFAULT_ADDRESS_BITS = 16;

    /**
     * Word width in bits, a multiple of the nibble width
     */
    public final int width;
    /**
     * log2 of the memory size, addresses at or above it are out of bounds
     */
    public final int addressBits;
    public final MixingFunction mixing;

    public DecompositionContext(int width, int addressBits, MixingFunction mixing) {
        if (width < VariableId.NIBBLE_WIDTH || width > 32 || width % VariableId.NIBBLE_WIDTH != 0) {
            throw new IllegalArgumentException(String.format("Width has to be a multiple of %d in [%d, 32], got %d",
                    VariableId.NIBBLE_WIDTH, VariableId.NIBBLE_WIDTH, width));
        }
        if (addressBits < 2 || addressBits > width) {
            throw new IllegalArgumentException(String.format("Address bits have to be in [2, %d], got %d",
                    width, addressBits));
        }
        this.width = width;
        this.addressBits = addressBits;
        this.mixing = Objects.requireNonNull(mixing);
    }

    public DecompositionContext(int width) {
        this(width, Math.min(DEFAULT_ADDRESS_BITS, width), new RotateXorMixing());
    }

    public DecompositionContext() {
        this(DEFAULT_WIDTH);
    }

    public int nibbles() {
        return width / VariableId.NIBBLE_WIDTH;
    }

    @Override
    public String toString() {
        return String.format("width=%d, addressBits=%d, mixing=%s", width, addressBits, mixing.name());
    }
}
