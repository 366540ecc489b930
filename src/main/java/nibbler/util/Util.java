package nibbler.util;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public class Util {

    private Util() {
    }

    /**
     * Bits of the unsigned value, least significant first
     */
    public static List<Boolean> toBits(long value, int width) {
        if (width < 1 || width > Long.SIZE - 1) {
            throw new IllegalArgumentException("Unsupported width " + width);
        }
        if ((value & ~mask(width)) != 0) {
            throw new IllegalArgumentException(String.format("%d does not fit into %d bits", value, width));
        }
        return IntStream.range(0, width).mapToObj(i -> ((value >>> i) & 1) == 1).collect(Collectors.toList());
    }

    public static long fromBits(List<Boolean> bits) {
        long value = 0;
        for (int i = bits.size() - 1; i >= 0; i--) {
            value = (value << 1) | (bits.get(i) ? 1 : 0);
        }
        return value;
    }

    public static long mask(int width) {
        return width >= Long.SIZE ? -1L : (1L << width) - 1;
    }
}
