package nibbler.contract;

import java.util.Optional;

/**
 * A three valued bit, used to evaluate terms while not every variable is known yet
 */
public enum B {
    /**
     * Value is unknown, can be 1 or 0
     */
    U("u", Optional.empty()),
    ZERO("0", Optional.of(0)),
    ONE("1", Optional.of(1));

    public final String name;
    public final Optional<Integer> value;

    B(String name, Optional<Integer> value) {
        this.name = name;
        this.value = value;
    }

    public boolean isConstant() {
        return value.isPresent();
    }

    public B neg() {
        switch (this) {
            case ZERO:
                return ONE;
            case ONE:
                return ZERO;
            default:
                return U;
        }
    }

    public B and(B other) {
        if (this == ZERO || other == ZERO) {
            return ZERO;
        }
        if (this == ONE && other == ONE) {
            return ONE;
        }
        return U;
    }

    public B or(B other) {
        if (this == ONE || other == ONE) {
            return ONE;
        }
        if (this == ZERO && other == ZERO) {
            return ZERO;
        }
        return U;
    }

    public B xor(B other) {
        if (!isConstant() || !other.isConstant()) {
            return U;
        }
        return this == other ? ZERO : ONE;
    }

    public boolean toBoolean() {
        if (!isConstant()) {
            throw new IllegalStateException("Bit is not constant");
        }
        return this == ONE;
    }

    public static B of(boolean value) {
        return value ? ONE : ZERO;
    }

    public static B parse(String str) {
        switch (str.trim()) {
            case "0":
                return ZERO;
            case "1":
                return ONE;
            case "u":
                return U;
        }
        throw new IllegalArgumentException(String.format("No such bit '%s'", str));
    }

    @Override
    public String toString() {
        return name;
    }
}
