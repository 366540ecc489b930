package nibbler.contract;

import java.util.Objects;

/**
 * Declares that the consumer component reads a bit that the producer component exports
 */
public final class LinkSpec {

    public final VariableId produced;
    public final VariableId consumed;
    public final ComponentRef from;
    public final ComponentRef to;

    public LinkSpec(VariableId produced, VariableId consumed, ComponentRef from, ComponentRef to) {
        this.produced = Objects.requireNonNull(produced);
        this.consumed = Objects.requireNonNull(consumed);
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
    }

    public static LinkSpec between(Component from, Component to, VariableId produced, VariableId consumed) {
        return new LinkSpec(produced, consumed, from.ref(), to.ref());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LinkSpec)) {
            return false;
        }
        LinkSpec that = (LinkSpec) o;
        return produced.equals(that.produced) && consumed.equals(that.consumed) &&
                from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(produced, consumed, from, to);
    }

    @Override
    public String toString() {
        return String.format("%s.%s -> %s.%s", from.name, produced, to.name, consumed);
    }
}
