package nibbler.decompose;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import nibbler.contract.B;
import nibbler.contract.Term;

/**
 * Placeholder for the compression step of the crypto instructions. Maps the input bits of a nibble
 * and the incoming four bit state onto the outgoing state. Not cryptographically meaningful.
 */
public interface MixingFunction {

    String name();

    /**
     * State that the least significant nibble starts with, least significant bit first
     */
    List<B> initialState();

    /**
     * @param input   four input bits, least significant first
     * @param stateIn four state bits, least significant first
     * @return the four outgoing state bits
     */
    List<Term> mix(List<Term> input, List<Term> stateIn);

    static List<MixingFunction> available() {
        return Arrays.asList(new RotateXorMixing(), new XorFoldMixing());
    }

    static MixingFunction from(String name) {
        return available().stream().filter(m -> m.name().equals(name.trim().toLowerCase())).findFirst()
                .orElseThrow(() -> new IllegalArgumentException(String.format("Unknown mixing function '%s', " +
                        "use one of %s", name, available().stream().map(MixingFunction::name)
                        .collect(Collectors.joining(", ")))));
    }
}
