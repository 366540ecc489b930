package nibbler.decompose;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import nibbler.contract.B;
import nibbler.contract.Term;

import static nibbler.contract.Terms.*;

/**
 * Every outgoing state bit is the input bit xored with two neighbouring state bits
 */
public class XorFoldMixing implements MixingFunction {

    @Override
    public String name() {
        return "xor-fold";
    }

    @Override
    public List<B> initialState() {
        return Arrays.asList(B.ZERO, B.ONE, B.ONE, B.ZERO);
    }

    @Override
    public List<Term> mix(List<Term> input, List<Term> stateIn) {
        List<Term> out = new ArrayList<>();
        for (int j = 0; j < 4; j++) {
            out.add(xor(input.get(j), stateIn.get(j), stateIn.get((j + 1) % 4)));
        }
        return out;
    }

    @Override
    public String toString() {
        return name();
    }
}
