package nibbler.decompose;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import nibbler.contract.B;
import nibbler.contract.Term;

import static nibbler.contract.Terms.*;

/**
 * <code>t = input + state</code>, rotated left by one and combined with alternating gates
 */
public class RotateXorMixing implements MixingFunction {

    @Override
    public String name() {
        return "rotate-xor";
    }

    @Override
    public List<B> initialState() {
        return Arrays.asList(B.ONE, B.ZERO, B.ONE, B.ZERO);
    }

    @Override
    public List<Term> mix(List<Term> input, List<Term> stateIn) {
        List<Term> t = new ArrayList<>();
        for (int j = 0; j < 4; j++) {
            t.add(xor(input.get(j), stateIn.get(j)));
        }
        List<Term> r = Arrays.asList(t.get(3), t.get(0), t.get(1), t.get(2));
        return Arrays.asList(
                and(r.get(0), t.get(1)),
                or(r.get(1), t.get(2)),
                xor(r.get(2), t.get(3)),
                and(r.get(3), t.get(0)));
    }

    @Override
    public String toString() {
        return name();
    }
}
