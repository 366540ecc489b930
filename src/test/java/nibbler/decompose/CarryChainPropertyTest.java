package nibbler.decompose;

import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.generator.InRange;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;
import org.junit.runner.RunWith;

import nibbler.vm.PlanValidator;

import static nibbler.decompose.InstructionKind.*;
import static org.junit.Assert.assertEquals;

/**
 * Random 32 bit operands for the carry chain instructions
 */
@RunWith(JUnitQuickcheck.class)
public class CarryChainPropertyTest {

    private static final long MASK = 0xFFFFFFFFL;

    private static final PlanValidator VALIDATOR = CompositionTest.validator(32, ADD, SUB, LT, EQ);

    @Property(trials = 50)
    public void addition(@InRange(minLong = 0, maxLong = MASK) long a, @InRange(minLong = 0, maxLong = MASK) long b) {
        long[] outputs = VALIDATOR.execute(ADD, a, b);
        assertEquals((a + b) & MASK, outputs[0]);
        assertEquals(a + b > MASK ? 1 : 0, outputs[1]);
    }

    @Property(trials = 50)
    public void subtraction(@InRange(minLong = 0, maxLong = MASK) long a, @InRange(minLong = 0, maxLong = MASK) long b) {
        long[] outputs = VALIDATOR.execute(SUB, a, b);
        assertEquals((a - b) & MASK, outputs[0]);
        assertEquals(a < b ? 1 : 0, outputs[1]);
    }

    @Property(trials = 50)
    public void lessThan(@InRange(minLong = 0, maxLong = MASK) long a, @InRange(minLong = 0, maxLong = MASK) long b) {
        long[] outputs = VALIDATOR.execute(LT, a, b);
        assertEquals(a < b ? 1 : 0, outputs[0]);
        assertEquals(a == b ? 1 : 0, outputs[1]);
        assertEquals(a == b ? 1 : 0, VALIDATOR.execute(EQ, a, b)[0]);
    }
}
