package nibbler.decompose;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import nibbler.contract.*;

import static nibbler.contract.Terms.*;
import static nibbler.contract.VariableId.NIBBLE_WIDTH;

/**
 * Ripple carry addition of two nibbles: <code>s = a+b+cin</code>, <code>c = (a&amp;b)|(cin&amp;(a+b))</code>.
 * Carries that fold to a constant or a single variable are passed on without a carry variable.
 */
final class Ripple {

    /**
     * Roles of the carry variables, instructions with two chains use one of each
     */
    enum Chain {
        MAIN(Role.CARRY, Role.CARRY_IN, Role.CARRY_OUT),
        STACK(Role.SP_CARRY, Role.SP_CARRY_IN, Role.SP_CARRY_OUT);

        final Role carry;
        final Role carryIn;
        final Role carryOut;

        Chain(Role carry, Role carryIn, Role carryOut) {
            this.carry = carry;
            this.carryIn = carryIn;
            this.carryOut = carryOut;
        }
    }

    final List<Predicate> definitions;
    /**
     * Carry leaving the most significant bit, a constant or a variable
     */
    final Term carryOut;

    private Ripple(List<Predicate> definitions, Term carryOut) {
        this.definitions = Collections.unmodifiableList(definitions);
        this.carryOut = carryOut;
    }

    /**
     * @param keepCarryOut define a variable for the carry of the last bit, otherwise it is dropped
     */
    static Ripple add(Namespace ns, Chain chain, Role sumRole, int nibble, List<Term> a, List<Term> b,
                      Term carryIn, boolean keepCarryOut) {
        if (a.size() != NIBBLE_WIDTH || b.size() != NIBBLE_WIDTH) {
            throw new IllegalArgumentException("Ripple operands have to be nibbles");
        }
        List<Predicate> definitions = new ArrayList<>();
        Term carry = carryIn;
        for (int j = 0; j < NIBBLE_WIDTH; j++) {
            Term x = xor(a.get(j), b.get(j));
            definitions.add(Predicate.eq(ns.bit(sumRole, nibble, j), xor(x, carry)));
            boolean last = j == NIBBLE_WIDTH - 1;
            if (last && !keepCarryOut) {
                carry = ZERO;
                break;
            }
            Term next = or(and(a.get(j), b.get(j)), and(carry, x));
            if (next instanceof Term.Const || next instanceof Term.Var) {
                carry = next;
            } else {
                VariableId c = ns.bit(chain.carry, nibble, j);
                definitions.add(Predicate.eq(c, next));
                carry = var(c);
            }
        }
        return new Ripple(definitions, carry);
    }

    /**
     * Bits of a constant addend for one nibble, least significant first
     */
    static List<Term> constant(long value, int nibble) {
        List<Term> bits = new ArrayList<>();
        for (int j = 0; j < NIBBLE_WIDTH; j++) {
            bits.add(Terms.constant(((value >>> (nibble * NIBBLE_WIDTH + j)) & 1) == 1));
        }
        return bits;
    }
}
