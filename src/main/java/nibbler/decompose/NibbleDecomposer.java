package nibbler.decompose;

import java.util.*;
import java.util.stream.Collectors;

import nibbler.contract.*;

import static nibbler.contract.Predicate.eq;
import static nibbler.contract.Predicate.isBoolean;
import static nibbler.contract.Role.*;
import static nibbler.contract.Terms.*;
import static nibbler.contract.VariableId.NIBBLE_WIDTH;
import static nibbler.decompose.InstructionKind.*;

/**
 * Decomposes every instruction into one component per nibble (per nibble and part for
 * instructions that consist of two independent parts), the link components between neighbouring
 * nibbles and the aggregators or checks that combine the nibbles.
 * <p>
 * Nibbles are always produced from the least significant to the most significant one.
 */
public class NibbleDecomposer implements DecompositionRule {

    /**
     * Increment of the stack pointer and the program counter
     */
    public static final int WORD_BYTES = 4;

    private final CarryLinker linker = new CarryLinker();
    private final Aggregator aggregator = new Aggregator();

    @Override
    public Decomposition decompose(InstructionKind instruction, DecompositionContext context) {
        Builder builder = new Builder(instruction, context);
        switch (instruction.family) {
            case CARRY_CHAIN:
                carryChain(builder);
                break;
            case PARALLEL:
                parallel(builder);
                break;
            case SHIFT:
                shift(builder);
                break;
            case COMPARISON:
                comparison(builder);
                break;
            case MEMORY_SPLIT:
                memory(builder);
                break;
            case STACK:
                stack(builder);
                break;
            case CONTROL_FLOW:
                controlFlow(builder);
                break;
            case CRYPTO_CHAIN:
                crypto(builder);
                break;
        }
        return builder.build();
    }

    /**
     * ADD and SUB, SUB adds the negated second operand with an initial carry of one.
     * The carry of the last nibble is the overflow (ADD) or, negated, the borrow (SUB).
     */
    private void carryChain(Builder b) {
        Namespace ns = b.ns;
        boolean sub = b.instruction == SUB;
        Component previous = null;
        for (int i = 0; i < b.nibbles; i++) {
            boolean last = i == b.nibbles - 1;
            List<Term> second = ns.terms(OPERAND_B, i);
            if (sub) {
                second = second.stream().map(Terms::not).collect(Collectors.toList());
            }
            List<Predicate> assumptions = new ArrayList<>();
            Term carryIn = b.carryIn(Ripple.Chain.MAIN, i, sub ? ONE : ZERO, assumptions);
            Ripple ripple = Ripple.add(ns, Ripple.Chain.MAIN, SUM, i, ns.terms(OPERAND_A, i), second, carryIn, true);
            List<Predicate> constraints = new ArrayList<>(ripple.definitions);
            if (last) {
                constraints.add(eq(ns.word(OVERFLOW), sub ? not(ripple.carryOut) : ripple.carryOut));
            } else {
                constraints.add(eq(ns.nibble(CARRY_OUT, i), ripple.carryOut));
            }
            Component component = b.nibble(ns.nibbleName(i), i, assumptions,
                    guarantees(constraints, SUM, CARRY_OUT, OVERFLOW), constraints, i > 0, !last);
            if (previous != null) {
                b.link(previous, component, ns.nibble(CARRY_OUT, i - 1), ns.nibble(CARRY_IN, i));
            }
            previous = component;
        }
        b.inputs(ns.operand(OPERAND_A, b.nibbles), ns.operand(OPERAND_B, b.nibbles));
        b.outputs(ns.operand(SUM, b.nibbles), ns.flag(OVERFLOW));
    }

    /**
     * Bitwise instructions, the nibbles are independent of each other
     */
    private void parallel(Builder b) {
        Namespace ns = b.ns;
        for (int i = 0; i < b.nibbles; i++) {
            List<Predicate> constraints = new ArrayList<>();
            for (int j = 0; j < NIBBLE_WIDTH; j++) {
                Term x = ns.term(OPERAND_A, i, j);
                Term y = ns.term(OPERAND_B, i, j);
                Term result;
                switch (b.instruction) {
                    case AND:
                        result = and(x, y);
                        break;
                    case OR:
                        result = or(x, y);
                        break;
                    case XOR:
                        result = xor(x, y);
                        break;
                    case NOT:
                        result = not(x);
                        break;
                    default:
                        throw new AssertionError(b.instruction);
                }
                constraints.add(eq(ns.bit(RESULT, i, j), result));
            }
            b.nibble(ns.nibbleName(i), i, Collections.emptyList(), constraints, constraints);
        }
        if (b.instruction == NOT) {
            b.inputs(ns.operand(OPERAND_A, b.nibbles));
        } else {
            b.inputs(ns.operand(OPERAND_A, b.nibbles), ns.operand(OPERAND_B, b.nibbles));
        }
        b.outputs(ns.operand(RESULT, b.nibbles));
    }

    /**
     * Shifts and rotations by one bit. Left shifts pass the most significant bit of a nibble to
     * the next higher nibble, right shifts pass the least significant bit to the next lower one.
     */
    private void shift(Builder b) {
        Namespace ns = b.ns;
        boolean left = b.instruction == SHL || b.instruction == ROL;
        boolean rotate = b.instruction == ROL || b.instruction == ROR;
        int n = b.nibbles;
        List<Component> components = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            // the nibble that receives a zero instead of a neighbouring bit
            boolean edgeIn = left ? i == 0 : i == n - 1;
            // the nibble whose outgoing bit leaves the word
            boolean edgeOut = left ? i == n - 1 : i == 0;
            boolean consumes = !edgeIn || rotate;
            boolean exports = !edgeOut || rotate;
            List<Predicate> assumptions = new ArrayList<>();
            Term in = ZERO;
            if (consumes) {
                assumptions.add(isBoolean(ns.nibble(SHIFT_IN, i)));
                in = var(ns.nibble(SHIFT_IN, i));
            }
            List<Predicate> constraints = new ArrayList<>();
            for (int j = 0; j < NIBBLE_WIDTH; j++) {
                int source = left ? j - 1 : j + 1;
                Term value = source < 0 || source >= NIBBLE_WIDTH ? in : ns.term(OPERAND_A, i, source);
                constraints.add(eq(ns.bit(RESULT, i, j), value));
            }
            Term out = ns.term(OPERAND_A, i, left ? NIBBLE_WIDTH - 1 : 0);
            if (exports) {
                constraints.add(eq(ns.nibble(SHIFT_OUT, i), out));
            } else {
                constraints.add(eq(ns.word(left ? OVERFLOW : UNDERFLOW), out));
            }
            components.add(b.nibble(ns.nibbleName(i), i, assumptions, constraints, constraints, consumes, exports));
        }
        for (int i = 0; i < n; i++) {
            int target = left ? i + 1 : i - 1;
            if (target < 0 || target >= n) {
                if (!rotate) {
                    continue;
                }
                target = (target + n) % n;
            }
            b.link(components.get(i), components.get(target), ns.nibble(SHIFT_OUT, i), ns.nibble(SHIFT_IN, target));
        }
        b.inputs(ns.operand(OPERAND_A, n));
        b.outputs(ns.operand(RESULT, n));
        if (!rotate) {
            b.outputs(ns.flag(left ? OVERFLOW : UNDERFLOW));
        }
    }

    /**
     * Nibble local equality and order flags, combined by aggregators
     */
    private void comparison(Builder b) {
        Namespace ns = b.ns;
        InstructionKind kind = b.instruction;
        boolean less = kind == InstructionKind.LT || kind == LTE;
        boolean greater = kind == InstructionKind.GT || kind == GTE;
        List<VariableId> eqFlags = new ArrayList<>();
        List<VariableId> neFlags = new ArrayList<>();
        List<VariableId> orderFlags = new ArrayList<>();
        for (int i = 0; i < b.nibbles; i++) {
            List<Term> x = ns.terms(OPERAND_A, i);
            List<Term> y = ns.terms(OPERAND_B, i);
            List<Term> equalBits = new ArrayList<>();
            List<Term> differBits = new ArrayList<>();
            List<Term> orderBits = new ArrayList<>();
            for (int j = 0; j < NIBBLE_WIDTH; j++) {
                equalBits.add(equal(x.get(j), y.get(j)));
                differBits.add(xor(x.get(j), y.get(j)));
                orderBits.add(less ? and(not(x.get(j)), y.get(j)) : and(x.get(j), not(y.get(j))));
            }
            List<Predicate> constraints = new ArrayList<>();
            if (kind == NEQ) {
                neFlags.add(ns.nibble(NE, i));
                constraints.add(eq(ns.nibble(NE, i), or(differBits)));
            } else {
                eqFlags.add(ns.nibble(Role.EQ, i));
                constraints.add(eq(ns.nibble(Role.EQ, i), and(equalBits)));
            }
            if (less || greater) {
                VariableId flag = ns.nibble(less ? Role.LT : Role.GT, i);
                orderFlags.add(flag);
                constraints.add(eq(flag, Aggregator.lexicographic(orderBits, equalBits)));
            }
            b.nibble(ns.nibbleName(i), i, Collections.emptyList(), constraints, constraints);
        }
        b.inputs(ns.operand(OPERAND_A, b.nibbles), ns.operand(OPERAND_B, b.nibbles));
        if (kind == NEQ) {
            b.aggregate(Aggregation.anyDiffer(neFlags), ns.word(NEQ_FINAL));
            return;
        }
        if (less || greater) {
            AggregationKind order = less ? AggregationKind.LEXICOGRAPHIC_LESS : AggregationKind.LEXICOGRAPHIC_GREATER;
            VariableId strict = ns.word(less ? LT_FINAL : GT_FINAL);
            b.aggregate(Aggregation.lexicographic(order, orderFlags, eqFlags), strict);
            if (kind == LTE || kind == GTE) {
                b.aggregate(Aggregation.orEqual(strict, ns.word(EQ_FINAL)), ns.word(less ? LTE_FINAL : GTE_FINAL));
            }
        }
        b.aggregate(Aggregation.allEqual(eqFlags), ns.word(EQ_FINAL));
    }

    /**
     * Address and data are decomposed independently, one check validates the whole address
     */
    private void memory(Builder b) {
        Namespace ns = b.ns;
        InstructionKind kind = b.instruction;
        boolean load = kind == LOAD || kind == MLOAD;
        boolean wordAccess = kind == LOAD || kind == STORE;
        int addressBits = b.context.addressBits;
        List<VariableId> highZero = new ArrayList<>();
        for (int i = 0; i < b.nibbles; i++) {
            List<Predicate> constraints = new ArrayList<>();
            List<Term> outside = new ArrayList<>();
            for (int j = 0; j < NIBBLE_WIDTH; j++) {
                constraints.add(eq(ns.bit(BUS, i, j), ns.term(ADDRESS, i, j)));
                if (i * NIBBLE_WIDTH + j >= addressBits) {
                    outside.add(not(ns.term(ADDRESS, i, j)));
                }
            }
            highZero.add(ns.nibble(HIGH_ZERO, i));
            constraints.add(eq(ns.nibble(HIGH_ZERO, i), and(outside)));
            b.nibble(ns.nibbleName("address", i), i, Collections.emptyList(), constraints, constraints);
        }
        for (int i = 0; i < b.nibbles; i++) {
            b.move(i, load ? new Role[]{VALUE, DATA} : new Role[]{DATA, VALUE});
        }
        List<Predicate> assumptions = new ArrayList<>();
        List<Predicate> constraints = new ArrayList<>();
        highZero.forEach(v -> assumptions.add(isBoolean(v)));
        constraints.add(eq(ns.word(IN_BOUNDS), and(highZero.stream().map(Terms::var).collect(Collectors.toList()))));
        if (wordAccess) {
            assumptions.add(isBoolean(ns.bit(BUS, 0, 0)));
            assumptions.add(isBoolean(ns.bit(BUS, 0, 1)));
            constraints.add(eq(ns.word(ALIGNED), not(or(ns.term(BUS, 0, 0), ns.term(BUS, 0, 1)))));
            constraints.add(eq(ns.word(ADDRESS_OK), and(var(ns.word(ALIGNED)), var(ns.word(IN_BOUNDS)))));
        } else {
            constraints.add(eq(ns.word(ADDRESS_OK), var(ns.word(IN_BOUNDS))));
        }
        b.check(ns.name("address_check"), assumptions, constraints);
        b.inputs(ns.operand(ADDRESS, b.nibbles), ns.operand(load ? DATA : VALUE, b.nibbles));
        b.outputs(ns.operand(load ? VALUE : DATA, b.nibbles), ns.flag(ADDRESS_OK));
    }

    /**
     * Stack pointer update (carry chain by the word size) and carry free data movement
     */
    private void stack(Builder b) {
        Namespace ns = b.ns;
        int n = b.nibbles;
        switch (b.instruction) {
            case PUSH:
                stackPointer(b, true);
                dataMovement(b, SLOT, VALUE);
                b.inputs(ns.operand(SP, n), ns.operand(VALUE, n));
                b.outputs(ns.operand(SP_NEXT, n), ns.operand(SLOT, n), ns.flag(OVERFLOW));
                break;
            case POP:
                stackPointer(b, false);
                dataMovement(b, VALUE, SLOT);
                b.inputs(ns.operand(SP, n), ns.operand(SLOT, n));
                b.outputs(ns.operand(SP_NEXT, n), ns.operand(VALUE, n), ns.flag(UNDERFLOW));
                break;
            case DUP:
                stackPointer(b, true);
                dataMovement(b, NEW_TOP, TOP);
                b.inputs(ns.operand(SP, n), ns.operand(TOP, n));
                b.outputs(ns.operand(SP_NEXT, n), ns.operand(NEW_TOP, n), ns.flag(OVERFLOW));
                break;
            case SWAP:
                dataMovement(b, NEW_TOP, SECOND, NEW_SECOND, TOP);
                b.inputs(ns.operand(TOP, n), ns.operand(SECOND, n));
                b.outputs(ns.operand(NEW_TOP, n), ns.operand(NEW_SECOND, n));
                break;
            default:
                throw new AssertionError(b.instruction);
        }
    }

    private void dataMovement(Builder b, Role... destinationSourcePairs) {
        for (int i = 0; i < b.nibbles; i++) {
            b.move(i, destinationSourcePairs);
        }
    }

    /**
     * <code>sq = sp + 4</code> or <code>sq = sp - 4</code>, the last carry signals the wrap around
     */
    private void stackPointer(Builder b, boolean increment) {
        Namespace ns = b.ns;
        long addend = increment ? WORD_BYTES : (1L << b.context.width) - WORD_BYTES;
        Ripple.Chain chain = Ripple.Chain.STACK;
        Component previous = null;
        for (int i = 0; i < b.nibbles; i++) {
            boolean last = i == b.nibbles - 1;
            List<Predicate> assumptions = new ArrayList<>();
            Term carryIn = b.carryIn(chain, i, ZERO, assumptions);
            Ripple ripple = Ripple.add(ns, chain, SP_NEXT, i, ns.terms(SP, i), Ripple.constant(addend, i),
                    carryIn, true);
            List<Predicate> constraints = new ArrayList<>(ripple.definitions);
            if (last) {
                constraints.add(increment ? eq(ns.word(OVERFLOW), ripple.carryOut) :
                        eq(ns.word(UNDERFLOW), not(ripple.carryOut)));
            } else {
                constraints.add(eq(ns.nibble(chain.carryOut, i), ripple.carryOut));
            }
            Component component = b.nibble(ns.nibbleName("sp", i), i, assumptions,
                    guarantees(constraints, SP_NEXT, chain.carryOut, OVERFLOW, UNDERFLOW), constraints, i > 0, !last);
            if (previous != null) {
                b.link(previous, component, ns.nibble(chain.carryOut, i - 1), ns.nibble(chain.carryIn, i));
            }
            previous = component;
        }
    }

    /**
     * Next program counter. The increment by the word size reuses the carry chain, the carry
     * out of the last nibble is dropped as the program counter wraps around.
     */
    private void controlFlow(Builder b) {
        Namespace ns = b.ns;
        InstructionKind kind = b.instruction;
        int n = b.nibbles;
        VariableId condition = null;
        if (kind == JZ || kind == JNZ) {
            condition = kind == JZ ? VariableId.word(InstructionKind.EQ, EQ_FINAL) : VariableId.word(NEQ, NEQ_FINAL);
            b.imports.add(condition);
        }
        boolean increments = kind == JZ || kind == JNZ || kind == CALL || kind == NOP;
        Component previous = null;
        for (int i = 0; i < n; i++) {
            boolean last = i == n - 1;
            List<Predicate> assumptions = new ArrayList<>();
            List<Predicate> constraints = new ArrayList<>();
            Term carryOut = null;
            if (condition != null) {
                assumptions.add(isBoolean(condition));
            }
            if (increments) {
                // the incremented counter is the next pc, the fall through target or the return address
                Role sum = kind == NOP ? PC_NEXT : kind == CALL ? SLOT : SUM;
                Term carryIn = b.carryIn(Ripple.Chain.MAIN, i, ZERO, assumptions);
                Ripple ripple = Ripple.add(ns, Ripple.Chain.MAIN, sum, i, ns.terms(PC, i),
                        Ripple.constant(WORD_BYTES, i), carryIn, !last);
                constraints.addAll(ripple.definitions);
                carryOut = ripple.carryOut;
            }
            for (int j = 0; j < NIBBLE_WIDTH; j++) {
                VariableId next = ns.bit(PC_NEXT, i, j);
                switch (kind) {
                    case JMP:
                    case CALL:
                        constraints.add(eq(next, ns.term(TARGET, i, j)));
                        break;
                    case JZ:
                    case JNZ:
                        Term taken = var(condition);
                        constraints.add(eq(next, or(and(taken, ns.term(TARGET, i, j)),
                                and(not(taken), ns.term(SUM, i, j)))));
                        break;
                    case RET:
                        constraints.add(eq(next, ns.term(SLOT, i, j)));
                        break;
                    case HALT:
                        constraints.add(eq(next, ns.term(PC, i, j)));
                        break;
                    case NOP:
                        break;
                    default:
                        throw new AssertionError(kind);
                }
            }
            if (increments && !last) {
                constraints.add(eq(ns.nibble(CARRY_OUT, i), carryOut));
            }
            Component component = b.nibble(ns.nibbleName("pc", i), i, assumptions,
                    guarantees(constraints, PC_NEXT, SLOT, CARRY_OUT), constraints,
                    increments && i > 0, increments && !last);
            if (increments && previous != null) {
                b.link(previous, component, ns.nibble(CARRY_OUT, i - 1), ns.nibble(CARRY_IN, i));
            }
            previous = component;
        }
        switch (kind) {
            case JMP:
                b.inputs(ns.operand(TARGET, n));
                b.outputs(ns.operand(PC_NEXT, n));
                break;
            case JZ:
            case JNZ:
                b.inputs(new Operand("cond", Collections.singletonList(condition)), ns.operand(PC, n),
                        ns.operand(TARGET, n));
                b.outputs(ns.operand(PC_NEXT, n));
                break;
            case CALL:
                stackPointer(b, true);
                b.inputs(ns.operand(PC, n), ns.operand(TARGET, n), ns.operand(SP, n));
                b.outputs(ns.operand(PC_NEXT, n), ns.operand(SLOT, n), ns.operand(SP_NEXT, n), ns.flag(OVERFLOW));
                break;
            case RET:
                stackPointer(b, false);
                b.inputs(ns.operand(SLOT, n), ns.operand(SP, n));
                b.outputs(ns.operand(PC_NEXT, n), ns.operand(SP_NEXT, n), ns.flag(UNDERFLOW));
                break;
            case NOP:
            case HALT:
                b.inputs(ns.operand(PC, n));
                b.outputs(ns.operand(PC_NEXT, n));
                break;
            default:
                throw new AssertionError(kind);
        }
    }

    /**
     * A four bit state runs through the nibbles like a carry, one link per state bit
     */
    private void crypto(Builder b) {
        Namespace ns = b.ns;
        InstructionKind kind = b.instruction;
        MixingFunction mixing = b.context.mixing;
        int n = b.nibbles;
        List<VariableId> okFlags = new ArrayList<>();
        List<Component> components = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            List<Predicate> assumptions = new ArrayList<>();
            List<Term> stateIn;
            if (i == 0) {
                stateIn = mixing.initialState().stream().map(Terms::constant).collect(Collectors.toList());
            } else {
                ns.bits(STATE_IN, i).forEach(v -> assumptions.add(isBoolean(v)));
                stateIn = ns.terms(STATE_IN, i);
            }
            List<Term> input = new ArrayList<>();
            for (int j = 0; j < NIBBLE_WIDTH; j++) {
                Term message = ns.term(MESSAGE, i, j);
                input.add(kind == HASH ? message : xor(message, ns.term(KEY, i, j)));
            }
            List<Term> stateOut = mixing.mix(input, stateIn);
            List<Predicate> constraints = new ArrayList<>();
            for (int j = 0; j < NIBBLE_WIDTH; j++) {
                constraints.add(eq(ns.bit(STATE_OUT, i, j), stateOut.get(j)));
            }
            List<Term> matches = new ArrayList<>();
            for (int j = 0; j < NIBBLE_WIDTH; j++) {
                Term expected = xor(ns.term(STATE_OUT, i, j), ns.term(KEY, i, j));
                if (kind == SIGN) {
                    constraints.add(eq(ns.bit(SIGNATURE, i, j), expected));
                } else if (kind == VERIFY) {
                    matches.add(equal(ns.term(SIGNATURE, i, j), expected));
                }
            }
            if (kind == VERIFY) {
                okFlags.add(ns.nibble(OK, i));
                constraints.add(eq(ns.nibble(OK, i), and(matches)));
            }
            components.add(b.nibble(ns.nibbleName(i), i, assumptions,
                    guarantees(constraints, STATE_OUT, SIGNATURE, OK), constraints, i > 0, i < n - 1));
        }
        for (int i = 0; i + 1 < n; i++) {
            for (int j = 0; j < NIBBLE_WIDTH; j++) {
                b.link(components.get(i), components.get(i + 1), ns.bit(STATE_OUT, i, j), ns.bit(STATE_IN, i + 1, j));
            }
        }
        switch (kind) {
            case HASH:
                b.inputs(ns.operand(MESSAGE, n));
                b.outputs(new Operand("digest", ns.bits(STATE_OUT, n - 1)));
                break;
            case SIGN:
                b.inputs(ns.operand(MESSAGE, n), ns.operand(KEY, n));
                b.outputs(ns.operand(SIGNATURE, n));
                break;
            case VERIFY:
                b.aggregate(Aggregation.allEqual(okFlags), ns.word(VERIFIED));
                b.inputs(ns.operand(MESSAGE, n), ns.operand(KEY, n), ns.operand(SIGNATURE, n));
                break;
            default:
                throw new AssertionError(kind);
        }
    }

    /**
     * The constraints that define variables of the given roles
     */
    private static List<Predicate> guarantees(List<Predicate> constraints, Role... roles) {
        Set<Role> wanted = EnumSet.noneOf(Role.class);
        wanted.addAll(Arrays.asList(roles));
        return constraints.stream().filter(p -> p instanceof Predicate.Equation &&
                ((Predicate.Equation) p).left instanceof Term.Var &&
                wanted.contains(((Term.Var) ((Predicate.Equation) p).left).id.role)).collect(Collectors.toList());
    }

    /**
     * Collects the parts of one decomposition
     */
    private final class Builder {

        final InstructionKind instruction;
        final DecompositionContext context;
        final Namespace ns;
        final int nibbles;
        final List<Component> nibbleComponents = new ArrayList<>();
        final List<LinkSpec> links = new ArrayList<>();
        final List<Component> linkComponents = new ArrayList<>();
        final List<Component> combining = new ArrayList<>();
        final List<Operand> inputs = new ArrayList<>();
        final List<Operand> outputs = new ArrayList<>();
        final Set<VariableId> imports = new TreeSet<>();

        Builder(InstructionKind instruction, DecompositionContext context) {
            this.instruction = instruction;
            this.context = context;
            this.ns = new Namespace(instruction);
            this.nibbles = context.nibbles();
        }

        /**
         * Carry into nibble i: the initial carry for the first nibble, a linked variable otherwise
         */
        Term carryIn(Ripple.Chain chain, int nibble, Term initial, List<Predicate> assumptions) {
            if (nibble == 0) {
                return initial;
            }
            VariableId carryIn = ns.nibble(chain.carryIn, nibble);
            assumptions.add(isBoolean(carryIn));
            return var(carryIn);
        }

        Component nibble(String name, int nibble, List<Predicate> assumptions, List<Predicate> guarantees,
                         List<Predicate> constraints) {
            return nibble(name, nibble, assumptions, guarantees, constraints, false, false);
        }

        Component nibble(String name, int nibble, List<Predicate> assumptions, List<Predicate> guarantees,
                         List<Predicate> constraints, boolean carryIn, boolean carryOut) {
            Component component = Component.nibble(instruction, new Contract(name, assumptions, guarantees,
                    constraints), nibble, carryIn, carryOut);
            nibbleComponents.add(component);
            return component;
        }

        /**
         * Carry free nibble that copies source bits into destination bits, the roles are given as
         * destination, source pairs
         */
        void move(int nibble, Role... destinationSourcePairs) {
            List<Predicate> constraints = new ArrayList<>();
            for (int p = 0; p < destinationSourcePairs.length; p += 2) {
                for (int j = 0; j < NIBBLE_WIDTH; j++) {
                    constraints.add(eq(ns.bit(destinationSourcePairs[p], nibble, j),
                            ns.term(destinationSourcePairs[p + 1], nibble, j)));
                }
            }
            nibble(ns.nibbleName("data", nibble), nibble, Collections.emptyList(), constraints, constraints);
        }

        void link(Component from, Component to, VariableId produced, VariableId consumed) {
            linkComponents.add(linker.link(from, to, produced, consumed));
            links.add(LinkSpec.between(from, to, produced, consumed));
        }

        void aggregate(Aggregation aggregation, VariableId result) {
            combining.add(aggregator.aggregate(instruction, ns.name(aggregation.kind.label() + "_aggregator"),
                    aggregation, result));
            outputs.add(Operand.flag(result));
        }

        void check(String name, List<Predicate> assumptions, List<Predicate> constraints) {
            combining.add(new Component(instruction, new Contract(name, assumptions, constraints, constraints),
                    Component.Kind.CHECK, OptionalInt.empty(), false, false));
        }

        void inputs(Operand... operands) {
            inputs.addAll(Arrays.asList(operands));
        }

        void outputs(Operand... operands) {
            outputs.addAll(Arrays.asList(operands));
        }

        Decomposition build() {
            List<Component> components = new ArrayList<>(nibbleComponents);
            components.addAll(linkComponents);
            components.addAll(combining);
            return new Decomposition(instruction, components, links, inputs, outputs, imports);
        }
    }
}
