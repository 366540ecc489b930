package nibbler.contract;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * What a variable stands for. The token is the letters-only part of the rendered variable name.
 */
public enum Role {
    OPERAND_A("a", Scope.BIT),
    OPERAND_B("b", Scope.BIT),
    SUM("s", Scope.BIT),
    CARRY("c", Scope.BIT),
    RESULT("r", Scope.BIT),
    ADDRESS("ad", Scope.BIT),
    BUS("ab", Scope.BIT),
    DATA("d", Scope.BIT),
    VALUE("v", Scope.BIT),
    SP("sp", Scope.BIT),
    SP_NEXT("sq", Scope.BIT),
    SLOT("st", Scope.BIT),
    TOP("tp", Scope.BIT),
    SECOND("nd", Scope.BIT),
    NEW_TOP("nt", Scope.BIT),
    NEW_SECOND("nn", Scope.BIT),
    PC("pc", Scope.BIT),
    PC_NEXT("pn", Scope.BIT),
    TARGET("t", Scope.BIT),
    MESSAGE("m", Scope.BIT),
    KEY("k", Scope.BIT),
    STATE_IN("hi", Scope.BIT),
    STATE_OUT("ho", Scope.BIT),
    SIGNATURE("sg", Scope.BIT),
    SP_CARRY("spc", Scope.BIT),

    CARRY_IN("ci", Scope.NIBBLE),
    CARRY_OUT("co", Scope.NIBBLE),
    SP_CARRY_IN("spi", Scope.NIBBLE),
    SP_CARRY_OUT("spo", Scope.NIBBLE),
    SHIFT_IN("si", Scope.NIBBLE),
    SHIFT_OUT("so", Scope.NIBBLE),
    EQ("eq", Scope.NIBBLE),
    NE("ne", Scope.NIBBLE),
    LT("lt", Scope.NIBBLE),
    GT("gt", Scope.NIBBLE),
    HIGH_ZERO("hz", Scope.NIBBLE),
    OK("ok", Scope.NIBBLE),

    OVERFLOW("ovf", Scope.WORD),
    UNDERFLOW("udf", Scope.WORD),
    EQ_FINAL("eqfinal", Scope.WORD),
    NEQ_FINAL("neqfinal", Scope.WORD),
    LT_FINAL("ltfinal", Scope.WORD),
    GT_FINAL("gtfinal", Scope.WORD),
    LTE_FINAL("ltefinal", Scope.WORD),
    GTE_FINAL("gtefinal", Scope.WORD),
    ALIGNED("aligned", Scope.WORD),
    IN_BOUNDS("inbounds", Scope.WORD),
    ADDRESS_OK("addrok", Scope.WORD),
    VERIFIED("verified", Scope.WORD);

    /**
     * Granularity of a variable: a single bit of a nibble, a per nibble flag or an instruction wide flag
     */
    public enum Scope {
        BIT, NIBBLE, WORD
    }

    public final String token;
    public final Scope scope;

    Role(String token, Scope scope) {
        this.token = token;
        this.scope = scope;
    }

    static {
        Set<String> tokens = new HashSet<>();
        for (Role role : values()) {
            if (!role.token.chars().allMatch(Character::isLetter) || !tokens.add(role.token)) {
                throw new ExceptionInInitializerError("Invalid or duplicate role token " + role.token);
            }
        }
    }

    public static Role fromToken(String token) {
        return Arrays.stream(values()).filter(r -> r.token.equals(token)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException(String.format("No such role token '%s'", token)));
    }

    @Override
    public String toString() {
        return token;
    }
}
