package nibbler.emit;

import java.util.Optional;

import nibbler.contract.Component;
import nibbler.contract.Contract;

/**
 * Rejects components whose solve expression the solver would not accept
 */
public class SizeBudgetEnforcer {

    public static final int MAX_EXPR_CHARS = 700;

    /**
     * Hard limit of the solver itself, budgets above it are configuration errors
     */
    public static final int SOLVER_CEILING = 800;

    public final int limit;

    public SizeBudgetEnforcer() {
        this(MAX_EXPR_CHARS);
    }

    public SizeBudgetEnforcer(int limit) {
        if (limit < 1 || limit > SOLVER_CEILING) {
            throw new IllegalArgumentException(String.format("Expression budget has to be in [1, %d], got %d",
                    SOLVER_CEILING, limit));
        }
        this.limit = limit;
    }

    public Optional<ExpressionTooLong> check(Contract contract) {
        return check(contract.name, contract.expression());
    }

    public Optional<ExpressionTooLong> check(Component component) {
        return check(component.name(), component.expression());
    }

    public void enforce(Component component) {
        Optional<ExpressionTooLong> error = check(component);
        if (error.isPresent()) {
            throw error.get();
        }
    }

    private Optional<ExpressionTooLong> check(String name, String expression) {
        if (expression.length() > limit) {
            return Optional.of(new ExpressionTooLong(name, expression.length(), limit));
        }
        return Optional.empty();
    }
}
