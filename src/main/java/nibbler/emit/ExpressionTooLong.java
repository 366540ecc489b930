package nibbler.emit;

import nibbler.NibblerError;

/**
 * The solve expression of a component exceeds the character budget of the solver
 */
public class ExpressionTooLong extends NibblerError {

    public final String component;
    public final int actualLength;
    public final int limit;

    public ExpressionTooLong(String component, int actualLength, int limit) {
        super(String.format("Expression of component %s has %d characters, the limit is %d",
                component, actualLength, limit));
        this.component = component;
        this.actualLength = actualLength;
        this.limit = limit;
    }
}
