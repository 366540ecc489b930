package nibbler.solver;

import nibbler.NibblerError;

/**
 * The external solver could not be started
 */
public class SolverUnavailable extends NibblerError {

    public SolverUnavailable(String driver, Throwable cause) {
        super(String.format("Solver %s is not available: %s", driver, cause.getMessage()), cause);
    }
}
