package nibbler.solver;

import java.time.Duration;

import nibbler.NibblerError;

public class SolverTimeout extends NibblerError {

    public final Duration timeout;

    public SolverTimeout(String component, Duration timeout) {
        super(String.format("Solver did not finish %s within %d ms", component, timeout.toMillis()));
        this.timeout = timeout;
    }
}
