package nibbler.solver;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import nibbler.contract.Component;

/**
 * Checks single components for satisfiability. Everything that is not a found solution,
 * including solver failures, is reported as unproven and never as unsatisfiable.
 */
public abstract class Solver {

    public static final Logger LOG = Logger.getLogger("Solver");

    static {
        LOG.setLevel(Level.INFO);
    }

    public enum Verdict {
        SATISFIABLE, UNPROVEN;

        @Override
        public String toString() {
            return name().toLowerCase();
        }
    }

    public static class Result {

        public final Verdict verdict;
        /**
         * Variable name to value, might be incomplete for external solvers
         */
        public final Map<String, Boolean> witness;
        @Nullable
        public final String reason;

        private Result(Verdict verdict, Map<String, Boolean> witness, @Nullable String reason) {
            this.verdict = verdict;
            this.witness = Collections.unmodifiableMap(new TreeMap<>(witness));
            this.reason = reason;
        }

        public static Result satisfiable(Map<String, Boolean> witness) {
            return new Result(Verdict.SATISFIABLE, witness, null);
        }

        public static Result unproven(String reason) {
            return new Result(Verdict.UNPROVEN, Collections.emptyMap(), reason);
        }

        public boolean isSatisfiable() {
            return verdict == Verdict.SATISFIABLE;
        }

        public Optional<String> reason() {
            return Optional.ofNullable(reason);
        }

        @Override
        public String toString() {
            return reason == null ? verdict.toString() : String.format("%s (%s)", verdict, reason);
        }
    }

    public abstract String name();

    public abstract Result solve(Component component);
}
