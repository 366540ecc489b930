package nibbler.solver;

import java.util.*;
import java.util.concurrent.*;

import nibbler.NibblerError;
import nibbler.contract.Component;
import nibbler.contract.InstructionPlan;
import nibbler.decompose.InstructionKind;

import static nibbler.solver.Solver.LOG;

/**
 * Passes every component of the given plans to a solver, in parallel
 */
public class ComponentVerifier {

    public static class Tally {

        public final int satisfiable;
        public final int unproven;
        /**
         * Names of the components that could not be shown to be satisfiable
         */
        public final List<String> unprovenComponents;

        public Tally(int satisfiable, List<String> unprovenComponents) {
            this.satisfiable = satisfiable;
            this.unproven = unprovenComponents.size();
            this.unprovenComponents = Collections.unmodifiableList(new ArrayList<>(unprovenComponents));
        }

        public boolean allSatisfiable() {
            return unproven == 0;
        }

        @Override
        public String toString() {
            return String.format("%d satisfiable, %d unproven", satisfiable, unproven);
        }
    }

    private final Solver solver;
    private final int workers;

    public ComponentVerifier(Solver solver, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("At least one worker needed");
        }
        this.solver = solver;
        this.workers = workers;
    }

    public Map<InstructionKind, Tally> verify(Collection<InstructionPlan> plans) {
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            Map<InstructionKind, List<Future<Solver.Result>>> futures = new EnumMap<>(InstructionKind.class);
            for (InstructionPlan plan : plans) {
                List<Future<Solver.Result>> results = new ArrayList<>();
                for (Component component : plan.components) {
                    results.add(pool.submit(() -> solver.solve(component)));
                }
                futures.put(plan.instruction, results);
            }
            Map<InstructionKind, Tally> tallies = new EnumMap<>(InstructionKind.class);
            for (InstructionPlan plan : plans) {
                int satisfiable = 0;
                List<String> unproven = new ArrayList<>();
                List<Future<Solver.Result>> results = futures.get(plan.instruction);
                for (int i = 0; i < plan.components.size(); i++) {
                    Solver.Result result = results.get(i).get();
                    if (result.isSatisfiable()) {
                        satisfiable++;
                    } else {
                        String name = plan.components.get(i).name();
                        LOG.info(String.format("%s is unproven: %s", name, result.reason().orElse("")));
                        unproven.add(name);
                    }
                }
                tallies.put(plan.instruction, new Tally(satisfiable, unproven));
            }
            return tallies;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NibblerError("Verification interrupted", e);
        } catch (ExecutionException e) {
            throw new NibblerError("Verification failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }
}
