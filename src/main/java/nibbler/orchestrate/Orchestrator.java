package nibbler.orchestrate;

import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import nibbler.NibblerError;
import nibbler.contract.Component;
import nibbler.contract.InstructionPlan;
import nibbler.contract.VariableId;
import nibbler.decompose.*;
import nibbler.emit.ComponentEmitter;
import nibbler.emit.ExpressionTooLong;
import nibbler.emit.SizeBudgetEnforcer;

/**
 * Generates the components of a set of instructions. Instructions run in parallel on a fixed
 * pool, an instruction starts as soon as all of its dependencies are finished.
 */
public class Orchestrator {

    public static final Logger LOG = Logger.getLogger("Generation");

    static {
        LOG.setLevel(Level.INFO);
    }

    private final GenerationOptions options;
    private final RuleRegistry rules;
    private final DecompositionContext context;
    private final SizeBudgetEnforcer budget;
    private final ComponentEmitter emitter = new ComponentEmitter();

    public Orchestrator(GenerationOptions options, RuleRegistry rules) {
        this.options = options;
        this.rules = rules;
        this.context = options.decompositionContext();
        this.budget = options.budget();
    }

    public Orchestrator(GenerationOptions options) {
        this(options, RuleRegistry.standard());
    }

    /**
     * Generates every instruction that has a rule
     */
    public GenerationResult runAll() {
        return run(rules.instructions());
    }

    /**
     * Generates the requested instructions and everything they depend on. Writes the components and
     * the manifest if an output directory is configured.
     */
    public GenerationResult run(Collection<InstructionKind> requested) {
        DependencyGraph graph = DependencyGraph.of(requested, options::dependencies);
        InstructionTracker tracker = new InstructionTracker(graph.instructions());
        Manifest manifest = new Manifest(options.width, options.maxExpressionChars);
        ExecutorService pool = Executors.newFixedThreadPool(options.workers);
        Map<InstructionKind, CompletableFuture<InstructionReport>> futures = new ConcurrentHashMap<>();
        try {
            for (InstructionKind instruction : graph.topologicalOrder()) {
                CompletableFuture<?>[] dependencies = graph.dependencies(instruction).stream()
                        .map(futures::get).toArray(CompletableFuture[]::new);
                CompletableFuture<Void> ready = CompletableFuture.allOf(dependencies)
                        .orTimeout(options.dependencyTimeout.toMillis(), TimeUnit.MILLISECONDS);
                futures.put(instruction, ready.handleAsync((v, t) ->
                        process(instruction, graph, futures, t, tracker, manifest), pool));
            }
            Map<InstructionKind, InstructionReport> reports = new EnumMap<>(InstructionKind.class);
            futures.forEach((k, f) -> reports.put(k, f.join()));
            options.outputDirectory().ifPresent(manifest::write);
            return new GenerationResult(reports, graph.waves(), manifest);
        } catch (CompletionException e) {
            throw new NibblerError("Generation failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private InstructionReport process(InstructionKind instruction, DependencyGraph graph,
                                      Map<InstructionKind, CompletableFuture<InstructionReport>> futures,
                                      Throwable waitError, InstructionTracker tracker, Manifest manifest) {
        long start = System.nanoTime();
        int wave = graph.wave(instruction);
        InstructionReport report;
        try {
            if (waitError != null) {
                throw new DependencyTimeout(instruction, String.format("no result after %d s",
                        options.dependencyTimeout.getSeconds()));
            }
            Map<InstructionKind, InstructionReport> dependencies = new EnumMap<>(InstructionKind.class);
            for (InstructionKind dependency : graph.dependencies(instruction)) {
                InstructionReport dependencyReport = futures.get(dependency).join();
                if (dependencyReport.state != InstructionState.COMPLETE) {
                    throw new DependencyTimeout(instruction, String.format("%s is %s", dependency,
                            dependencyReport.state));
                }
                dependencies.put(dependency, dependencyReport);
            }
            report = generate(instruction, wave, dependencies, tracker, start);
        } catch (NibblerError e) {
            report = InstructionReport.failed(instruction, wave, e, since(start));
        } catch (RuntimeException e) {
            report = InstructionReport.failed(instruction, wave,
                    new NibblerError(String.format("Generation of %s failed: %s", instruction, e.getMessage()), e),
                    since(start));
        }
        if (report.state == InstructionState.FAILED) {
            LOG.warning(report.toString());
        } else {
            LOG.info(report.toString());
        }
        manifest.record(report, options.outputDirectory());
        tracker.advance(instruction, report.state);
        return report;
    }

    private InstructionReport generate(InstructionKind instruction, int wave,
                                       Map<InstructionKind, InstructionReport> dependencies,
                                       InstructionTracker tracker, long start) {
        DecompositionRule rule = rules.rule(instruction);
        tracker.advance(instruction, InstructionState.GENERATING);
        Decomposition decomposition = rule.decompose(instruction, context);
        List<Component> accepted = new ArrayList<>();
        List<ExpressionTooLong> rejections = new ArrayList<>();
        for (Component component : decomposition.components) {
            Optional<ExpressionTooLong> rejection = budget.check(component);
            if (rejection.isPresent()) {
                LOG.warning(rejection.get().getMessage());
                rejections.add(rejection.get());
            } else {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine(String.format("%s: %d characters", component, component.expression().length()));
                }
                accepted.add(component);
            }
        }
        InstructionPlan plan = decomposition.toPlan(accepted);
        checkImports(plan, dependencies);
        List<Path> files = options.outputDirectory().map(out -> emitter.write(plan, out))
                .orElse(Collections.emptyList());
        InstructionState state = rejections.isEmpty() ? InstructionState.COMPLETE : InstructionState.PARTIALLY_FAILED;
        return new InstructionReport(instruction, state, wave, plan, rejections, null, files, since(start));
    }

    /**
     * Every imported variable has to be computed by an accepted component of a dependency
     */
    private void checkImports(InstructionPlan plan, Map<InstructionKind, InstructionReport> dependencies) {
        List<VariableId> unresolved = plan.imports.stream()
                .filter(v -> !Optional.ofNullable(dependencies.get(v.instruction))
                        .flatMap(InstructionReport::plan)
                        .map(p -> p.components.stream().anyMatch(c -> c.contract.mentions(v)))
                        .orElse(false))
                .collect(Collectors.toList());
        if (!unresolved.isEmpty()) {
            throw new NibblerError(String.format("%s imports %s, no dependency provides them", plan.instruction,
                    unresolved));
        }
    }

    private static Duration since(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }
}
