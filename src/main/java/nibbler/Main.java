package nibbler;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import nibbler.decompose.InstructionKind;
import nibbler.decompose.MixingFunction;
import nibbler.decompose.RotateXorMixing;
import nibbler.decompose.UnknownInstruction;
import nibbler.emit.SizeBudgetEnforcer;
import nibbler.orchestrate.*;
import nibbler.solver.*;
import nibbler.vm.PlanValidator;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;

import static picocli.CommandLine.*;

/**
 * Generates the components on the command line
 */
@Command(description = "Decompose VM instructions into nibble sized constraint components and write them " +
        "as solver query files. Generates all instructions if none are given.",
        showDefaultValues = true, mixinStandardHelpOptions = true, name = "nibbler")
public class Main implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(description = "Instructions to generate, e.g. ADD or JZ", arity = "0..*")
    private List<String> instructions = new ArrayList<>();

    @Option(names = {"-o", "--output"}, description = "Output directory, nothing is written if absent")
    private Path output;

    @Option(names = {"-w", "--workers"}, description = "Number of instructions generated in parallel, at most 8")
    private int workers = GenerationOptions.defaultWorkers();

    @Option(names = "--width", description = "Word width in bits, a multiple of 4")
    private int width = 32;

    @Option(names = "--max-chars", description = "Maximum length of a solve expression")
    private int maxChars = SizeBudgetEnforcer.MAX_EXPR_CHARS;

    @Option(names = "--address-bits", description = "Valid address bits of memory accesses, defaults to " +
            "16 or the width if it is smaller")
    private Integer addressBits;

    @Option(names = "--mixing", description = "Mixing function of the crypto instructions: rotate-xor, xor-fold")
    private MixingFunction mixing = new RotateXorMixing();

    @Option(names = "--strict", description = "Exit with 1 if any instruction is not complete")
    private boolean strict;

    @Option(names = "--validate", description = "Pass every generated component to the solver")
    private boolean validate;

    @Option(names = "--solver", description = "Solver driver, called as 'driver file', in process solver if absent")
    private String solver;

    @Option(names = "--solver-timeout", description = "Seconds per solver call")
    private long solverTimeout = ExternalSolver.DEFAULT_TIMEOUT.getSeconds();

    @Option(names = "--dependency-timeout", description = "Seconds an instruction waits for its dependencies")
    private long dependencyTimeout = GenerationOptions.DEFAULT_DEPENDENCY_TIMEOUT.getSeconds();

    @Option(names = {"-v", "--verbose"}, description = "Log per component details")
    private boolean verbose;

    @Option(names = "--csv", description = "Print the summary as csv")
    private boolean csv;

    @Override
    public Integer call() {
        if (verbose) {
            verbose();
        }
        Set<InstructionKind> requested = EnumSet.noneOf(InstructionKind.class);
        int unknown = 0;
        for (String instruction : instructions) {
            try {
                requested.add(InstructionKind.from(instruction));
            } catch (UnknownInstruction e) {
                Orchestrator.LOG.severe(e.getMessage());
                unknown++;
            }
        }
        GenerationOptions options;
        try {
            GenerationOptions.Builder builder = GenerationOptions.builder()
                    .width(width)
                    .maxExpressionChars(maxChars)
                    .mixing(mixing)
                    .workers(workers)
                    .dependencyTimeout(Duration.ofSeconds(dependencyTimeout))
                    .outputDirectory(output);
            if (addressBits != null) {
                builder.addressBits(addressBits);
            }
            options = builder.build();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
        Orchestrator orchestrator = new Orchestrator(options);
        GenerationResult result = instructions.isEmpty() ? orchestrator.runAll() : orchestrator.run(requested);
        Map<InstructionKind, ComponentVerifier.Tally> tallies = Collections.emptyMap();
        if (validate) {
            tallies = new ComponentVerifier(solver(), options.workers).verify(result.plans().values());
            tallies.forEach(result.manifest::recordValidation);
            options.outputDirectory().ifPresent(result.manifest::write);
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println(new SummaryTable(result, tallies).render(csv ? SummaryTable.Mode.CSV : SummaryTable.Mode.NICE));
        out.flush();
        return unknown > 0 && strict ? 1 : result.exitCode(strict);
    }

    private Solver solver() {
        if (solver == null) {
            return new InProcessSolver();
        }
        return new ExternalSolver(solver, Duration.ofSeconds(solverTimeout));
    }

    private static void verbose() {
        for (Logger logger : Arrays.asList(Orchestrator.LOG, Solver.LOG, PlanValidator.LOG)) {
            logger.setLevel(Level.FINE);
        }
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    public static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new Main());
        commandLine.registerConverter(MixingFunction.class, MixingFunction::from);
        return commandLine;
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
