package nibbler.orchestrate;

import java.nio.file.Path;
import java.time.Duration;
import java.util.*;

import javax.annotation.Nullable;

import nibbler.decompose.DecompositionContext;
import nibbler.decompose.InstructionKind;
import nibbler.decompose.MixingFunction;
import nibbler.decompose.RotateXorMixing;
import nibbler.emit.SizeBudgetEnforcer;

/**
 * Immutable configuration of a generation run, see {@link #builder()} for the defaults
 */
public class GenerationOptions {

    public static final int MAX_WORKERS = 8;
    public static final Duration DEFAULT_DEPENDENCY_TIMEOUT = Duration.ofSeconds(300);

    public final int width;
    public final int addressBits;
    public final MixingFunction mixing;
    public final int maxExpressionChars;
    public final int workers;
    public final Duration dependencyTimeout;
    /**
     * Where components and the manifest are written, nothing is written if null
     */
    @Nullable
    public final Path outputDirectory;
    /**
     * Dependencies on top of {@link InstructionKind#dependencies()}
     */
    public final Map<InstructionKind, Set<InstructionKind>> extraDependencies;

    private GenerationOptions(Builder builder) {
        this.width = builder.width;
        this.addressBits = builder.addressBits != null ? builder.addressBits :
                Math.min(DecompositionContext.DEFAULT_ADDRESS_BITS, builder.width);
        this.mixing = builder.mixing;
        this.maxExpressionChars = builder.maxExpressionChars;
        this.workers = builder.workers;
        this.dependencyTimeout = builder.dependencyTimeout;
        this.outputDirectory = builder.outputDirectory;
        Map<InstructionKind, Set<InstructionKind>> extra = new EnumMap<>(InstructionKind.class);
        builder.extraDependencies.forEach((k, v) -> extra.put(k, Collections.unmodifiableSet(EnumSet.copyOf(v))));
        this.extraDependencies = Collections.unmodifiableMap(extra);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GenerationOptions defaults() {
        return builder().build();
    }

    public DecompositionContext decompositionContext() {
        return new DecompositionContext(width, addressBits, mixing);
    }

    public SizeBudgetEnforcer budget() {
        return new SizeBudgetEnforcer(maxExpressionChars);
    }

    public Optional<Path> outputDirectory() {
        return Optional.ofNullable(outputDirectory);
    }

    public Set<InstructionKind> dependencies(InstructionKind instruction) {
        Set<InstructionKind> dependencies = EnumSet.noneOf(InstructionKind.class);
        dependencies.addAll(instruction.dependencies());
        dependencies.addAll(extraDependencies.getOrDefault(instruction, Collections.emptySet()));
        return dependencies;
    }

    public static int defaultWorkers() {
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), MAX_WORKERS));
    }

    public static class Builder {

        private int width = DecompositionContext.DEFAULT_WIDTH;
        private Integer addressBits;
        private MixingFunction mixing = new RotateXorMixing();
        private int maxExpressionChars = SizeBudgetEnforcer.MAX_EXPR_CHARS;
        private int workers = defaultWorkers();
        private Duration dependencyTimeout = DEFAULT_DEPENDENCY_TIMEOUT;
        private Path outputDirectory;
        private final Map<InstructionKind, Set<InstructionKind>> extraDependencies = new EnumMap<>(InstructionKind.class);

        private Builder() {
        }

        public Builder width(int width) {
            this.width = width;
            return this;
        }

        /**
         * Defaults to 16 or the width if it is smaller
         */
        public Builder addressBits(int addressBits) {
            this.addressBits = addressBits;
            return this;
        }

        public Builder mixing(MixingFunction mixing) {
            this.mixing = Objects.requireNonNull(mixing);
            return this;
        }

        public Builder maxExpressionChars(int maxExpressionChars) {
            this.maxExpressionChars = maxExpressionChars;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder dependencyTimeout(Duration dependencyTimeout) {
            this.dependencyTimeout = Objects.requireNonNull(dependencyTimeout);
            return this;
        }

        public Builder outputDirectory(@Nullable Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder dependency(InstructionKind dependent, InstructionKind dependency) {
            extraDependencies.computeIfAbsent(dependent, k -> EnumSet.noneOf(InstructionKind.class)).add(dependency);
            return this;
        }

        /**
         * @throws IllegalArgumentException for invalid values
         */
        public GenerationOptions build() {
            if (workers < 1 || workers > MAX_WORKERS) {
                throw new IllegalArgumentException(String.format("Workers have to be in [1, %d], got %d",
                        MAX_WORKERS, workers));
            }
            if (dependencyTimeout.isNegative() || dependencyTimeout.isZero()) {
                throw new IllegalArgumentException("Dependency timeout has to be positive");
            }
            GenerationOptions options = new GenerationOptions(this);
            // validates width, address bits and budget
            options.decompositionContext();
            options.budget();
            return options;
        }
    }
}
