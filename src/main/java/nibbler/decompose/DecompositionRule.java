package nibbler.decompose;

/**
 * Turns an instruction into components
 */
@FunctionalInterface
public interface DecompositionRule {

    Decomposition decompose(InstructionKind instruction, DecompositionContext context);
}
