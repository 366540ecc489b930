package nibbler.orchestrate;

import java.util.*;
import java.util.function.Function;

import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;

import nibbler.NibblerError;
import nibbler.decompose.InstructionKind;

/**
 * Instructions of a run and the dependencies between them. An edge leads from an instruction to
 * the instructions that consume its results.
 */
public class DependencyGraph {

    private final DirectedAcyclicGraph<InstructionKind, DefaultEdge> graph;
    private final Map<InstructionKind, Integer> waves = new EnumMap<>(InstructionKind.class);

    private DependencyGraph(DirectedAcyclicGraph<InstructionKind, DefaultEdge> graph) {
        this.graph = graph;
        for (InstructionKind instruction : topologicalOrder()) {
            waves.put(instruction, dependencies(instruction).stream().mapToInt(waves::get).map(w -> w + 1)
                    .max().orElse(0));
        }
    }

    /**
     * Graph of the requested instructions and, transitively, of everything they depend on
     *
     * @throws NibblerError if the dependencies are cyclic
     */
    public static DependencyGraph of(Collection<InstructionKind> requested,
                                     Function<InstructionKind, Set<InstructionKind>> dependencies) {
        DirectedAcyclicGraph<InstructionKind, DefaultEdge> graph = new DirectedAcyclicGraph<>(DefaultEdge.class);
        Deque<InstructionKind> queue = new ArrayDeque<>(new TreeSet<>(requested));
        queue.forEach(graph::addVertex);
        while (!queue.isEmpty()) {
            InstructionKind instruction = queue.poll();
            for (InstructionKind dependency : new TreeSet<>(dependencies.apply(instruction))) {
                if (!graph.containsVertex(dependency)) {
                    graph.addVertex(dependency);
                    queue.add(dependency);
                }
                try {
                    graph.addEdge(dependency, instruction);
                } catch (IllegalArgumentException e) {
                    throw new NibblerError(String.format("Cyclic dependency between %s and %s", dependency, instruction), e);
                }
            }
        }
        return new DependencyGraph(graph);
    }

    public Set<InstructionKind> instructions() {
        return Collections.unmodifiableSet(new TreeSet<>(graph.vertexSet()));
    }

    public Set<InstructionKind> dependencies(InstructionKind instruction) {
        return new TreeSet<>(Graphs.predecessorListOf(graph, instruction));
    }

    public Set<InstructionKind> dependents(InstructionKind instruction) {
        return new TreeSet<>(Graphs.successorListOf(graph, instruction));
    }

    /**
     * Dependencies first, ties are broken by declaration order
     */
    public List<InstructionKind> topologicalOrder() {
        List<InstructionKind> order = new ArrayList<>();
        new TopologicalOrderIterator<>(graph, Comparator.<InstructionKind>naturalOrder()).forEachRemaining(order::add);
        return order;
    }

    /**
     * Wave 0 has no dependencies, every other instruction depends on at least one instruction of the previous wave
     */
    public int wave(InstructionKind instruction) {
        return waves.get(instruction);
    }

    public List<List<InstructionKind>> waves() {
        List<List<InstructionKind>> result = new ArrayList<>();
        for (InstructionKind instruction : topologicalOrder()) {
            int wave = waves.get(instruction);
            while (result.size() <= wave) {
                result.add(new ArrayList<>());
            }
            result.get(wave).add(instruction);
        }
        result.forEach(Collections::sort);
        return result;
    }
}
