package nibbler.solver;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;

import nibbler.contract.Component;
import nibbler.emit.ComponentEmitter;

/**
 * Runs the solver driver as <code>driver query-file</code>. A component is satisfiable if the
 * standard output contains <code>solution:</code>.
 */
public class ExternalSolver extends Solver {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    static final String SOLUTION_MARKER = "solution:";

    private static final Pattern WITNESS_LINE = Pattern.compile("^\\s*([A-Za-z][A-Za-z0-9_]*)\\s*:?=\\s*([01])\\s*$");

    public final String driver;
    public final Duration timeout;
    private final ComponentEmitter emitter;

    public ExternalSolver(String driver) {
        this(driver, DEFAULT_TIMEOUT);
    }

    public ExternalSolver(String driver, Duration timeout) {
        this.driver = driver;
        this.timeout = timeout;
        this.emitter = new ComponentEmitter();
    }

    @Override
    public String name() {
        return driver;
    }

    @Override
    public Result solve(Component component) {
        Path file = null;
        try {
            file = Files.createTempFile(component.name(), ComponentEmitter.FILE_EXTENSION);
            Files.write(file, emitter.render(component).getBytes(StandardCharsets.UTF_8));
            String output = run(component.name(), file);
            if (!output.contains(SOLUTION_MARKER)) {
                return Result.unproven(StringUtils.abbreviate(StringUtils.normalizeSpace(output), 80));
            }
            return Result.satisfiable(parseWitness(output));
        } catch (SolverUnavailable | SolverTimeout e) {
            LOG.warning(e.getMessage());
            return Result.unproven(e.getMessage());
        } catch (IOException e) {
            LOG.warning(String.format("Cannot write query of %s: %s", component.name(), e.getMessage()));
            return Result.unproven(e.getMessage());
        } catch (UncheckedIOException e) {
            LOG.warning(String.format("Solver failed on %s: %s", component.name(), e.getMessage()));
            return Result.unproven(e.getMessage());
        } finally {
            if (file != null) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    LOG.fine(String.format("Cannot delete %s: %s", file, e.getMessage()));
                }
            }
        }
    }

    /**
     * @return the standard output of the driver
     */
    String run(String component, Path file) {
        Process process;
        try {
            process = new ProcessBuilder(driver, file.toString()).start();
        } catch (IOException e) {
            throw new SolverUnavailable(driver, e);
        }
        ExecutorService streams = Executors.newFixedThreadPool(2);
        try {
            Future<String> output = streams.submit(() -> IOUtils.toString(process.getInputStream(), StandardCharsets.UTF_8));
            Future<String> error = streams.submit(() -> IOUtils.toString(process.getErrorStream(), StandardCharsets.UTF_8));
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new SolverTimeout(component, timeout);
            }
            String err = error.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!err.isEmpty()) {
                LOG.fine(String.format("%s: %s", component, err));
            }
            return output.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new SolverTimeout(component, timeout);
        } catch (TimeoutException e) {
            process.destroyForcibly();
            throw new SolverTimeout(component, timeout);
        } catch (ExecutionException e) {
            throw new UncheckedIOException(new IOException("Cannot read solver output", e.getCause()));
        } finally {
            streams.shutdownNow();
        }
    }

    /**
     * Collects <code>name := value</code> lines after the solution marker
     */
    static Map<String, Boolean> parseWitness(String output) {
        Map<String, Boolean> witness = new LinkedHashMap<>();
        String rest = output.substring(output.indexOf(SOLUTION_MARKER) + SOLUTION_MARKER.length());
        for (String line : rest.split("\\R")) {
            Matcher matcher = WITNESS_LINE.matcher(line);
            if (matcher.matches()) {
                witness.put(matcher.group(1), matcher.group(2).equals("1"));
            }
        }
        return witness;
    }
}
