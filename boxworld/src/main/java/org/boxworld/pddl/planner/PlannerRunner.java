package org.boxworld.pddl.planner;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.boxworld.pddl.plan.PlanParser;
import org.boxworld.pddl.plan.PlanResult;
import org.boxworld.pddl.problem.BoxWorldDomain;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs an external planner on a problem and parses the plan it writes.
 *
 * <p>Each call is one blocking run in a fresh temporary directory. A failed run is reported as a
 * {@link PlannerException} and never retried.</p>
 */
public class PlannerRunner {
    private static final Logger LOGGER = LogManager.getLogger(PlannerRunner.class.getName());

    // Number of output characters kept in error messages
    private static final int OUTPUT_TAIL = 2000;

    private final PlannerConfig config;
    private final PlanParser planParser;

    public PlannerRunner(PlannerConfig config, PlanParser planParser) {
        this.config = config;
        this.planParser = planParser;
    }

    /**
     * Builds the planner command line for the given files.
     */
    public List<String> command(Path domainFile, Path problemFile, Path planFile) {
        List<String> command = new ArrayList<>();
        command.add(config.getExecutable());
        command.addAll(config.getExtraArguments());
        command.add(domainFile.toString());
        command.add(problemFile.toString());
        config.getPlanFlag().ifPresent(command::add);
        command.add(planFile.toString());
        return command;
    }

    /**
     * Writes the problem, runs the planner and parses its plan.
     *
     * @param problemText the PDDL problem
     * @return the parsed plan
     * @throws PlannerException if the planner fails, times out or writes no plan
     * @throws IOException      if the working files cannot be written or read
     */
    public PlanResult run(String problemText) throws IOException {
        Path workDir = Files.createTempDirectory("boxworld-planner");
        try {
            Path domainFile = config.getDomainFile().isPresent()
                ? config.getDomainFile().get()
                : BoxWorldDomain.writeTo(workDir.resolve("domain.pddl"));
            Path problemFile = workDir.resolve("problem.pddl");
            Path planFile = workDir.resolve("plan.out");
            Path outputFile = workDir.resolve("planner.log");
            Files.writeString(problemFile, problemText + "\n", StandardCharsets.UTF_8);

            List<String> command = command(domainFile, problemFile, planFile);
            LOGGER.info("Running planner: {}", String.join(" ", command));
            int exitCode = execute(command, workDir, outputFile);

            if (exitCode != 0) {
                throw new PlannerException("Planner exited with code " + exitCode + ":\n" + tail(outputFile), exitCode);
            }
            if (!Files.exists(planFile)) {
                throw new PlannerException("Planner wrote no plan file:\n" + tail(outputFile), exitCode);
            }
            return planParser.parse(planFile);
        } finally {
            if (config.isKeepFiles()) {
                LOGGER.info("Planner files kept in {}", workDir);
            } else {
                deleteQuietly(workDir);
            }
        }
    }

    private int execute(List<String> command, Path workDir, Path outputFile) throws IOException {
        Process process;
        try {
            process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(outputFile.toFile())
                .start();
        } catch (IOException e) {
            throw new PlannerException("Cannot start planner " + config.getExecutable(), e);
        }

        try {
            if (config.getTimeout().isPresent()) {
                long millis = config.getTimeout().get().toMillis();
                if (!process.waitFor(millis, TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    throw new PlannerException("Planner timed out after " + millis + " ms", -1);
                }
                return process.exitValue();
            }
            return process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new PlannerException("Interrupted while waiting for the planner", e);
        }
    }

    private static String tail(Path outputFile) throws IOException {
        if (!Files.exists(outputFile)) {
            return "";
        }
        String output = new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
        return output.length() <= OUTPUT_TAIL ? output : output.substring(output.length() - OUTPUT_TAIL);
    }

    /**
     * Removes the working directory. A failure here is logged so that it never hides the
     * outcome of the run.
     */
    private static void deleteQuietly(Path dir) {
        try {
            deleteRecursively(dir);
        } catch (IOException | UncheckedIOException e) {
            LOGGER.warn("Cannot remove planner directory {}: {}", dir, e.getMessage());
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(path);
            }
        }
    }
}
