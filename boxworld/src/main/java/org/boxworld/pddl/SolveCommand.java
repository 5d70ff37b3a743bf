package org.boxworld.pddl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.boxworld.pddl.plan.PlanParser;
import org.boxworld.pddl.plan.PlanResult;
import org.boxworld.pddl.plan.PlanResultWriter;
import org.boxworld.pddl.planner.PlannerConfig;
import org.boxworld.pddl.planner.PlannerRunner;
import org.boxworld.pddl.problem.ProblemEmitter;
import org.boxworld.pddl.spec.SpecificationReader;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * {@code boxworld solve}: translate, run an external planner, parse its plan.
 */
@CommandLine.Command(name = "solve", mixinStandardHelpOptions = true, sortOptions = false,
    description = "Translates a JSON instance, runs a planner on it and prints the plan as JSON.")
public class SolveCommand implements Callable<Integer> {
    private static final Logger LOGGER = LogManager.getLogger(SolveCommand.class.getName());

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "<json>", description = "The JSON instance file.")
    private Path input;

    @CommandLine.Option(names = {"-p", "--planner"}, required = true, paramLabel = "<exe>",
        description = "The planner executable.")
    private String planner;

    @CommandLine.Option(names = "--planner-arg", paramLabel = "<arg>",
        description = "Extra argument passed to the planner before the files (repeatable).")
    private List<String> plannerArgs = new ArrayList<>();

    @CommandLine.Option(names = "--plan-flag", paramLabel = "<flag>",
        description = "Flag preceding the plan file path (default: the path is positional).")
    private String planFlag;

    @CommandLine.Option(names = {"-d", "--domain"}, paramLabel = "<pddl>",
        description = "Domain file (default: the bundled BOX-WORLD domain).")
    private Path domain;

    @CommandLine.Option(names = {"-t", "--timeout"}, paramLabel = "<seconds>", defaultValue = "0",
        description = "Planner time limit in seconds, 0 for none (default: ${DEFAULT-VALUE}).")
    private long timeoutSeconds;

    @CommandLine.Option(names = "--keep-files", description = "Keep the planner working directory.")
    private boolean keepFiles;

    @CommandLine.Option(names = "--strict", description = "Reject plan lines that are not comments or actions.")
    private boolean strict;

    @CommandLine.Option(names = {"-o", "--out"}, paramLabel = "<json>",
        description = "Output JSON file (default: standard output).")
    private Path out;

    /**
     * @return the planner configuration described by the options
     */
    PlannerConfig plannerConfig() {
        return PlannerConfig.builder(planner)
            .extraArguments(plannerArgs)
            .planFlag(planFlag)
            .domainFile(domain)
            .timeout(timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null)
            .keepFiles(keepFiles)
            .build();
    }

    @Override
    public Integer call() {
        return BoxWorld.run(() -> {
            String problem = ProblemEmitter.emit(new SpecificationReader().read(input));
            PlanResult result = new PlannerRunner(plannerConfig(), new PlanParser(strict)).run(problem);
            LOGGER.info("Planner returned {} steps", result.getSteps().size());
            BoxWorld.writeOutput(spec, new PlanResultWriter().write(result), out);
            return 0;
        });
    }
}
