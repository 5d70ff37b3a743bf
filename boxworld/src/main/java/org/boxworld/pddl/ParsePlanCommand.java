package org.boxworld.pddl;

import org.boxworld.pddl.plan.PlanParser;
import org.boxworld.pddl.plan.PlanResult;
import org.boxworld.pddl.plan.PlanResultWriter;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * {@code boxworld parse-plan}: planner plan file to JSON.
 */
@CommandLine.Command(name = "parse-plan", mixinStandardHelpOptions = true,
    description = "Converts a planner plan file to JSON.")
public class ParsePlanCommand implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "<plan>", description = "The plan file.")
    private Path input;

    @CommandLine.Option(names = {"-o", "--out"}, paramLabel = "<json>",
        description = "Output JSON file (default: standard output).")
    private Path out;

    @CommandLine.Option(names = "--strict", description = "Reject lines that are not comments or actions.")
    private boolean strict;

    @Override
    public Integer call() {
        return BoxWorld.run(() -> {
            PlanResult result = new PlanParser(strict).parse(input);
            BoxWorld.writeOutput(spec, new PlanResultWriter().write(result), out);
            return 0;
        });
    }
}
