package org.boxworld.pddl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.boxworld.pddl.problem.ProblemChecker;
import org.boxworld.pddl.problem.ProblemEmitter;
import org.boxworld.pddl.spec.Specification;
import org.boxworld.pddl.spec.SpecificationReader;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * {@code boxworld translate}: JSON problem to PDDL problem.
 */
@CommandLine.Command(name = "translate", mixinStandardHelpOptions = true,
    description = "Converts a Box-World JSON instance to a BOX-WORLD PDDL problem.")
public class TranslateCommand implements Callable<Integer> {
    private static final Logger LOGGER = LogManager.getLogger(TranslateCommand.class.getName());

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "<json>", description = "The JSON instance file.")
    private Path input;

    @CommandLine.Option(names = {"-o", "--out"}, paramLabel = "<pddl>",
        description = "Output PDDL file (default: standard output).")
    private Path out;

    @CommandLine.Option(names = "--check",
        description = "Parse the generated problem with pddl4j against the bundled domain.")
    private boolean check;

    @Override
    public Integer call() {
        return BoxWorld.run(() -> {
            Specification specification = new SpecificationReader().read(input);
            String problem = ProblemEmitter.emit(specification);
            if (check) {
                List<String> errors = new ProblemChecker().check(problem);
                if (!errors.isEmpty()) {
                    errors.forEach(LOGGER::error);
                    return BoxWorld.EXIT_INVALID;
                }
            }
            BoxWorld.writeOutput(spec, problem, out);
            return 0;
        });
    }
}
