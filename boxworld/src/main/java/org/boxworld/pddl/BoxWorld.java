package org.boxworld.pddl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command line entry point of the Box-World translator.
 */
@CommandLine.Command(name = "boxworld", version = "boxworld 1.0",
    description = "Translates Box-World JSON problems to PDDL and reads planner output back.",
    sortOptions = false, mixinStandardHelpOptions = true, headerHeading = "Usage:%n",
    synopsisHeading = "%n", descriptionHeading = "%nDescription:%n%n",
    parameterListHeading = "%nParameters:%n", optionListHeading = "%nOptions:%n",
    commandListHeading = "%nCommands:%n",
    subcommands = {TranslateCommand.class, ParsePlanCommand.class, SolveCommand.class})
public class BoxWorld implements Callable<Integer> {
    private static final Logger LOGGER = LogManager.getLogger(BoxWorld.class.getName());

    /** Exit code for invalid input: schema, validation, plan format or planner errors. */
    public static final int EXIT_INVALID = 1;

    /** Exit code for I/O failures. */
    public static final int EXIT_IO = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        try {
            System.exit(new CommandLine(new BoxWorld()).execute(args));
        } catch (IllegalArgumentException e) {
            LOGGER.fatal(e.getMessage());
            System.exit(EXIT_INVALID);
        }
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Writes the result of a command to the given file, or to the command's output when no file
     * is given. Files always end with a newline.
     */
    static void writeOutput(CommandLine.Model.CommandSpec spec, String text, Path out) throws IOException {
        if (out == null) {
            PrintWriter writer = spec.commandLine().getOut();
            writer.println(text);
            writer.flush();
        } else {
            Files.writeString(out, text + "\n", StandardCharsets.UTF_8);
            LOGGER.info("Wrote {}", out);
        }
    }

    /**
     * Runs a command body and maps its failures onto exit codes.
     */
    static int run(Callable<Integer> body) {
        try {
            return body.call();
        } catch (BoxWorldException e) {
            LOGGER.error(e.getMessage());
            return EXIT_INVALID;
        } catch (IOException e) {
            LOGGER.error("I/O error: {}", e.getMessage());
            return EXIT_IO;
        } catch (Exception e) {
            LOGGER.fatal("Unexpected failure", e);
            return EXIT_IO;
        }
    }
}
