package org.boxworld.pddl.plan;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the plan file written by a planner.
 *
 * <p>Blank lines are skipped. Comment lines only matter when they carry a {@code cost = N}
 * annotation; the last one wins. Action lines become {@link PlanStep}s in file order. Any other
 * line is dropped with a warning, or rejected when the parser is strict.</p>
 */
public class PlanParser {
    private static final Logger LOGGER = LogManager.getLogger(PlanParser.class.getName());

    private final boolean strict;

    /**
     * Creates a lenient parser.
     */
    public PlanParser() {
        this(false);
    }

    /**
     * @param strict whether lines that are neither blank, comments nor actions are errors
     */
    public PlanParser(boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * @throws PlanFormatException on the first malformed line
     */
    public PlanResult parse(String text) {
        List<PlanStep> steps = new ArrayList<>();
        Long cost = null;

        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            PlanLine line = PlanLine.classify(i + 1, lines[i]);
            switch (line.getKind()) {
                case BLANK:
                    break;
                case COMMENT:
                    Long found = line.cost().orElse(null);
                    if (found != null) {
                        cost = found;
                    }
                    break;
                case ACTION:
                    steps.add(line.toStep());
                    break;
                default:
                    if (strict) {
                        throw new PlanFormatException(line.getNumber(), "unrecognized line \"" + line.getText() + '"');
                    }
                    LOGGER.warn("Ignoring unrecognized plan line {}: {}", line.getNumber(), line.getText());
                    break;
            }
        }

        LOGGER.debug("Parsed plan with {} steps, cost {}", steps.size(), cost);
        return new PlanResult(steps, cost);
    }

    /**
     * Reads and parses a plan file.
     */
    public PlanResult parse(Path planFile) throws IOException {
        LOGGER.debug("Reading plan from {}", planFile);
        return parse(Files.readString(planFile, StandardCharsets.UTF_8));
    }
}
