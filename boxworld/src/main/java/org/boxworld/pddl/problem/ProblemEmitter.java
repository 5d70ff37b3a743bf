package org.boxworld.pddl.problem;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.boxworld.pddl.spec.Specification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders a specification as a PDDL problem of the BOX-WORLD domain.
 *
 * <p>The output is reproducible: objects keep their canonical declaration order and initial
 * facts are sorted by text, so two specifications describing the same state print the same
 * {@code :init} block whatever order the input used.</p>
 */
public final class ProblemEmitter {
    private static final Logger LOGGER = LogManager.getLogger(ProblemEmitter.class.getName());

    /** Name of the domain every emitted problem refers to. */
    public static final String DOMAIN_NAME = "BOX-WORLD";

    private ProblemEmitter() {
    }

    /**
     * @return the problem text, lines separated by {@code \n}, without a trailing newline
     */
    public static String emit(Specification spec) {
        List<Atom> init = new ArrayList<>(FactDeriver.derive(spec));
        Collections.sort(init);

        String objects = String.join(" ", spec.getBoxes().getNames()) + " - box\n          "
            + String.join(" ", spec.getLocations().getNames()) + " - location";

        List<String> lines = new ArrayList<>();
        lines.add("(define (problem " + spec.getProblemName() + ")");
        lines.add("  (:domain " + DOMAIN_NAME + ")");
        lines.add("  (:objects " + objects + ")");
        lines.add("  (:init");
        for (Atom fact : init) {
            lines.add("    " + fact);
        }
        lines.add("  )");
        lines.add("  (:goal " + GoalFormulaBuilder.build(spec.getGoal()) + ")");
        lines.add(")");

        LOGGER.info("Emitted problem {} with {} objects and {} initial facts", spec.getProblemName(),
            spec.getBoxes().size() + spec.getLocations().size(), init.size());
        return String.join("\n", lines);
    }
}
