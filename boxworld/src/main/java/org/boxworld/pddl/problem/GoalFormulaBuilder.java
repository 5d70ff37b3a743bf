package org.boxworld.pddl.problem;

import org.boxworld.pddl.spec.GoalSpec;
import org.boxworld.pddl.spec.NamePair;

import java.util.ArrayList;
import java.util.List;

/**
 * Composes the goal formula of a problem as a conjunction.
 */
public final class GoalFormulaBuilder {

    /** The conjunction of nothing. */
    public static final String EMPTY_CONJUNCTION = "(and)";

    private GoalFormulaBuilder() {
    }

    /**
     * Lists the parts of the goal: {@code on} atoms, then {@code box-at} atoms, then {@code clear}
     * atoms, then the raw fragments exactly as given.
     */
    public static List<String> parts(GoalSpec goal) {
        List<String> parts = new ArrayList<>();
        for (NamePair pair : goal.getOn()) {
            parts.add(new Atom(Predicates.ON, pair.getFirst(), pair.getSecond()).toString());
        }
        for (NamePair pair : goal.getBoxAt()) {
            parts.add(new Atom(Predicates.BOX_AT, pair.getFirst(), pair.getSecond()).toString());
        }
        for (String target : goal.getClear()) {
            parts.add(new Atom(Predicates.CLEAR, target).toString());
        }
        parts.addAll(goal.getRawFormulas());
        return parts;
    }

    /**
     * Builds the goal formula. A single part is returned as is, two or more are wrapped in
     * {@code (and ...)}.
     */
    public static String build(GoalSpec goal) {
        return conjunction(parts(goal));
    }

    static String conjunction(List<String> parts) {
        if (parts.isEmpty()) {
            return EMPTY_CONJUNCTION;
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return "(and " + String.join(" ", parts) + ")";
    }
}
