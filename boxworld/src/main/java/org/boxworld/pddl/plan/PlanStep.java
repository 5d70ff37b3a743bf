package org.boxworld.pddl.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One action of a plan: its name and its ordered arguments.
 */
public final class PlanStep {
    private final String action;
    private final List<String> arguments;

    public PlanStep(String action, List<String> arguments) {
        this.action = Objects.requireNonNull(action, "action");
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public String getAction() {
        return action;
    }

    public List<String> getArguments() {
        return arguments;
    }

    /**
     * @return the step as a plan file line, e.g. {@code (unstack b1 l1)}
     */
    public String toPlanLine() {
        if (arguments.isEmpty()) {
            return "(" + action + ")";
        }
        return "(" + action + " " + String.join(" ", arguments) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PlanStep)) {
            return false;
        }
        PlanStep other = (PlanStep) o;
        return action.equals(other.action) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, arguments);
    }

    @Override
    public String toString() {
        return toPlanLine();
    }
}
