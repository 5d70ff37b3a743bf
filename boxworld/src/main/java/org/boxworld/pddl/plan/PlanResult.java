package org.boxworld.pddl.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A parsed plan: the ordered steps and, if the planner reported one, the plan cost.
 */
public final class PlanResult {
    private final List<PlanStep> steps;
    private final Long cost;

    public PlanResult(List<PlanStep> steps, Long cost) {
        if (cost != null && cost < 0) {
            throw new IllegalArgumentException("cost must not be negative: " + cost);
        }
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.cost = cost;
    }

    public List<PlanStep> getSteps() {
        return steps;
    }

    public OptionalLong getCost() {
        return cost == null ? OptionalLong.empty() : OptionalLong.of(cost);
    }

    /**
     * Renders the plan in the planner's text format, one step per line and the cost as a
     * trailing comment.
     */
    public String toPlanText() {
        StringBuilder text = new StringBuilder();
        for (PlanStep step : steps) {
            text.append(step.toPlanLine()).append('\n');
        }
        if (cost != null) {
            text.append("; cost = ").append(cost).append('\n');
        }
        return text.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PlanResult)) {
            return false;
        }
        PlanResult other = (PlanResult) o;
        return steps.equals(other.steps) && Objects.equals(cost, other.cost);
    }

    @Override
    public int hashCode() {
        return Objects.hash(steps, cost);
    }

    @Override
    public String toString() {
        return "PlanResult{steps=" + steps + ", cost=" + cost + '}';
    }
}
