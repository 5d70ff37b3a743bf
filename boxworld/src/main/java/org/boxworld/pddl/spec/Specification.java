package org.boxworld.pddl.spec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A validated Box-World problem. Instances are immutable.
 *
 * <p>Stacks are listed top first: the first box of a stack is clear and the last one rests
 * directly on the location. Only non-empty stacks are kept, so a location is occupied exactly
 * when {@link #getStacks()} has an entry for it.</p>
 *
 * @see SpecificationReader
 */
public final class Specification {
    private final String problemName;
    private final NamedEntities locations;
    private final NamedEntities boxes;
    private final String robotAt;
    private final String holding;
    private final Map<String, List<String>> stacks;
    private final List<NamePair> forbiddenStacks;
    private final GoalSpec goal;

    public Specification(String problemName, NamedEntities locations, NamedEntities boxes, String robotAt,
                         String holding, Map<String, List<String>> stacks, List<NamePair> forbiddenStacks,
                         GoalSpec goal) {
        this.problemName = Objects.requireNonNull(problemName, "problemName");
        this.locations = Objects.requireNonNull(locations, "locations");
        this.boxes = Objects.requireNonNull(boxes, "boxes");
        this.robotAt = Objects.requireNonNull(robotAt, "robotAt");
        this.holding = holding;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : stacks.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
            }
        }
        this.stacks = Collections.unmodifiableMap(copy);
        this.forbiddenStacks = Collections.unmodifiableList(new ArrayList<>(forbiddenStacks));
        this.goal = Objects.requireNonNull(goal, "goal");
    }

    public String getProblemName() {
        return problemName;
    }

    public NamedEntities getLocations() {
        return locations;
    }

    public NamedEntities getBoxes() {
        return boxes;
    }

    public String getRobotAt() {
        return robotAt;
    }

    /**
     * @return the box in the robot's hand, empty when the hand is free
     */
    public Optional<String> getHolding() {
        return Optional.ofNullable(holding);
    }

    /**
     * @return the non-empty stacks by location, each listed top to bottom
     */
    public Map<String, List<String>> getStacks() {
        return stacks;
    }

    public boolean isOccupied(String location) {
        return stacks.containsKey(location);
    }

    public List<NamePair> getForbiddenStacks() {
        return forbiddenStacks;
    }

    public GoalSpec getGoal() {
        return goal;
    }
}
