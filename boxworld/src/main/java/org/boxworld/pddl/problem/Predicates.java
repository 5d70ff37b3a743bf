package org.boxworld.pddl.problem;

/**
 * Predicate names of the BOX-WORLD domain.
 */
public final class Predicates {
    public static final String ROBOT_AT = "robot-at";
    public static final String HANDS_EMPTY = "hands-empty";
    public static final String HOLDING = "holding";
    public static final String FORBIDDEN_STACK = "forbidden-stack";
    public static final String ON = "on";
    public static final String BOX_AT = "box-at";
    public static final String CLEAR = "clear";

    private Predicates() {
    }
}
