package org.boxworld.pddl.spec;

import java.util.Objects;

/**
 * An ordered pair of entity names, such as {@code (top, bottom)} in a forbidden stack or
 * {@code (box, location)} in a goal.
 */
public final class NamePair {
    private final String first;
    private final String second;

    public NamePair(String first, String second) {
        this.first = Objects.requireNonNull(first, "first");
        this.second = Objects.requireNonNull(second, "second");
    }

    public String getFirst() {
        return first;
    }

    public String getSecond() {
        return second;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NamePair)) {
            return false;
        }
        NamePair other = (NamePair) o;
        return first.equals(other.first) && second.equals(other.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return "[" + first + ", " + second + "]";
    }
}
