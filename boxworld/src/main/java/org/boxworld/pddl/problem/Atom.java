package org.boxworld.pddl.problem;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A ground predicate, e.g. {@code (on b1 b2)}. Atoms are ordered by their text form, which is
 * the order the initial state is printed in.
 */
public final class Atom implements Comparable<Atom> {
    private final String predicate;
    private final List<String> arguments;
    private final String text;

    public Atom(String predicate, String... arguments) {
        this.predicate = predicate;
        this.arguments = Collections.unmodifiableList(Arrays.asList(arguments.clone()));
        this.text = arguments.length == 0
            ? "(" + predicate + ")"
            : "(" + predicate + " " + String.join(" ", arguments) + ")";
    }

    public String getPredicate() {
        return predicate;
    }

    public List<String> getArguments() {
        return arguments;
    }

    @Override
    public int compareTo(Atom other) {
        return text.compareTo(other.text);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Atom && text.equals(((Atom) o).text));
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    /**
     * @return the PDDL text form
     */
    @Override
    public String toString() {
        return text;
    }
}
