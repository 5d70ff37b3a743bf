package org.boxworld.pddl.problem;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.boxworld.pddl.spec.Color;
import org.boxworld.pddl.spec.NamePair;
import org.boxworld.pddl.spec.NamedEntities;
import org.boxworld.pddl.spec.Specification;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the initial-state facts of a specification.
 */
public final class FactDeriver {
    private static final Logger LOGGER = LogManager.getLogger(FactDeriver.class.getName());

    private FactDeriver() {
    }

    /**
     * Computes every fact that holds initially: robot position, hand state, colors, forbidden
     * stacks, the {@code on}/{@code box-at}/{@code clear} relations of each stack and the
     * {@code clear} fact of each free location.
     *
     * @param spec a validated specification
     * @return the facts, without order
     */
    public static Set<Atom> derive(Specification spec) {
        Set<Atom> facts = new HashSet<>();

        facts.add(new Atom(Predicates.ROBOT_AT, spec.getRobotAt()));

        if (spec.getHolding().isPresent()) {
            facts.add(new Atom(Predicates.HOLDING, spec.getHolding().get()));
        } else {
            facts.add(new Atom(Predicates.HANDS_EMPTY));
        }

        addColors(spec.getLocations(), facts);
        addColors(spec.getBoxes(), facts);

        for (NamePair pair : spec.getForbiddenStacks()) {
            facts.add(new Atom(Predicates.FORBIDDEN_STACK, pair.getFirst(), pair.getSecond()));
        }

        for (Map.Entry<String, List<String>> entry : spec.getStacks().entrySet()) {
            addStack(entry.getKey(), entry.getValue(), facts);
        }

        for (String location : spec.getLocations().getNames()) {
            if (!spec.isOccupied(location)) {
                facts.add(new Atom(Predicates.CLEAR, location));
            }
        }

        LOGGER.debug("Derived {} initial facts for problem {}", facts.size(), spec.getProblemName());
        return facts;
    }

    private static void addColors(NamedEntities entities, Set<Atom> facts) {
        for (Map.Entry<String, Color> entry : entities.getColors().entrySet()) {
            facts.add(new Atom(entry.getValue().getPredicate(), entry.getKey()));
        }
    }

    /**
     * Decomposes one stack, listed top to bottom, into its relations. Each box supports the one
     * above it and the bottom box rests on the location.
     */
    private static void addStack(String location, List<String> stack, Set<Atom> facts) {
        if (stack.isEmpty()) {
            return;
        }
        for (String box : stack) {
            facts.add(new Atom(Predicates.BOX_AT, box, location));
        }
        for (int i = 0; i < stack.size() - 1; i++) {
            facts.add(new Atom(Predicates.ON, stack.get(i), stack.get(i + 1)));
        }
        facts.add(new Atom(Predicates.ON, stack.get(stack.size() - 1), location));
        facts.add(new Atom(Predicates.CLEAR, stack.get(0)));
    }
}
