package org.boxworld.pddl.spec;

import org.boxworld.pddl.BoxWorldException;

/**
 * Raised when a referential or structural invariant of a specification does not hold.
 */
public class ValidationException extends BoxWorldException {

    public ValidationException(String message) {
        super(message);
    }
}
