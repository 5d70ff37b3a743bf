package org.boxworld.pddl;

/**
 * Base class of every error raised while translating a Box-World problem or reading a plan.
 * An instance is always fatal to the current operation: no partial result is returned.
 */
public class BoxWorldException extends IllegalArgumentException {

    public BoxWorldException(String message) {
        super(message);
    }

    public BoxWorldException(String message, Throwable cause) {
        super(message, cause);
    }
}
