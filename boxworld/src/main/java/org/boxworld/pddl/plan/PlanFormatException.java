package org.boxworld.pddl.plan;

import org.boxworld.pddl.BoxWorldException;

/**
 * Raised when a line of a plan file cannot be read as an action atom.
 */
public class PlanFormatException extends BoxWorldException {

    private final int lineNumber;

    public PlanFormatException(int lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    /**
     * @return the 1-based number of the offending line
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
