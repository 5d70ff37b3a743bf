package org.boxworld.pddl.planner;

import org.boxworld.pddl.BoxWorldException;

/**
 * Raised when the external planner cannot be started, fails, times out or writes no plan.
 */
public class PlannerException extends BoxWorldException {

    // -1 when the process never exited normally
    private final int exitCode;

    public PlannerException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public PlannerException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public int getExitCode() {
        return exitCode;
    }
}
