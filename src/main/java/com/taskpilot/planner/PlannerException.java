package com.taskpilot.planner;

/**
 * A planning round could not produce a usable plan. The message is shown to the user as is.
 */
public class PlannerException extends Exception {

    public PlannerException(String message) {
        super(message);
    }

    public PlannerException(String message, Throwable cause) {
        super(message, cause);
    }
}
