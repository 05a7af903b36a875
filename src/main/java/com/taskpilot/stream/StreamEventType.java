package com.taskpilot.stream;

public final class StreamEventType {

    private StreamEventType() {
    }

    public static final String STATUS = "status";
    public static final String TOKEN = "token";
    public static final String PROGRESS = "progress";
    public static final String APPROVAL_REQUIRED = "approval-required";
    public static final String FINAL = "final";
    public static final String ERROR = "error";
    public static final String RUN_COMPLETE = "run-complete";
    public static final String RUN_CANCEL = "run-cancel";

    /**
     * Types still delivered after a run has been cancelled.
     */
    static boolean isTerminal(String type) {
        return RUN_CANCEL.equals(type) || RUN_COMPLETE.equals(type) || ERROR.equals(type) || FINAL.equals(type);
    }

    static boolean completesRun(String type) {
        return RUN_COMPLETE.equals(type) || ERROR.equals(type);
    }
}
