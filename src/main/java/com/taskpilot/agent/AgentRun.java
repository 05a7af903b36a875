package com.taskpilot.agent;

import com.taskpilot.approval.ApprovalGate;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on a running task: its eventual outcome, its approval channel and its cancel switch.
 */
public class AgentRun {

    private final String runId;
    private final ApprovalGate approvalGate;
    private final CompletableFuture<TaskOutcome> outcome = new CompletableFuture<>();
    private volatile boolean cancelled;

    AgentRun(String runId, ApprovalGate approvalGate) {
        this.runId = runId;
        this.approvalGate = approvalGate;
    }

    public String runId() {
        return runId;
    }

    public CompletableFuture<TaskOutcome> outcome() {
        return outcome;
    }

    /**
     * @return false when no approval is pending for the step or it was already decided
     */
    public boolean submitDecision(String stepId, boolean approved) {
        return approvalGate.submitDecision(stepId, approved);
    }

    /**
     * Denies any pending approval and stops the run before its next step. A tool call
     * already in progress is allowed to finish.
     */
    public void cancel() {
        cancelled = true;
        approvalGate.cancel();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    ApprovalGate approvalGate() {
        return approvalGate;
    }
}
