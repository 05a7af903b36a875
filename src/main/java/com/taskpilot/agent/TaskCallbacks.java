package com.taskpilot.agent;

import org.springframework.lang.Nullable;

import java.util.concurrent.CompletionStage;

/**
 * Observer hooks for a task run. All hooks are invoked on the run's worker thread.
 */
public record TaskCallbacks(
        ProgressListener onProgress,
        ApprovalCallback onApprovalRequired,
        TokenListener onToken
) {

    public TaskCallbacks {
        onProgress = onProgress != null ? onProgress : plan -> { };
        onApprovalRequired = onApprovalRequired != null ? onApprovalRequired : step -> null;
        onToken = onToken != null ? onToken : token -> { };
    }

    public static TaskCallbacks none() {
        return new TaskCallbacks(null, null, null);
    }

    @FunctionalInterface
    public interface ProgressListener {
        /**
         * Receives a copy of every step of the run after each status change.
         */
        void onProgress(Plan snapshot);
    }

    @FunctionalInterface
    public interface ApprovalCallback {
        /**
         * Announces a step waiting for a decision. The returned stage, when not null, resolves
         * the decision; otherwise the decision arrives through {@link AgentRun#submitDecision}.
         */
        @Nullable
        CompletionStage<Boolean> onApprovalRequired(Step step);
    }

    @FunctionalInterface
    public interface TokenListener {
        void onToken(String token);
    }
}
