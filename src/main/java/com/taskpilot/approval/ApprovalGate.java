package com.taskpilot.approval;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Per-run channel between the agent loop and the human deciding on risky steps.
 * <p>
 * Each request registers a one-shot pending decision keyed by step id. The first decision
 * wins; later or unknown decisions are ignored. At most one request is outstanding at a time.
 */
@Slf4j
public class ApprovalGate {

    private final Duration timeout;
    private final Map<String, CompletableFuture<Boolean>> pending = new ConcurrentHashMap<>();
    private volatile boolean cancelled;

    /**
     * @param timeout how long to wait for a decision; zero or negative waits indefinitely
     */
    public ApprovalGate(@Nullable Duration timeout) {
        this.timeout = timeout == null ? Duration.ZERO : timeout;
    }

    /**
     * Blocks the calling worker until the step is approved, denied, timed out or the gate is cancelled.
     *
     * @param notifier announces the request; may return a stage that carries the decision
     */
    public ApprovalDecision requestApproval(String stepId, Supplier<? extends CompletionStage<Boolean>> notifier) {
        if (cancelled) {
            return ApprovalDecision.CANCELLED;
        }
        CompletableFuture<Boolean> decision = new CompletableFuture<>();
        synchronized (pending) {
            if (!pending.isEmpty()) {
                throw new IllegalStateException("An approval is already pending: " + pending.keySet());
            }
            pending.put(stepId, decision);
        }
        if (cancelled) {
            decision.complete(false);
        }
        try {
            if (!decision.isDone()) {
                notify(stepId, decision, notifier);
            }
            return await(stepId, decision);
        } finally {
            pending.remove(stepId, decision);
        }
    }

    /**
     * Delivers a decision. Returns false when no request is pending for the id or it was already decided.
     */
    public boolean submitDecision(String stepId, boolean approved) {
        CompletableFuture<Boolean> decision = stepId == null ? null : pending.get(stepId);
        if (decision == null) {
            log.debug("Ignoring decision for step {} with no pending approval", stepId);
            return false;
        }
        boolean accepted = decision.complete(approved);
        if (accepted) {
            log.info("Step {} {} by user", stepId, approved ? "approved" : "denied");
        }
        return accepted;
    }

    /**
     * Denies whatever is pending and every later request.
     */
    public void cancel() {
        cancelled = true;
        pending.values().forEach(decision -> decision.complete(false));
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    public boolean isPending(String stepId) {
        return pending.containsKey(stepId);
    }

    private void notify(String stepId, CompletableFuture<Boolean> decision,
                        Supplier<? extends CompletionStage<Boolean>> notifier) {
        try {
            CompletionStage<Boolean> external = notifier.get();
            if (external != null) {
                external.whenComplete((approved, error) -> {
                    if (error != null) {
                        log.warn("Approval callback for step {} failed: {}", stepId, error.getMessage());
                    }
                    decision.complete(error == null && Boolean.TRUE.equals(approved));
                });
            }
        } catch (RuntimeException ex) {
            log.warn("Approval callback for step {} failed: {}", stepId, ex.getMessage());
            decision.complete(false);
        }
    }

    private ApprovalDecision await(String stepId, CompletableFuture<Boolean> decision) {
        try {
            boolean approved = timeout.isZero() || timeout.isNegative()
                    ? decision.get()
                    : decision.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (approved) {
                return ApprovalDecision.APPROVED;
            }
            return cancelled ? ApprovalDecision.CANCELLED : ApprovalDecision.DENIED;
        } catch (TimeoutException ex) {
            decision.complete(false);
            log.warn("Approval for step {} timed out after {}", stepId, timeout);
            return ApprovalDecision.TIMED_OUT;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            decision.complete(false);
            return ApprovalDecision.CANCELLED;
        } catch (ExecutionException ex) {
            log.warn("Approval for step {} failed: {}", stepId, ex.getMessage());
            return ApprovalDecision.DENIED;
        }
    }
}
