package com.taskpilot.agent;

import com.taskpilot.approval.ApprovalDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class AgentMetricsService {

    private final AtomicLong taskCount = new AtomicLong();
    private final AtomicLong plannerRequestCount = new AtomicLong();
    private final AtomicLong stepsReceivedCount = new AtomicLong();
    private final AtomicLong stepsCompletedCount = new AtomicLong();
    private final AtomicLong stepsFailedCount = new AtomicLong();
    private final AtomicLong approvalRequestCount = new AtomicLong();
    private final AtomicLong deniedCount = new AtomicLong();

    public void recordTaskStarted(String runId) {
        long count = taskCount.incrementAndGet();
        log.info("Task #{} started (run={}).", count, runId);
    }

    public void recordPlannerRequest(String runId, int round) {
        long count = plannerRequestCount.incrementAndGet();
        log.info("Planner request #{} sent (run={}, round={}). Total requests={}.", count, runId, round, count);
    }

    public void recordPlan(String runId, int round, Plan plan) {
        if (plan.isConversational()) {
            log.info("Round {} of run {} ended with a conversational response.", round, runId);
            return;
        }
        long total = stepsReceivedCount.addAndGet(plan.steps().size());
        log.info("Round {} of run {} received {} steps. Total steps received={}.",
                round, runId, plan.steps().size(), total);
    }

    public void recordStep(Step step) {
        if (step.getStatus() == StepStatus.COMPLETED) {
            stepsCompletedCount.incrementAndGet();
        } else if (step.getStatus() == StepStatus.FAILED) {
            stepsFailedCount.incrementAndGet();
        }
    }

    public void recordApproval(String stepId, ApprovalDecision decision) {
        approvalRequestCount.incrementAndGet();
        if (!decision.approved()) {
            deniedCount.incrementAndGet();
        }
        log.info("Approval for step {} resolved as {}.", stepId, decision);
    }

    public void logSummary() {
        log.info("Agent stats: tasks={}, plannerRequests={}, stepsReceived={}, stepsCompleted={}, stepsFailed={}, "
                        + "approvals={}, denied={}.",
                taskCount.get(), plannerRequestCount.get(), stepsReceivedCount.get(), stepsCompletedCount.get(),
                stepsFailedCount.get(), approvalRequestCount.get(), deniedCount.get());
    }
}
