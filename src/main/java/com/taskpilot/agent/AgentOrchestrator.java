package com.taskpilot.agent;

import com.taskpilot.approval.ApprovalDecision;
import com.taskpilot.approval.ApprovalGate;
import com.taskpilot.approval.RiskClassifier;
import com.taskpilot.approval.RiskTier;
import com.taskpilot.config.AgentProperties;
import com.taskpilot.planner.PlanGenerator;
import com.taskpilot.planner.PlanRequest;
import com.taskpilot.planner.PlannerException;
import com.taskpilot.tools.ToolRegistry;
import com.taskpilot.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

import static com.taskpilot.agent.AgentConstants.*;

/**
 * Runs the plan, approve, execute, report loop for a goal.
 * <p>
 * Each task runs on its own worker from the agent executor. Within a task every planner call,
 * approval wait and tool call happens sequentially on that worker.
 */
@Service
@Slf4j
public class AgentOrchestrator {

    private final PlanGenerator planGenerator;
    private final ToolRegistry toolRegistry;
    private final AgentProperties properties;
    private final AgentMetricsService metricsService;
    private final ExecutorService agentExecutor;

    public AgentOrchestrator(PlanGenerator planGenerator,
                             ToolRegistry toolRegistry,
                             AgentProperties properties,
                             AgentMetricsService metricsService,
                             @Qualifier("agentExecutor") ExecutorService agentExecutor) {
        this.planGenerator = planGenerator;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
        this.metricsService = metricsService;
        this.agentExecutor = agentExecutor;
    }

    public CompletableFuture<TaskOutcome> executeTask(TaskRequest request, TaskCallbacks callbacks) {
        return start(request, callbacks).outcome();
    }

    public AgentRun start(TaskRequest request, TaskCallbacks callbacks) {
        return start(UUID.randomUUID().toString(), request, callbacks);
    }

    public AgentRun start(String runId, TaskRequest request, TaskCallbacks callbacks) {
        return start(runId, request, callbacks, run -> { });
    }

    /**
     * @param onCreated receives the run before its worker is scheduled, so the run can be made
     *                  addressable before the first approval request can be announced
     */
    public AgentRun start(String runId, TaskRequest request, TaskCallbacks callbacks,
                          Consumer<AgentRun> onCreated) {
        AgentRun run = new AgentRun(runId, new ApprovalGate(properties.getApprovalTimeout()));
        TaskCallbacks hooks = callbacks != null ? callbacks : TaskCallbacks.none();
        metricsService.recordTaskStarted(runId);
        onCreated.accept(run);
        agentExecutor.execute(() -> {
            try {
                run.outcome().complete(new TaskExecution(run, request, hooks).run());
            } catch (RuntimeException ex) {
                log.error("Run {} failed unexpectedly", runId, ex);
                run.outcome().completeExceptionally(ex);
            } finally {
                metricsService.logSummary();
            }
        });
        return run;
    }

    /**
     * State of a single run. Confined to the run's worker thread.
     */
    private final class TaskExecution {

        private final AgentRun run;
        private final TaskRequest request;
        private final TaskCallbacks callbacks;
        private final List<String> allowedTools;
        private final List<Step> steps = new ArrayList<>();
        private final Set<String> usedIds = new HashSet<>();
        private String conversationalResponse;
        private int rounds;

        private TaskExecution(AgentRun run, TaskRequest request, TaskCallbacks callbacks) {
            this.run = run;
            this.request = request;
            this.callbacks = callbacks;
            this.allowedTools = properties.getTools().resolveAllowed(request.allowedTools(), toolRegistry.toolNames());
        }

        TaskOutcome run() {
            log.info("Run {} started: goal='{}', allowedTools={}", run.runId(), request.goal(), allowedTools);
            int maxRounds = Math.max(1, properties.getMaxRounds());
            for (int round = 1; round <= maxRounds; round++) {
                if (run.isCancelled()) {
                    return finish(TASK_CANCELLED, false);
                }
                rounds = round;
                Plan plan;
                try {
                    metricsService.recordPlannerRequest(run.runId(), round);
                    plan = planGenerator.generate(planRequest(round), this::forwardToken);
                } catch (PlannerException ex) {
                    log.warn("Run {} aborted in round {}: {}", run.runId(), round, ex.getMessage());
                    return finish(StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : PLANNER_FAILED, false);
                }
                metricsService.recordPlan(run.runId(), round, plan);
                if (run.isCancelled()) {
                    return finish(TASK_CANCELLED, false);
                }
                if (plan.steps().isEmpty()) {
                    conversationalResponse = plan.conversationalResponse();
                    String output = StringUtils.hasText(conversationalResponse)
                            ? conversationalResponse
                            : steps.isEmpty() ? NO_RESPONSE : STEP_SUMMARY.formatted(completed(), failed());
                    return finish(output, true);
                }
                List<Step> roundSteps = assignIds(plan.steps(), round);
                steps.addAll(roundSteps);
                publishProgress();
                for (Step step : roundSteps) {
                    if (run.isCancelled()) {
                        return finish(TASK_CANCELLED, false);
                    }
                    executeStep(step);
                }
            }
            log.info("Run {} reached the round cap of {}", run.runId(), maxRounds);
            return finish(ROUND_CAP_SUMMARY.formatted(rounds, completed(), failed()), true);
        }

        private void executeStep(Step step) {
            if (step.isInvalid()) {
                rejectWithoutApproval(step, step.getInvalidReason());
                return;
            }
            if (!allowedTools.contains(step.getTool())) {
                rejectWithoutApproval(step, TOOL_NOT_ALLOWED.formatted(step.getTool()));
                return;
            }
            RiskTier tier = RiskClassifier.classify(step.getTool());
            if (tier.requiresApproval()) {
                log.info("Step {} ({}) is {} risk, waiting for approval", step.getId(), step.getTool(), tier);
                ApprovalDecision decision = run.approvalGate().requestApproval(step.getId(),
                        () -> callbacks.onApprovalRequired().onApprovalRequired(step.copy()));
                metricsService.recordApproval(step.getId(), decision);
                switch (decision) {
                    case DENIED -> {
                        fail(step, FailureKind.DENIED, DENIED_BY_USER);
                        return;
                    }
                    case TIMED_OUT -> {
                        fail(step, FailureKind.DENIED, APPROVAL_TIMED_OUT);
                        return;
                    }
                    case CANCELLED -> {
                        fail(step, FailureKind.CANCELLED, CANCELLED);
                        return;
                    }
                    case APPROVED -> {
                    }
                }
            }
            step.approve();
            publishProgress();
            step.startExecuting();
            publishProgress();
            ToolResult result = toolRegistry.execute(step.getTool(), step.getParameters());
            if (result.success()) {
                step.complete(result.output(), result.data());
                metricsService.recordStep(step);
                publishProgress();
            } else {
                fail(step, result.rejected() ? FailureKind.VALIDATION : FailureKind.EXECUTION, result.error());
            }
        }

        private void rejectWithoutApproval(Step step, String error) {
            step.approve();
            publishProgress();
            step.startExecuting();
            publishProgress();
            fail(step, FailureKind.VALIDATION, error);
        }

        private void fail(Step step, FailureKind kind, String error) {
            step.fail(kind, error);
            log.info("Step {} ({}) failed [{}]: {}", step.getId(), step.getTool(), kind, error);
            metricsService.recordStep(step);
            publishProgress();
        }

        private PlanRequest planRequest(int round) {
            List<Step> history = steps.stream().map(Step::copy).toList();
            return new PlanRequest(request.goal(), request.conversation(), history, allowedTools,
                    request.modelId(), request.customModels(), request.apiKey(), round);
        }

        private List<Step> assignIds(List<Step> planned, int round) {
            List<Step> assigned = new ArrayList<>(planned.size());
            for (int index = 0; index < planned.size(); index++) {
                Step step = planned.get(index);
                String id = step.getId();
                if (!StringUtils.hasText(id) || usedIds.contains(id)) {
                    id = STEP_ID_PREFIX + round + "-" + (index + 1);
                    int suffix = 2;
                    while (usedIds.contains(id)) {
                        id = STEP_ID_PREFIX + round + "-" + (index + 1) + "-" + suffix++;
                    }
                    step = step.withId(id);
                }
                usedIds.add(id);
                assigned.add(step);
            }
            return assigned;
        }

        private void forwardToken(String token) {
            try {
                callbacks.onToken().onToken(token);
            } catch (RuntimeException ex) {
                log.warn("Token listener failed for run {}: {}", run.runId(), ex.getMessage());
            }
        }

        private void publishProgress() {
            try {
                callbacks.onProgress().onProgress(snapshot());
            } catch (RuntimeException ex) {
                log.warn("Progress listener failed for run {}: {}", run.runId(), ex.getMessage());
            }
        }

        private Plan snapshot() {
            return new Plan(request.goal(), steps, conversationalResponse).snapshot();
        }

        private TaskOutcome finish(String finalOutput, boolean success) {
            TaskOutcome outcome = new TaskOutcome(snapshot(), finalOutput, rounds, completed(), failed(), success);
            log.info("Run {} finished after {} rounds: completed={}, failed={}, success={}",
                    run.runId(), rounds, outcome.stepsCompleted(), outcome.stepsFailed(), success);
            return outcome;
        }

        private int completed() {
            return (int) steps.stream().filter(step -> step.getStatus() == StepStatus.COMPLETED).count();
        }

        private int failed() {
            return (int) steps.stream().filter(step -> step.getStatus() == StepStatus.FAILED).count();
        }
    }
}
