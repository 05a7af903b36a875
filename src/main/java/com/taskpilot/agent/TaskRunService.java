package com.taskpilot.agent;

import com.taskpilot.stream.TaskStreamService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts tasks whose progress is published on the stream hub and keeps the live runs
 * addressable by id for approval decisions and cancellation.
 */
@Service
@Slf4j
public class TaskRunService {

    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_FAILED = "FAILED";
    public static final String STATUS_CANCELLED = "CANCELLED";

    private final AgentOrchestrator orchestrator;
    private final TaskStreamService streamService;
    private final Map<String, AgentRun> activeRuns = new ConcurrentHashMap<>();

    public TaskRunService(AgentOrchestrator orchestrator, TaskStreamService streamService) {
        this.orchestrator = orchestrator;
        this.streamService = streamService;
    }

    public String startStreaming(TaskRequest request) {
        String runId = streamService.createRun();
        streamService.emitStatus(runId, "Queued");
        TaskCallbacks callbacks = new TaskCallbacks(
                snapshot -> streamService.emitProgress(runId, snapshot),
                step -> {
                    streamService.emitApprovalRequired(runId, step);
                    return null;
                },
                token -> streamService.emitToken(runId, token));
        AgentRun run = orchestrator.start(runId, request, callbacks, created -> activeRuns.put(runId, created));
        run.outcome().whenComplete((outcome, error) -> {
            activeRuns.remove(runId);
            if (error != null) {
                log.error("Run {} failed", runId, error);
                streamService.emitError(runId, rootMessage(error));
                streamService.emitRunComplete(runId, STATUS_FAILED);
                return;
            }
            streamService.emitFinal(runId, outcome);
            streamService.emitRunComplete(runId, run.isCancelled() ? STATUS_CANCELLED
                    : outcome.success() ? STATUS_COMPLETED : STATUS_FAILED);
        });
        return runId;
    }

    public Optional<AgentRun> find(String runId) {
        return Optional.ofNullable(activeRuns.get(runId));
    }

    /**
     * @return empty when the run is unknown or already finished, otherwise whether the decision was accepted
     */
    public Optional<Boolean> submitDecision(String runId, String stepId, boolean approved) {
        return find(runId).map(run -> run.submitDecision(stepId, approved));
    }

    public boolean cancel(String runId) {
        AgentRun run = activeRuns.get(runId);
        if (run == null) {
            return streamService.cancelRun(runId);
        }
        log.info("Cancelling run {}", runId);
        run.cancel();
        streamService.cancelRun(runId);
        return true;
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
