package com.taskpilot.api;

import com.taskpilot.agent.TaskRunService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskRunService taskRunService;

    public TaskController(TaskRunService taskRunService) {
        this.taskRunService = taskRunService;
    }

    /**
     * Starts a task; progress is streamed on {@code /ws/stream?runId=...}.
     */
    @PostMapping
    public StartTaskResponse start(@Valid @RequestBody StartTaskRequest request) {
        String runId = taskRunService.startStreaming(request.toTaskRequest());
        return new StartTaskResponse(runId, Instant.now());
    }

    @PostMapping("/{runId}/approvals/{stepId}")
    public ApprovalDecisionResponse decide(@PathVariable String runId,
                                           @PathVariable String stepId,
                                           @Valid @RequestBody ApprovalDecisionRequest request) {
        return taskRunService.submitDecision(runId, stepId, request.approved())
                .map(ApprovalDecisionResponse::new)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found or already finished."));
    }

    @PostMapping("/{runId}/cancel")
    public CancelRunResponse cancel(@PathVariable String runId) {
        return taskRunService.cancel(runId) ? CancelRunResponse.success() : CancelRunResponse.notFound();
    }
}
