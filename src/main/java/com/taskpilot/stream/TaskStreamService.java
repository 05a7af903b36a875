package com.taskpilot.stream;

import com.taskpilot.agent.Plan;
import com.taskpilot.agent.Step;
import com.taskpilot.agent.TaskOutcome;
import com.taskpilot.approval.RiskClassifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.taskpilot.stream.StreamEventType.*;

@Component
public class TaskStreamService {

    private final TaskStreamHub hub;

    public TaskStreamService(TaskStreamHub hub) {
        this.hub = hub;
    }

    public String createRun() {
        return hub.createRun();
    }

    public boolean exists(String runId) {
        return hub.exists(runId);
    }

    public void emitStatus(String runId, String message) {
        hub.emit(runId, STATUS, Map.of("message", message));
    }

    public void emitToken(String runId, String text) {
        hub.emit(runId, TOKEN, Map.of("text", text));
    }

    public void emitProgress(String runId, Plan snapshot) {
        hub.emit(runId, PROGRESS, snapshot);
    }

    public void emitApprovalRequired(String runId, Step step) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("stepId", step.getId());
        payload.put("tool", step.getTool());
        payload.put("description", step.getDescription());
        payload.put("parameters", step.getParameters());
        payload.put("riskTier", RiskClassifier.classify(step.getTool()).name());
        hub.emit(runId, APPROVAL_REQUIRED, payload);
    }

    public void emitFinal(String runId, TaskOutcome outcome) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("finalOutput", outcome.finalOutput());
        payload.put("success", outcome.success());
        payload.put("rounds", outcome.rounds());
        payload.put("stepsCompleted", outcome.stepsCompleted());
        payload.put("stepsFailed", outcome.stepsFailed());
        hub.emit(runId, FINAL, payload);
    }

    public void emitRunComplete(String runId, String status) {
        hub.emit(runId, RUN_COMPLETE, Map.of("status", status));
    }

    public void emitError(String runId, String message) {
        hub.emit(runId, ERROR, Map.of("message", message == null ? "Unexpected error" : message));
    }

    public boolean cancelRun(String runId) {
        return hub.cancelRun(runId);
    }
}
