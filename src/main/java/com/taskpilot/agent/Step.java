package com.taskpilot.agent;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One tool invocation within a plan. Status changes are restricted to this package so only
 * the orchestrator drives a step; everyone else receives copies.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Step {

    private final String id;
    private final String description;
    private final String tool;
    private final Map<String, Object> parameters;
    private volatile StepStatus status;
    @Nullable
    private volatile String output;
    @Nullable
    private volatile Object data;
    @Nullable
    private volatile String error;
    @Nullable
    private volatile FailureKind failureKind;
    @Nullable
    @JsonIgnore
    private volatile String invalidReason;

    public Step(String id, String description, String tool, @Nullable Map<String, Object> parameters) {
        this(id, description, tool, parameters, StepStatus.PENDING);
    }

    private Step(String id, String description, String tool, @Nullable Map<String, Object> parameters,
                 StepStatus status) {
        this.id = id;
        this.description = description == null ? "" : description;
        this.tool = tool == null ? "" : tool;
        this.parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.status = status;
    }

    /**
     * A step the model described badly. It stays in the plan and fails validation when its turn comes.
     */
    public static Step invalid(String id, String description, String tool, String reason) {
        Step step = new Step(id, description, tool, null);
        step.invalidReason = reason;
        return step;
    }

    /**
     * A pending copy of this step carrying another id.
     */
    public Step withId(String newId) {
        Step renamed = new Step(newId, description, tool, parameters);
        renamed.invalidReason = invalidReason;
        return renamed;
    }

    @JsonIgnore
    public boolean isInvalid() {
        return invalidReason != null;
    }

    public Step copy() {
        Step copy = new Step(id, description, tool, parameters, status);
        copy.output = output;
        copy.data = data;
        copy.error = error;
        copy.failureKind = failureKind;
        copy.invalidReason = invalidReason;
        return copy;
    }

    void approve() {
        moveTo(StepStatus.APPROVED);
    }

    void startExecuting() {
        moveTo(StepStatus.EXECUTING);
    }

    void complete(String output, @Nullable Object data) {
        this.output = output;
        this.data = data;
        moveTo(StepStatus.COMPLETED);
    }

    void fail(FailureKind kind, String error) {
        this.failureKind = kind;
        this.error = error;
        moveTo(StepStatus.FAILED);
    }

    private synchronized void moveTo(StepStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Step " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    @Override
    public String toString() {
        return "Step[" + id + ", " + tool + ", " + status + "]";
    }
}
