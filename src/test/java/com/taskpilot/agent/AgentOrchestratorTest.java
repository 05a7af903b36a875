package com.taskpilot.agent;

import com.taskpilot.config.AgentProperties;
import com.taskpilot.planner.PlanGenerator;
import com.taskpilot.planner.PlanRequest;
import com.taskpilot.planner.PlannerException;
import com.taskpilot.tools.ParameterType;
import com.taskpilot.tools.ToolDescriptor;
import com.taskpilot.tools.ToolExecutionException;
import com.taskpilot.tools.ToolParameter;
import com.taskpilot.tools.ToolProvider;
import com.taskpilot.tools.ToolRegistry;
import com.taskpilot.tools.ToolResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AgentOrchestratorTest {

    private static final String GOAL = "tidy the project";

    private final List<String> toolCalls = new CopyOnWriteArrayList<>();
    private final List<PlanRequest> planRequests = new CopyOnWriteArrayList<>();
    private final Deque<Object> scriptedPlans = new ArrayDeque<>();
    private ExecutorService executor;
    private AgentProperties properties;
    private AgentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        properties = new AgentProperties();
        properties.setApprovalTimeout(Duration.ofSeconds(5));
        properties.setMaxRounds(8);
        orchestrator = new AgentOrchestrator(scriptedGenerator(), new ToolRegistry(List.of(fakeTools())),
                properties, new AgentMetricsService(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ToolProvider fakeTools() {
        return () -> List.of(
                ToolDescriptor.of("list_directory", "List files",
                        List.of(ToolParameter.optional("path", ParameterType.STRING, "Directory")),
                        params -> record("list_directory", ToolResult.success("a.txt\nb.txt"))),
                ToolDescriptor.of("read_file", "Read a file",
                        List.of(ToolParameter.required("path", ParameterType.STRING, "File")),
                        params -> {
                            toolCalls.add("read_file");
                            throw new ToolExecutionException("File not found: " + params.get("path"));
                        }),
                ToolDescriptor.of("write_file", "Write a file",
                        List.of(ToolParameter.required("path", ParameterType.STRING, "File"),
                                ToolParameter.optional("content", ParameterType.STRING, "Content")),
                        params -> record("write_file", ToolResult.success("Wrote " + params.get("path")))),
                ToolDescriptor.of("delete_file", "Delete a file",
                        List.of(ToolParameter.required("path", ParameterType.STRING, "File")),
                        params -> record("delete_file", ToolResult.success("Deleted " + params.get("path")))),
                ToolDescriptor.of("run_command", "Run a command",
                        List.of(ToolParameter.required("command", ParameterType.STRING, "Command")),
                        params -> record("run_command", ToolResult.success("ok"))));
    }

    private ToolResult record(String tool, ToolResult result) {
        toolCalls.add(tool);
        return result;
    }

    private PlanGenerator scriptedGenerator() {
        return (request, onToken) -> {
            planRequests.add(request);
            Object next;
            synchronized (scriptedPlans) {
                next = scriptedPlans.isEmpty() ? null : scriptedPlans.poll();
            }
            if (next instanceof PlannerException ex) {
                throw ex;
            }
            if (next instanceof Plan plan) {
                if (plan.isConversational() && plan.conversationalResponse() != null) {
                    onToken.accept(plan.conversationalResponse());
                }
                return plan;
            }
            return Plan.conversational(request.goal(), "All done.");
        };
    }

    private void script(Object... plans) {
        synchronized (scriptedPlans) {
            scriptedPlans.addAll(List.of(plans));
        }
    }

    private static Plan plan(Step... steps) {
        return new Plan(GOAL, List.of(steps), null);
    }

    private static Step step(String id, String tool, Map<String, Object> params) {
        return new Step(id, "Use " + tool, tool, params);
    }

    private TaskOutcome await(AgentRun run) throws Exception {
        return run.outcome().get(10, TimeUnit.SECONDS);
    }

    private TaskOutcome execute(TaskRequest request, TaskCallbacks callbacks) throws Exception {
        return orchestrator.executeTask(request, callbacks).get(10, TimeUnit.SECONDS);
    }

    @Test
    void testReadOnlyGoalRunsWithoutApproval() throws Exception {
        script(plan(step("s1", "list_directory", Map.of("path", "."))), Plan.conversational(GOAL, "Two files."));
        AtomicInteger approvals = new AtomicInteger();

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of()),
                new TaskCallbacks(null, step -> {
                    approvals.incrementAndGet();
                    return CompletableFuture.completedFuture(true);
                }, null));

        assertTrue(outcome.success());
        assertEquals("Two files.", outcome.finalOutput());
        assertEquals(2, outcome.rounds());
        assertEquals(1, outcome.stepsCompleted());
        assertEquals(0, approvals.get());
        Step done = outcome.plan().steps().get(0);
        assertEquals(StepStatus.COMPLETED, done.getStatus());
        assertEquals("a.txt\nb.txt", done.getOutput());
    }

    @Test
    void testApprovedWriteExecutes() throws Exception {
        script(plan(step("w1", "write_file", Map.of("path", "notes.md", "content", "hi"))));
        List<Step> announced = new CopyOnWriteArrayList<>();

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of()),
                new TaskCallbacks(null, step -> {
                    announced.add(step);
                    return CompletableFuture.completedFuture(true);
                }, null));

        assertEquals(List.of("write_file"), toolCalls);
        assertEquals(1, announced.size());
        assertEquals(StepStatus.PENDING, announced.get(0).getStatus());
        assertEquals(StepStatus.COMPLETED, outcome.plan().steps().get(0).getStatus());
        assertEquals("All done.", outcome.finalOutput());
    }

    @Test
    void testDeniedStepIsReportedToNextRound() throws Exception {
        script(plan(step("d1", "run_command", Map.of("command", "rm -rf build"))));

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of()),
                new TaskCallbacks(null, step -> CompletableFuture.completedFuture(false), null));

        assertTrue(toolCalls.isEmpty());
        Step denied = outcome.plan().steps().get(0);
        assertEquals(StepStatus.FAILED, denied.getStatus());
        assertEquals(FailureKind.DENIED, denied.getFailureKind());
        assertEquals(AgentConstants.DENIED_BY_USER, denied.getError());
        assertEquals(1, outcome.stepsFailed());

        List<Step> history = planRequests.get(1).stepHistory();
        assertEquals(1, history.size());
        assertEquals(StepStatus.FAILED, history.get(0).getStatus());
    }

    @Test
    void testDeniedDeleteNeverReachesHandler() throws Exception {
        script(plan(step("del", "delete_file", Map.of("path", "temp.txt"))), Plan.conversational(GOAL, "Kept it."));

        TaskOutcome outcome = execute(TaskRequest.of("delete temp.txt", List.of()),
                new TaskCallbacks(null, step -> CompletableFuture.completedFuture(false), null));

        Step denied = outcome.plan().steps().get(0);
        assertEquals(StepStatus.FAILED, denied.getStatus());
        assertEquals("denied by user", denied.getError());
        assertFalse(toolCalls.contains("delete_file"));
        assertTrue(outcome.success());
    }

    @Test
    void testStepPassesThroughStatusesInOrder() throws Exception {
        script(plan(step("w1", "write_file", Map.of("path", "a.md"))));
        List<StepStatus> statuses = new CopyOnWriteArrayList<>();

        execute(TaskRequest.of(GOAL, List.of()), new TaskCallbacks(snapshot -> snapshot.steps().stream()
                .filter(s -> s.getId().equals("w1"))
                .map(Step::getStatus)
                .forEach(status -> {
                    if (statuses.isEmpty() || statuses.get(statuses.size() - 1) != status) {
                        statuses.add(status);
                    }
                }), step -> CompletableFuture.completedFuture(true), null));

        assertEquals(List.of(StepStatus.PENDING, StepStatus.APPROVED, StepStatus.EXECUTING, StepStatus.COMPLETED),
                statuses);
    }

    @Test
    void testToolOutsideAllowListFailsValidationWithoutApproval() throws Exception {
        script(plan(step("x1", "run_command", Map.of("command", "ls"))));
        AtomicInteger approvals = new AtomicInteger();

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of("list_directory")),
                new TaskCallbacks(null, step -> {
                    approvals.incrementAndGet();
                    return CompletableFuture.completedFuture(true);
                }, null));

        Step rejected = outcome.plan().steps().get(0);
        assertEquals(StepStatus.FAILED, rejected.getStatus());
        assertEquals(FailureKind.VALIDATION, rejected.getFailureKind());
        assertEquals("Tool \"run_command\" is not allowed for this task", rejected.getError());
        assertEquals(0, approvals.get());
        assertTrue(toolCalls.isEmpty());
        assertEquals(List.of("list_directory"), planRequests.get(0).allowedTools());
    }

    @Test
    void testHandlerFailureIsExecutionAndBadParametersAreValidation() throws Exception {
        script(plan(step("r1", "read_file", Map.of("path", "missing.txt")),
                step("r2", "read_file", Map.of("file", "missing.txt"))));

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of()), TaskCallbacks.none());

        Step failed = outcome.plan().steps().get(0);
        assertEquals(FailureKind.EXECUTION, failed.getFailureKind());
        assertEquals("File not found: missing.txt", failed.getError());
        Step invalid = outcome.plan().steps().get(1);
        assertEquals(FailureKind.VALIDATION, invalid.getFailureKind());
        assertTrue(invalid.getError().startsWith("Invalid parameters for tool \"read_file\""));
        assertEquals(List.of("read_file"), toolCalls);
        assertEquals(2, outcome.stepsFailed());
    }

    @Test
    void testMalformedStepFailsAloneWhileValidStepRuns() throws Exception {
        script(plan(step("l1", "list_directory", Map.of("path", ".")),
                Step.invalid("r1", "Read readme", "read_file",
                        "Parameters of plan step 2 must be an object, got: \"README.md\"")));
        AtomicInteger approvals = new AtomicInteger();

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of()), new TaskCallbacks(null, step -> {
            approvals.incrementAndGet();
            return CompletableFuture.completedFuture(true);
        }, null));

        assertTrue(outcome.success());
        assertEquals(StepStatus.COMPLETED, outcome.plan().steps().get(0).getStatus());
        Step malformed = outcome.plan().steps().get(1);
        assertEquals(StepStatus.FAILED, malformed.getStatus());
        assertEquals(FailureKind.VALIDATION, malformed.getFailureKind());
        assertTrue(malformed.getError().startsWith("Parameters of plan step 2 must be an object"));
        assertEquals(List.of("list_directory"), toolCalls);
        assertEquals(0, approvals.get());
    }

    @Test
    void testRoundCapStopsTheLoop() throws Exception {
        properties.setMaxRounds(3);
        for (int i = 0; i < 5; i++) {
            script(plan(step("l" + i, "list_directory", Map.of())));
        }

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of()), TaskCallbacks.none());

        assertEquals(3, planRequests.size());
        assertEquals(3, outcome.rounds());
        assertTrue(outcome.success());
        assertEquals("Stopped after 3 rounds. Completed 3 steps, 0 failed.", outcome.finalOutput());
    }

    @Test
    void testLoopEndsOnRoundAfterLastSteps() throws Exception {
        script(plan(step("a", "list_directory", Map.of())),
                plan(step("b", "list_directory", Map.of())),
                new Plan(GOAL, List.of(), null));

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of()), TaskCallbacks.none());

        assertEquals(3, outcome.rounds());
        assertEquals(3, planRequests.size());
        assertEquals("Completed 2 steps, 0 failed.", outcome.finalOutput());
        assertEquals(List.of(1, 2, 3), planRequests.stream().map(PlanRequest::round).toList());
    }

    @Test
    void testEmptyFirstPlanWithoutResponse() throws Exception {
        script(new Plan(GOAL, List.of(), null));

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of()), TaskCallbacks.none());

        assertTrue(outcome.success());
        assertEquals(AgentConstants.NO_RESPONSE, outcome.finalOutput());
        assertEquals(1, outcome.rounds());
    }

    @Test
    void testPlannerFailureEndsRun() throws Exception {
        script(new PlannerException("The model provider rejected the API key (HTTP 401)."));

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of()), TaskCallbacks.none());

        assertFalse(outcome.success());
        assertEquals("The model provider rejected the API key (HTTP 401).", outcome.finalOutput());
        assertTrue(outcome.plan().steps().isEmpty());
    }

    @Test
    void testConversationalTokensAreForwarded() throws Exception {
        script(Plan.conversational(GOAL, "Hello there."));
        List<String> tokens = new CopyOnWriteArrayList<>();

        TaskOutcome outcome = execute(TaskRequest.of("hi", List.of()), new TaskCallbacks(null, null, tokens::add));

        assertEquals(List.of("Hello there."), tokens);
        assertEquals("Hello there.", outcome.finalOutput());
        assertEquals("Hello there.", outcome.plan().conversationalResponse());
    }

    @Test
    void testApprovalTimesOut() throws Exception {
        properties.setApprovalTimeout(Duration.ofMillis(100));
        script(plan(step("w1", "write_file", Map.of("path", "a.md"))));

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of()), TaskCallbacks.none());

        Step timedOut = outcome.plan().steps().get(0);
        assertEquals(StepStatus.FAILED, timedOut.getStatus());
        assertEquals(FailureKind.DENIED, timedOut.getFailureKind());
        assertEquals(AgentConstants.APPROVAL_TIMED_OUT, timedOut.getError());
        assertTrue(toolCalls.isEmpty());
    }

    @Test
    void testDecisionThroughRunHandleIsIdempotent() throws Exception {
        script(plan(step("w1", "write_file", Map.of("path", "a.md"))));
        CountDownLatch waiting = new CountDownLatch(1);

        AgentRun run = orchestrator.start(TaskRequest.of(GOAL, List.of()), new TaskCallbacks(null, step -> {
            waiting.countDown();
            return null;
        }, null));
        assertTrue(waiting.await(5, TimeUnit.SECONDS));

        assertFalse(run.submitDecision("unknown", true));
        assertTrue(run.submitDecision("w1", true));
        assertFalse(run.submitDecision("w1", false));

        TaskOutcome outcome = await(run);
        assertEquals(StepStatus.COMPLETED, outcome.plan().steps().get(0).getStatus());
        assertEquals(List.of("write_file"), toolCalls);
    }

    @Test
    void testCancelDuringApproval() throws Exception {
        script(plan(step("w1", "write_file", Map.of("path", "a.md")), step("l1", "list_directory", Map.of())));
        CountDownLatch waiting = new CountDownLatch(1);

        AgentRun run = orchestrator.start(TaskRequest.of(GOAL, List.of()), new TaskCallbacks(null, step -> {
            waiting.countDown();
            return null;
        }, null));
        assertTrue(waiting.await(5, TimeUnit.SECONDS));
        run.cancel();

        TaskOutcome outcome = await(run);
        assertFalse(outcome.success());
        assertEquals(AgentConstants.TASK_CANCELLED, outcome.finalOutput());
        Step cancelled = outcome.plan().steps().get(0);
        assertEquals(FailureKind.CANCELLED, cancelled.getFailureKind());
        assertEquals(AgentConstants.CANCELLED, cancelled.getError());
        assertEquals(StepStatus.PENDING, outcome.plan().steps().get(1).getStatus());
        assertTrue(toolCalls.isEmpty());
        assertEquals(1, planRequests.size());
    }

    @Test
    void testMissingAndDuplicateIdsAreReplaced() throws Exception {
        script(plan(step("a", "list_directory", Map.of()),
                step("a", "list_directory", Map.of()),
                step(null, "list_directory", Map.of())),
                plan(step("a", "list_directory", Map.of())));

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of()), TaskCallbacks.none());

        List<String> ids = outcome.plan().steps().stream().map(Step::getId).toList();
        assertEquals(List.of("a", "step-1-2", "step-1-3", "step-2-1"), ids);
    }

    @Test
    void testFailingListenersDoNotStopTheRun() throws Exception {
        script(plan(step("l1", "list_directory", Map.of())));

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of()), new TaskCallbacks(
                snapshot -> {
                    throw new IllegalStateException("listener down");
                },
                null,
                token -> {
                    throw new IllegalStateException("socket closed");
                }));

        assertTrue(outcome.success());
        assertEquals(1, outcome.stepsCompleted());
    }

    @Test
    void testFailingApprovalCallbackCountsAsDenial() throws Exception {
        script(plan(step("w1", "write_file", Map.of("path", "a.md"))));

        TaskOutcome outcome = execute(TaskRequest.of(GOAL, List.of()), new TaskCallbacks(null, step -> {
            throw new IllegalStateException("no reviewer");
        }, null));

        Step denied = outcome.plan().steps().get(0);
        assertEquals(FailureKind.DENIED, denied.getFailureKind());
        assertTrue(toolCalls.isEmpty());
    }

    @Test
    void testProgressSnapshotsAreCopies() throws Exception {
        script(plan(step("l1", "list_directory", Map.of())));
        List<Plan> snapshots = new ArrayList<>();

        execute(TaskRequest.of(GOAL, List.of()), new TaskCallbacks(snapshot -> {
            synchronized (snapshots) {
                snapshots.add(snapshot);
            }
        }, null, null));

        synchronized (snapshots) {
            assertEquals(StepStatus.PENDING, snapshots.get(0).steps().get(0).getStatus());
            assertEquals(StepStatus.COMPLETED, snapshots.get(snapshots.size() - 1).steps().get(0).getStatus());
        }
    }
}
