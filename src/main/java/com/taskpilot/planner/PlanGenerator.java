package com.taskpilot.planner;

import com.taskpilot.agent.Plan;

import java.util.function.Consumer;

/**
 * Asks a language model for the next round of work.
 */
public interface PlanGenerator {

    /**
     * Produces either a non-empty list of pending steps or a conversational answer.
     * Narration is forwarded to {@code onToken} in generation order while the model is still
     * responding; steps are only exposed once the whole response has been parsed.
     *
     * @throws PlannerException when the model cannot be reached or its output cannot be used
     */
    Plan generate(PlanRequest request, Consumer<String> onToken) throws PlannerException;
}
