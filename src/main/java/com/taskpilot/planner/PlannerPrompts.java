package com.taskpilot.planner;

public final class PlannerPrompts {

    private PlannerPrompts() {
    }

    public static final int MAX_RESULT_CHARS = 1500;

    public static final String SYSTEM_PROMPT = """
            You are an autonomous software agent working inside a project workspace.
            You reach the user's goal by calling tools. Only the tools listed below exist for this task.

            %s

            When tools are needed, briefly say what you are about to do, then reply with a single JSON object:
            {
              "goal": "<the goal in your own words>",
              "steps": [
                {
                  "id": "step-1",
                  "description": "<what this step does>",
                  "tool": "<tool name>",
                  "parameters": { "<name>": <value> }
                }
              ]
            }

            Rules:
            - Use only the tools listed above, with exactly the parameters they declare.
            - Paths are relative to the project root.
            - Steps run in order. You will see their results before planning the next round.
            - When the goal is complete, or no tool is needed, answer in plain text without any JSON.
            """;

    public static final String NO_TOOLS_AVAILABLE = "No tools are available for this task. Answer in plain text.";

    public static final String GOAL_TEMPLATE = "Goal: %s";

    public static final String HISTORY_HEADER = "Steps executed so far:";

    public static final String CONTINUE_INSTRUCTION = """
            Plan the next steps if more work is needed. If the goal has been reached, \
            answer the user in plain text summarising what was done.""";
}
