package com.locai.workflow.service;

public final class WorkflowConstants {

    private WorkflowConstants() {
    }

    // LLM Request Purposes
    public static final String PURPOSE_PLAN = "plan";
    public static final String PURPOSE_PLAN_ADJUSTMENT = "plan-adjustment";
    public static final String PURPOSE_STEP = "step";
    public static final String PURPOSE_REFLECTION = "reflection";
    public static final String PURPOSE_FINAL_ANSWER = "final-answer";

    // Step defaults
    public static final String STEP_PREFIX = "step-";
    public static final String DEFAULT_SUCCESS_CRITERIA = "The step's goal is achieved.";
    public static final String IMPLICIT_STEP_ID = "step-1";
    public static final int MAX_RESULT_SNIPPET = 200;
    public static final int MAX_FINAL_ANSWER_SNIPPET = 500;

    public static final String DEFAULT_AGENT_PROMPT = """
            You are a capable local assistant that completes tasks step by step using tools.
            Call a tool whenever it gets you closer to the goal; do not invent tool results.
            When a step is finished, answer with a short plain-text summary of what was done.

            Available tools: %s
            """;

    public static final String PLANNING_PROMPT = """
            You are a precise planner. Produce a structured execution plan as JSON.
            Respond ONLY with valid JSON, no markdown fences, no explanations.

            JSON format:
            {
              "goal": "The goal to achieve in one sentence",
              "steps": [
                {
                  "id": "step-1",
                  "description": "What is done in this step",
                  "expectedTools": ["tool_name"],
                  "dependsOn": [],
                  "successCriteria": "How to tell this step succeeded"
                }
              ],
              "maxSteps": %d
            }

            Rules:
            - At most %d steps, no redundancy
            - expectedTools only from the available tools
            - dependsOn: ids of steps that must finish first (empty when none)
            - No "summarize" or "write the answer" step, that happens automatically
            - If the task needs no tools at all, return an empty steps array

            Available tools: %s

            Task: %s
            """;

    public static final String PLAN_ADJUSTMENT_PROMPT = """
            You are a precise planner revising a plan that is already being executed.
            Respond ONLY with valid JSON in the same format as before:
            {"goal": "...", "steps": [{"id": "...", "description": "...", "expectedTools": [], "dependsOn": [], "successCriteria": "..."}], "maxSteps": %d}

            Only list the steps that still have to run, at most %d. Completed steps are kept as they are.

            Original task: %s
            Current goal: %s

            Completed steps:
            %s

            Steps that were still planned:
            %s

            Reason for the adjustment: %s

            Available tools: %s
            """;

    public static final String STEP_PROMPT = """
            Overall goal: %s

            Current step (%d of %d): %s
            Success criteria: %s
            Suggested tools: %s

            Results of earlier steps:
            %s

            Carry out this step now. Use tools as needed, then reply with a short summary of the outcome.
            """;

    public static final String REFLECTION_PROMPT = """
            Step "%s" was executed.
            Success criteria: %s
            Step status: %s

            Tool results:
            %s

            Step output:
            %s

            Remaining planned steps:
            %s

            Assess the outcome as JSON (ONLY JSON, no markdown):
            {
              "assessment": "success|partial|failure",
              "nextAction": "continue|adjust_plan|complete|abort",
              "comment": "Short explanation, one sentence",
              "planAdjustment": {"reason": "why the plan must change"},
              "abortReason": null
            }

            Choose "complete" ONLY when the goal is already fully achieved.
            Choose "adjust_plan" when the remaining plan no longer fits (rare).
            Choose "continue" to move on to the next planned step.
            Choose "abort" only for an unrecoverable error.
            """;

    public static final String FINAL_ANSWER_PROMPT = """
            Task: %s

            Results of the executed steps:
            %s

            Write the final answer for the user based on these results.
            Answer directly and completely; do not mention the internal steps or tools unless they matter to the user.
            """;

    public static final String TOOL_RESULT_TEXT_TEMPLATE = """
            Result of tool %s (%s):
            %s
            """;
}
