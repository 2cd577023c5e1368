package com.example.quorum.agent;

/**
 * Closed set of agent specializations. A role only changes the system prompt and the framing
 * of the task; adding a role never touches the orchestrator.
 */
public enum AgentRole {

    ANALYST(
        "You are an analyst. Break down problems, identify requirements, and provide clear analysis. "
            + "Be thorough but concise.",
        "Analyze this task and identify key requirements:\n"),

    CODER(
        "You are an expert programmer. Write clean, efficient code with proper error handling. "
            + "Use best practices.",
        "Implement the following:\n"),

    REVIEWER(
        "You are a code reviewer. Check for bugs, security issues, performance problems, and style. "
            + "Be constructive.",
        "Review the following:\n"),

    PLANNER(
        "You are a project planner. Create actionable plans with clear steps and dependencies.",
        "Create an execution plan for:\n"),

    EXECUTOR(
        "You are a precise executor. Carry out the task exactly as described and report only the result.",
        "");

    private final String systemPrompt;
    private final String taskPrefix;

    AgentRole(String systemPrompt, String taskPrefix) {
        this.systemPrompt = systemPrompt;
        this.taskPrefix = taskPrefix;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public String frame(String taskPrompt) {
        return taskPrefix + taskPrompt;
    }
}
