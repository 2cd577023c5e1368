package com.example.quorum.agent;

/**
 * Text generation collaborator behind role agents.
 */
public interface LanguageModel {

    /**
     * Generates a completion.
     *
     * @param systemPrompt Role instructions, may be empty
     * @param prompt The user prompt
     * @return The generated text
     * @throws AgentUnavailableException on transport or model errors
     * @throws AgentTimeoutException if the model does not answer in time
     */
    String generate(String systemPrompt, String prompt);
}
