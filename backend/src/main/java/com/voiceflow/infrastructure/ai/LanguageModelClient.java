package com.voiceflow.infrastructure.ai;

/**
 * Role-tagged prompt pair in, free-form reply text out.
 */
public interface LanguageModelClient {

    /**
     * @param systemPrompt system instructions
     * @param userMessage  user context
     * @return the model's reply text
     * @throws LanguageModelException when the call fails or the reply is empty
     */
    String complete(String systemPrompt, String userMessage);
}
