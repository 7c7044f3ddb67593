package com.voiceflow.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * OpenAI chat-completions wrapper. Requests JSON object output, since every caller in the
 * pipeline expects a structured JSON reply.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiLanguageModelClient implements LanguageModelClient {

    private final OpenAIClient openAIClient;
    private final LlmUsageTracker usageTracker;

    @Value("${openai.model}")
    private String model;

    @Value("${openai.temperature}")
    private double temperature;

    @Value("${openai.max-tokens}")
    private int maxTokens;

    @Override
    public String complete(String systemPrompt, String userMessage) {
        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(systemPrompt)
                    .addUserMessage(userMessage)
                    .responseFormat(ResponseFormatJsonObject.builder().build())
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            if (completion.usage().isPresent()) {
                var usage = completion.usage().get();
                long cachedTokens = usage.promptTokensDetails()
                        .map(d -> d.cachedTokens().orElse(0L))
                        .orElse(0L);
                usageTracker.recordUsage(usage.promptTokens(), usage.completionTokens(), cachedTokens);
            }

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new LanguageModelException("OpenAI response has no content"));

            return content.trim();
        } catch (LanguageModelException e) {
            throw e;
        } catch (Exception e) {
            log.error("OpenAI API call failed [{}]", model, e);
            throw new LanguageModelException("Language model call failed", e);
        }
    }
}
