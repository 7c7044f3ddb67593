package com.voiceflow.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class LlmUsageTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong cacheHitRequests = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();

    public void recordUsage(long promptTokens, long completionTokens, long cachedTokens) {
        totalRequests.incrementAndGet();
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);

        if (cachedTokens > 0) {
            cacheHitRequests.incrementAndGet();
        }

        log.debug("LLM usage - request #{}: promptTokens={}, completionTokens={}, cachedTokens={}, " +
                        "cumulative: promptTokens={}, completionTokens={}, cacheHitRate={}%",
                totalRequests.get(), promptTokens, completionTokens, cachedTokens,
                totalPromptTokens.get(), totalCompletionTokens.get(), String.format("%.1f", getCacheHitRate()));
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public double getCacheHitRate() {
        long total = totalRequests.get();
        return total > 0 ? (double) cacheHitRequests.get() / total * 100 : 0;
    }
}
