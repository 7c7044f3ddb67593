package com.voiceflow.infrastructure.ai;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LlmUsageTrackerTest {

    private final LlmUsageTracker tracker = new LlmUsageTracker();

    @Test
    @DisplayName("无请求时命中率为 0")
    void 无请求() {
        assertThat(tracker.getTotalRequests()).isZero();
        assertThat(tracker.getCacheHitRate()).isZero();
    }

    @Test
    @DisplayName("只有带缓存 token 的请求计入命中")
    void 缓存命中率() {
        tracker.recordUsage(1200, 80, 1024);
        tracker.recordUsage(300, 40, 0);
        tracker.recordUsage(900, 60, 0);
        tracker.recordUsage(1100, 90, 512);

        assertThat(tracker.getTotalRequests()).isEqualTo(4);
        assertThat(tracker.getCacheHitRate()).isCloseTo(50.0, within(1e-9));
    }
}
