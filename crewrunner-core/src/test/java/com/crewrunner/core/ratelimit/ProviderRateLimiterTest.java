package com.crewrunner.core.ratelimit;

import com.crewrunner.core.test.TimeController;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ProviderRateLimiterTest {

    @Test
    void providerDefaults_shouldMatchPublishedLimits() {
        assertEquals(40_000, ProviderTokenLimit.ANTHROPIC_INPUT.defaultTokensPerMinute());
        assertEquals(10_000, ProviderTokenLimit.ANTHROPIC_INPUT.tokensPerRequest());
        assertEquals(8_000, ProviderTokenLimit.ANTHROPIC_OUTPUT.defaultTokensPerMinute());
        assertEquals(60_000, ProviderTokenLimit.GOOGLE_INPUT.defaultTokensPerMinute());
        assertEquals(12_000, ProviderTokenLimit.GOOGLE_OUTPUT.defaultTokensPerMinute());
        assertEquals("google-output", ProviderTokenLimit.GOOGLE_OUTPUT.bucketKey());
    }

    @Test
    void effectiveTokensPerMinute_withoutQuota_shouldUseDefault() {
        assertEquals(40_000, ProviderTokenLimit.ANTHROPIC_INPUT.effectiveTokensPerMinute(null));
        assertEquals(40_000, ProviderTokenLimit.ANTHROPIC_INPUT.effectiveTokensPerMinute(0));
        assertEquals(40_000, ProviderTokenLimit.ANTHROPIC_INPUT.effectiveTokensPerMinute(-5));
    }

    @Test
    void effectiveTokensPerMinute_shouldNeverExceedDefault() {
        // 2 requests * 10 000 tokens is below the ceiling
        assertEquals(20_000, ProviderTokenLimit.ANTHROPIC_INPUT.effectiveTokensPerMinute(2));
        // 100 requests * 6 000 tokens is above it
        assertEquals(60_000, ProviderTokenLimit.GOOGLE_INPUT.effectiveTokensPerMinute(100));
        assertEquals(60_000, ProviderTokenLimit.GOOGLE_INPUT.effectiveTokensPerMinute(Integer.MAX_VALUE));
    }

    @Test
    void consume_shouldUseProviderBucketAtEffectiveRate() {
        TimeController time = new TimeController();
        TokenBucketManager manager = new TokenBucketManager(time, time::advance);
        ProviderRateLimiter limiter = new ProviderRateLimiter(manager);

        assertTrue(limiter.consume(ProviderTokenLimit.ANTHROPIC_OUTPUT, 1_500, 2, false));

        TokenBucket bucket = manager.findBucket("anthropic-output").orElseThrow();
        assertThat(bucket.getTokensPerMinute()).isEqualTo(4_000.0);
        assertThat(bucket.availableTokens()).isEqualTo(2_500.0);
        assertFalse(limiter.consume(ProviderTokenLimit.ANTHROPIC_OUTPUT, 3_000, 2, false));
    }

    @Test
    void consume_shouldKeepProvidersIndependent() {
        TimeController time = new TimeController();
        TokenBucketManager manager = new TokenBucketManager(time, time::advance);
        ProviderRateLimiter limiter = new ProviderRateLimiter(manager);

        assertTrue(limiter.consume(ProviderTokenLimit.GOOGLE_OUTPUT, 12_000));
        assertTrue(limiter.consume(ProviderTokenLimit.GOOGLE_INPUT, 12_000));

        assertThat(manager.bucketKeys()).containsExactlyInAnyOrder("google-output", "google-input");
        assertThat(limiter.getBucketManager()).isSameAs(manager);
    }
}
