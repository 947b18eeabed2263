package com.crewrunner.core.ratelimit;

/**
 * Default token-per-minute ceilings for LLM providers, split by direction.
 *
 * <p>Each limit also carries the average number of tokens a single request is
 * expected to use, so a requests-per-minute quota can be translated into a
 * token rate.</p>
 */
public enum ProviderTokenLimit {

    ANTHROPIC_INPUT("anthropic-input", 40_000, 10_000),
    ANTHROPIC_OUTPUT("anthropic-output", 8_000, 2_000),
    GOOGLE_INPUT("google-input", 60_000, 6_000),
    GOOGLE_OUTPUT("google-output", 12_000, 2_000);

    private final String bucketKey;
    private final int defaultTokensPerMinute;
    private final int tokensPerRequest;

    ProviderTokenLimit(String bucketKey, int defaultTokensPerMinute, int tokensPerRequest) {
        this.bucketKey = bucketKey;
        this.defaultTokensPerMinute = defaultTokensPerMinute;
        this.tokensPerRequest = tokensPerRequest;
    }

    public String bucketKey() {
        return bucketKey;
    }

    public int defaultTokensPerMinute() {
        return defaultTokensPerMinute;
    }

    public int tokensPerRequest() {
        return tokensPerRequest;
    }

    /**
     * Token rate implied by a requests-per-minute quota, never above the default ceiling.
     * A missing or non-positive quota yields the default.
     */
    public int effectiveTokensPerMinute(Integer requestsPerMinute) {
        if (requestsPerMinute == null || requestsPerMinute <= 0) {
            return defaultTokensPerMinute;
        }
        long derived = (long) requestsPerMinute * tokensPerRequest;
        return (int) Math.min(derived, defaultTokensPerMinute);
    }
}
