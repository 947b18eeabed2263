package com.crewrunner.core.ratelimit;

/**
 * Throttles provider calls through the shared {@link TokenBucketManager}.
 * Call immediately before issuing a provider request with an estimate of its token count.
 */
public class ProviderRateLimiter {

    private final TokenBucketManager bucketManager;

    public ProviderRateLimiter(TokenBucketManager bucketManager) {
        this.bucketManager = bucketManager;
    }

    /**
     * Take {@code tokens} from the provider's bucket.
     *
     * @param requestsPerMinute optional request quota; narrows the rate of a bucket
     *                          that does not exist yet
     * @return false only when {@code wait} is false and the bucket is short,
     *         or the waiting thread was interrupted
     */
    public boolean consume(ProviderTokenLimit limit, long tokens, Integer requestsPerMinute, boolean wait) {
        return bucketManager.consumeTokens(
            limit.bucketKey(),
            tokens,
            limit.effectiveTokensPerMinute(requestsPerMinute),
            wait
        );
    }

    public boolean consume(ProviderTokenLimit limit, long tokens) {
        return consume(limit, tokens, null, true);
    }

    public TokenBucketManager getBucketManager() {
        return bucketManager;
    }
}
