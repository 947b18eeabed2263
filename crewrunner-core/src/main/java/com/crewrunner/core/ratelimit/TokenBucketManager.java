package com.crewrunner.core.ratelimit;

import com.crewrunner.core.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of named token buckets, created lazily on first use.
 *
 * <p>Creation is serialized by a manager-level lock so two threads never create
 * competing buckets for one key. Lookups of existing buckets and consumption
 * take no manager lock; they only contend on the bucket itself.</p>
 *
 * <p>The rate passed with the first request for a key is fixed for that bucket.
 * Later requests with a different rate are ignored; use {@link #updateRate}
 * to change it explicitly.</p>
 */
public class TokenBucketManager {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketManager.class);

    private final ConcurrentMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final Object creationLock = new Object();
    private final Clock clock;
    private final TokenBucket.Sleeper sleeper;

    public TokenBucketManager() {
        this(Clock.systemUTC(), TokenBucket.THREAD_SLEEPER);
    }

    public TokenBucketManager(Clock clock, TokenBucket.Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Get the bucket for {@code key}, creating a full one at {@code tokensPerMinute} if absent.
     */
    public TokenBucket getBucket(String key, double tokensPerMinute) {
        TokenBucket bucket = buckets.get(key);
        if (bucket == null) {
            synchronized (creationLock) {
                bucket = buckets.get(key);
                if (bucket == null) {
                    bucket = new TokenBucket(key, tokensPerMinute, tokensPerMinute, tokensPerMinute, clock, sleeper);
                    buckets.put(key, bucket);
                    log.info("Created token bucket '{}' at {} tokens/min", key, tokensPerMinute);
                    return bucket;
                }
            }
        }
        if (bucket.getTokensPerMinute() != tokensPerMinute) {
            log.debug("Ignoring rate {} for bucket '{}', keeping {} tokens/min",
                tokensPerMinute, key, bucket.getTokensPerMinute());
        }
        return bucket;
    }

    /**
     * Take tokens from the bucket for {@code key}, creating it if needed.
     *
     * @see TokenBucket#consume(double, boolean)
     */
    public boolean consumeTokens(String key, double amount, double tokensPerMinute, boolean wait) {
        return getBucket(key, tokensPerMinute).consume(amount, wait);
    }

    public boolean consumeTokens(String key, double amount, double tokensPerMinute) {
        return consumeTokens(key, amount, tokensPerMinute, true);
    }

    /**
     * Change the rate of an existing bucket.
     *
     * @throws NotFoundException if no bucket exists for {@code key}
     */
    public void updateRate(String key, double tokensPerMinute) {
        TokenBucket bucket = buckets.get(key);
        if (bucket == null) {
            throw new NotFoundException("TokenBucket", key);
        }
        bucket.updateRate(tokensPerMinute);
    }

    public Optional<TokenBucket> findBucket(String key) {
        return Optional.ofNullable(buckets.get(key));
    }

    public Set<String> bucketKeys() {
        return Set.copyOf(buckets.keySet());
    }
}
