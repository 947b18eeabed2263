package com.crewrunner.core.ratelimit;

import com.crewrunner.core.exception.TokenRequestExceedsCapacityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket limiting throughput of one named resource to a tokens-per-minute rate.
 *
 * Invariants:
 * - capacity is fixed at creation
 * - 0 <= tokens <= capacity at all times
 * - a successful consume removes exactly the requested amount, never part of it
 *
 * <p>Refill and consumption happen atomically under the bucket's own lock. A
 * waiting consumer sleeps without holding the lock and retries afterwards.</p>
 */
public class TokenBucket {

    private static final Logger log = LoggerFactory.getLogger(TokenBucket.class);

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    /**
     * Blocking pause used while waiting for tokens. Replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEPER = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

    private final String name;
    private final double capacity;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private double tokensPerMinute;
    private double refillRate;
    private double tokens;
    private Instant lastRefill;

    /**
     * Create a full bucket whose capacity equals its per-minute rate.
     */
    public TokenBucket(String name, double tokensPerMinute) {
        this(name, tokensPerMinute, tokensPerMinute, tokensPerMinute, Clock.systemUTC(), THREAD_SLEEPER);
    }

    public TokenBucket(String name, double tokensPerMinute, double capacity, double initialTokens,
                       Clock clock, Sleeper sleeper) {
        if (tokensPerMinute <= 0) {
            throw new IllegalArgumentException("tokensPerMinute must be > 0");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        if (initialTokens < 0 || initialTokens > capacity) {
            throw new IllegalArgumentException("initialTokens must be within [0, capacity]");
        }
        this.name = name;
        this.capacity = capacity;
        this.clock = clock;
        this.sleeper = sleeper;
        this.tokensPerMinute = tokensPerMinute;
        this.refillRate = tokensPerMinute / 60.0;
        this.tokens = initialTokens;
        this.lastRefill = clock.instant();
    }

    /**
     * Take {@code amount} tokens from the bucket.
     *
     * @param amount tokens to take; zero always succeeds
     * @param wait   if true, sleep until enough tokens have been refilled
     * @return true if the tokens were taken; false if {@code wait} is false and the
     *         bucket is short, or if the waiting thread was interrupted
     * @throws TokenRequestExceedsCapacityException if {@code amount} exceeds the capacity
     */
    public boolean consume(double amount, boolean wait) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
        if (amount > capacity) {
            throw new TokenRequestExceedsCapacityException(amount, capacity);
        }

        while (true) {
            Duration pause;
            lock.lock();
            try {
                refill();
                if (tokens >= amount) {
                    tokens -= amount;
                    return true;
                }
                if (!wait) {
                    return false;
                }
                pause = toDuration((amount - tokens) / refillRate);
            } finally {
                lock.unlock();
            }

            log.debug("Bucket '{}' short of {} tokens, waiting {} ms", name, amount, pause.toMillis());
            try {
                sleeper.sleep(pause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} tokens on bucket '{}'", amount, name);
                return false;
            }
        }
    }

    /**
     * Take tokens, waiting as long as needed.
     */
    public boolean consume(double amount) {
        return consume(amount, true);
    }

    /**
     * Change the refill rate. Tokens accrued so far are credited at the old rate first.
     * Capacity is not affected.
     */
    public void updateRate(double newTokensPerMinute) {
        if (newTokensPerMinute <= 0) {
            throw new IllegalArgumentException("tokensPerMinute must be > 0");
        }
        lock.lock();
        try {
            refill();
            log.info("Bucket '{}' rate changed from {} to {} tokens/min",
                name, tokensPerMinute, newTokensPerMinute);
            this.tokensPerMinute = newTokensPerMinute;
            this.refillRate = newTokensPerMinute / 60.0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the current fill level, after refilling.
     */
    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public double getCapacity() {
        return capacity;
    }

    public double getTokensPerMinute() {
        lock.lock();
        try {
            return tokensPerMinute;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tokens added per second.
     */
    public double getRefillRate() {
        lock.lock();
        try {
            return refillRate;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds lock
    private void refill() {
        Instant now = clock.instant();
        long elapsedNanos = Duration.between(lastRefill, now).toNanos();
        if (elapsedNanos <= 0) {
            // Clock stood still or stepped backwards; keep the later timestamp
            return;
        }
        tokens = Math.min(capacity, tokens + (elapsedNanos / NANOS_PER_SECOND) * refillRate);
        lastRefill = now;
    }

    private static Duration toDuration(double seconds) {
        long nanos = (long) Math.ceil(seconds * NANOS_PER_SECOND);
        return Duration.ofNanos(Math.max(1, nanos));
    }
}
